package com.arcdispatch.providers;

import com.arcdispatch.models.AnalysisConfig;
import com.arcdispatch.models.ConversationTurn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything an adapter needs for one call. For a stateful continuation {@link #getTurns()}
 * holds only the new messages; otherwise it is the full conversation to send.
 */
public final class ProviderCall {

    private final String modelId;
    private final AnalysisConfig config;
    private final String instructions;
    private final List<ConversationTurn> turns;
    private final String previousHandle;
    private final int testCount;

    public ProviderCall(String modelId, AnalysisConfig config, String instructions,
                        List<ConversationTurn> turns, String previousHandle, int testCount) {
        if (turns == null || turns.isEmpty()) {
            throw new IllegalArgumentException("A provider call needs at least one message");
        }
        this.modelId = modelId;
        this.config = config != null ? config : AnalysisConfig.defaults();
        this.instructions = instructions;
        this.turns = Collections.unmodifiableList(new ArrayList<>(turns));
        this.previousHandle = previousHandle;
        this.testCount = testCount;
    }

    public String getModelId() {
        return modelId;
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    public String getInstructions() {
        return instructions;
    }

    public List<ConversationTurn> getTurns() {
        return turns;
    }

    public String getPreviousHandle() {
        return previousHandle;
    }

    public boolean isContinuation() {
        return previousHandle != null && !previousHandle.isBlank();
    }

    public int getTestCount() {
        return testCount;
    }

    /**
     * Same call continuing from a provider-held conversation.
     */
    public ProviderCall continueFrom(String handle, String message) {
        return new ProviderCall(modelId, config, instructions, List.of(ConversationTurn.user(message)), handle, testCount);
    }

    /**
     * Same call with the partial answer and a new user message appended to the conversation.
     */
    public ProviderCall appendExchange(String assistantText, String message) {
        List<ConversationTurn> next = new ArrayList<>(turns);
        next.add(ConversationTurn.assistant(assistantText));
        next.add(ConversationTurn.user(message));
        return new ProviderCall(modelId, config, instructions, next, null, testCount);
    }
}
