package com.arcdispatch.retry;

import com.arcdispatch.AppLogger;
import com.arcdispatch.models.AnalysisRequest;
import com.arcdispatch.models.ConversationTurn;
import com.arcdispatch.providers.ProviderAdapter;
import com.arcdispatch.session.ProviderSession;
import com.arcdispatch.session.RequestIndex;
import com.arcdispatch.session.SessionNotFoundException;
import com.arcdispatch.session.SessionNotReadyException;
import com.arcdispatch.session.StreamSessionManager;

import java.util.ArrayList;
import java.util.List;

/**
 * User-driven retries. Every retry is a new request and a new session; the prior session and its
 * stored result are only read.
 */
public class RetryController {

    private final StreamSessionManager sessionManager;
    private final AppLogger logger = AppLogger.get();

    public RetryController(StreamSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    /**
     * Continue the prior conversation by handle when it is still retained on a stateful provider,
     * otherwise start fresh with the original prompt, the prior answer and the new instruction.
     *
     * @return id of the new session
     * @throws SessionNotFoundException if nothing is known about {@code priorSessionId}
     * @throws SessionNotReadyException if the prior session is still running
     */
    public String retry(String priorSessionId, String extraInstruction) {
        AnalysisRequest request = plan(priorSessionId, extraInstruction);
        String sessionId = sessionManager.open(request);
        logger.info("[RetryController] Retry of " + priorSessionId + " opened " + sessionId
            + (request.hasContinuationHandle() ? " by continuation" : " as fresh session"));
        return sessionId;
    }

    /**
     * The request a retry would open, without opening it.
     */
    public AnalysisRequest plan(String priorSessionId, String extraInstruction) {
        ProviderSession prior = sessionManager.find(priorSessionId);
        String extra = extraInstruction == null || extraInstruction.isBlank() ? null : extraInstruction.trim();

        if (prior != null) {
            if (!prior.isTerminal()) {
                throw new SessionNotReadyException(priorSessionId, prior.getState());
            }
            AnalysisRequest original = prior.getRequest();
            AnalysisRequest fresh = freshRequest(priorSessionId, original, prior.getText(), extra);
            String handle = prior.getContinuationHandle();
            if (prior.isStatefulProvider() && handle != null && canContinue(original.getProviderId())) {
                return original.toFreshBuilder()
                    .continuationHandle(handle)
                    .followUpInstruction(extra)
                    .retryOf(priorSessionId)
                    .freshFallback(fresh)
                    .build();
            }
            return fresh;
        }

        RequestIndex.Entry entry = sessionManager.findRequest(priorSessionId);
        if (entry == null) {
            throw new SessionNotFoundException(priorSessionId);
        }
        return freshRequest(priorSessionId, entry.getRequest(), entry.getAnswer(), extra);
    }

    private boolean canContinue(String providerId) {
        ProviderAdapter adapter = sessionManager.getAdapters().getAdapter(providerId);
        return adapter.supportsContinuation();
    }

    /**
     * Original context replayed as turns: earlier turns, the earlier follow-up, then the prior answer.
     * A request that continued by handle sent no turns itself; its fresh fallback holds the chain.
     */
    private AnalysisRequest freshRequest(String priorSessionId, AnalysisRequest original, String priorAnswer,
                                         String extra) {
        AnalysisRequest context = original.hasContinuationHandle() && original.getFreshFallback() != null
            ? original.getFreshFallback()
            : original;
        List<ConversationTurn> turns = new ArrayList<>(context.getPriorTurns());
        String earlierFollowUp = context.getFollowUpInstruction();
        if (earlierFollowUp != null && !earlierFollowUp.isBlank()) {
            turns.add(ConversationTurn.user(earlierFollowUp));
        }
        if (priorAnswer != null && !priorAnswer.isBlank()) {
            turns.add(ConversationTurn.assistant(priorAnswer));
        }
        return original.toFreshBuilder()
            .priorTurns(turns)
            .followUpInstruction(extra)
            .retryOf(priorSessionId)
            .build();
    }
}
