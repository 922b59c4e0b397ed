package com.arcdispatch.collaborators;

import com.arcdispatch.models.AnalysisConfig;
import com.arcdispatch.models.Puzzle;

/**
 * Turns a puzzle and a configuration into instruction text for a provider.
 */
public interface PromptBuilder {

    BuiltPrompt build(Puzzle puzzle, AnalysisConfig config);

    final class BuiltPrompt {
        private final String systemPrompt;
        private final String userPrompt;
        private final String templateId;

        public BuiltPrompt(String systemPrompt, String userPrompt, String templateId) {
            this.systemPrompt = systemPrompt;
            this.userPrompt = userPrompt;
            this.templateId = templateId;
        }

        public String getSystemPrompt() {
            return systemPrompt;
        }

        public String getUserPrompt() {
            return userPrompt;
        }

        /** Null for custom instructions. */
        public String getTemplateId() {
            return templateId;
        }
    }
}
