package com.phillippitts.modelrelay.service.orchestration;

import com.phillippitts.modelrelay.domain.AnalysisType;
import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.CodeContext;
import com.phillippitts.modelrelay.domain.ProjectContext;
import com.phillippitts.modelrelay.service.provider.ProviderCandidate;
import com.phillippitts.modelrelay.service.task.RequestOptions;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a batch submission.
 */
public sealed interface BatchRequest {

    ProviderCandidate target();

    RequestOptions options();

    record Chat(ProviderCandidate target,
                List<ChatMessage> messages,
                String model,
                RequestOptions options) implements BatchRequest {
        public Chat {
            Objects.requireNonNull(target, "target must not be null");
            messages = List.copyOf(messages);
            Objects.requireNonNull(model, "model must not be null");
        }
    }

    record CodeAnalysis(ProviderCandidate target,
                        String code,
                        AnalysisType analysisType,
                        ProjectContext projectContext,
                        RequestOptions options) implements BatchRequest {
        public CodeAnalysis {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(code, "code must not be null");
            Objects.requireNonNull(analysisType, "analysisType must not be null");
        }
    }

    record CodeCompletion(ProviderCandidate target,
                          String prompt,
                          CodeContext codeContext,
                          RequestOptions options) implements BatchRequest {
        public CodeCompletion {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(prompt, "prompt must not be null");
        }
    }

    record CodeExplanation(ProviderCandidate target,
                           String code,
                           CodeContext codeContext,
                           RequestOptions options) implements BatchRequest {
        public CodeExplanation {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(code, "code must not be null");
        }
    }
}
