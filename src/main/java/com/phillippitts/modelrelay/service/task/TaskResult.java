package com.phillippitts.modelrelay.service.task;

import com.phillippitts.modelrelay.domain.AnalysisResponse;
import com.phillippitts.modelrelay.domain.ChatResponse;
import com.phillippitts.modelrelay.domain.CompletionResponse;
import com.phillippitts.modelrelay.domain.ExplanationResponse;

import java.util.Objects;

/**
 * Payload of a completed task. There is exactly one variant per {@link TaskKind}.
 */
public sealed interface TaskResult {

    TaskKind kind();

    record ChatCompletion(ChatResponse response) implements TaskResult {
        public ChatCompletion {
            Objects.requireNonNull(response, "response must not be null");
        }

        @Override
        public TaskKind kind() {
            return TaskKind.CHAT_COMPLETION;
        }
    }

    record CodeCompletion(CompletionResponse response) implements TaskResult {
        public CodeCompletion {
            Objects.requireNonNull(response, "response must not be null");
        }

        @Override
        public TaskKind kind() {
            return TaskKind.CODE_COMPLETION;
        }
    }

    record CodeAnalysis(AnalysisResponse response) implements TaskResult {
        public CodeAnalysis {
            Objects.requireNonNull(response, "response must not be null");
        }

        @Override
        public TaskKind kind() {
            return TaskKind.CODE_ANALYSIS;
        }
    }

    record CodeExplanation(ExplanationResponse response) implements TaskResult {
        public CodeExplanation {
            Objects.requireNonNull(response, "response must not be null");
        }

        @Override
        public TaskKind kind() {
            return TaskKind.CODE_EXPLANATION;
        }
    }

    record HealthCheck(boolean healthy, long responseTimeMs) implements TaskResult {
        @Override
        public TaskKind kind() {
            return TaskKind.HEALTH_CHECK;
        }
    }
}
