package com.phillippitts.modelrelay.service.provider;

import com.phillippitts.modelrelay.domain.AnalysisResponse;
import com.phillippitts.modelrelay.domain.AnalysisType;
import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ChatResponse;
import com.phillippitts.modelrelay.domain.CodeContext;
import com.phillippitts.modelrelay.domain.CompletionResponse;
import com.phillippitts.modelrelay.domain.ExplanationResponse;
import com.phillippitts.modelrelay.domain.ProjectContext;
import com.phillippitts.modelrelay.domain.ProviderCapability;
import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.exception.ProviderException;
import com.phillippitts.modelrelay.exception.UnsupportedCapabilityException;

import java.util.List;

/**
 * Contract for a single LLM backend adapter.
 *
 * <p>Adapters wrap a vendor HTTP API (or a local inference service) behind a uniform,
 * blocking interface. The relay calls them from dispatch worker threads, so implementations
 * must be safe for concurrent use.
 *
 * <p>Only {@link #chatCompletion(List, String)} is mandatory. The code-oriented operations
 * default to throwing {@link UnsupportedCapabilityException}; adapters override the ones their
 * backend supports.
 *
 * <p>Errors: any {@link RuntimeException} is treated as a failed call. Its message is captured
 * in the task's error info; {@link ProviderException} and its subclasses are preferred.
 */
public interface ProviderClient {

    /**
     * Returns the backend this client talks to.
     */
    ProviderId provider();

    /**
     * Runs a chat completion over the given transcript.
     *
     * @param messages transcript, oldest first
     * @param model    model identifier understood by the backend
     * @return the generated response
     * @throws ProviderException if the backend call fails
     */
    ChatResponse chatCompletion(List<ChatMessage> messages, String model);

    default AnalysisResponse analyzeCode(String code, AnalysisType type, ProjectContext projectContext) {
        throw new UnsupportedCapabilityException(provider(), ProviderCapability.CODE_ANALYSIS);
    }

    default CompletionResponse codeCompletion(String prompt, CodeContext codeContext) {
        throw new UnsupportedCapabilityException(provider(), ProviderCapability.CODE_COMPLETION);
    }

    default ExplanationResponse explainCode(String code, CodeContext codeContext) {
        throw new UnsupportedCapabilityException(provider(), ProviderCapability.CODE_EXPLANATION);
    }

    /**
     * Cheap local readiness check (credentials present, process running).
     * Does not perform a network round trip.
     */
    default boolean isHealthy() {
        return true;
    }
}
