package com.phillippitts.modelrelay.service.orchestration;

import com.phillippitts.modelrelay.domain.AnalysisType;
import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ChatResponse;
import com.phillippitts.modelrelay.domain.CodeContext;
import com.phillippitts.modelrelay.domain.ProjectContext;
import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.exception.AllProvidersFailedException;
import com.phillippitts.modelrelay.exception.NoProvidersException;
import com.phillippitts.modelrelay.exception.RequestNotFoundException;
import com.phillippitts.modelrelay.exception.RequestTimeoutException;
import com.phillippitts.modelrelay.service.provider.ProviderCandidate;
import com.phillippitts.modelrelay.service.provider.ProviderClient;
import com.phillippitts.modelrelay.service.task.RequestOptions;
import com.phillippitts.modelrelay.service.task.RequestStats;
import com.phillippitts.modelrelay.service.task.RequestTask;
import com.phillippitts.modelrelay.service.task.TaskStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Submits provider requests as tracked tasks and coordinates them.
 *
 * <p>Submission never blocks on the provider call: every {@code submit*} method returns a request id
 * immediately and the call runs on a dispatch worker. Use {@link #waitForRequest(long)} or the
 * task's completion future to observe the outcome.
 *
 * <p>Provider failures never escape as exceptions from submission or waits; they end the task in
 * {@link TaskStatus#FAILED} with a description. Only {@link #raceProviders} raises when no provider succeeds.
 *
 * <p>Chat completions consult the response cache first. A hit produces an already completed task.
 *
 * <p>Passing {@code null} options applies the configured defaults.
 */
public interface RequestOrchestrator {

    default long submitChatRequest(ProviderId provider,
                                   ProviderClient client,
                                   List<ChatMessage> messages,
                                   String model,
                                   RequestOptions options) {
        return submitChatRequest(provider, client, messages, model, options, null);
    }

    /**
     * Submits a chat completion.
     *
     * @param callback optional, runs once on the thread that finishes the task
     * @return request id
     */
    long submitChatRequest(ProviderId provider,
                           ProviderClient client,
                           List<ChatMessage> messages,
                           String model,
                           RequestOptions options,
                           Consumer<RequestTask> callback);

    default long submitCodeAnalysisRequest(ProviderId provider,
                                           ProviderClient client,
                                           String code,
                                           AnalysisType analysisType,
                                           ProjectContext projectContext,
                                           RequestOptions options) {
        return submitCodeAnalysisRequest(provider, client, code, analysisType, projectContext, options, null);
    }

    long submitCodeAnalysisRequest(ProviderId provider,
                                   ProviderClient client,
                                   String code,
                                   AnalysisType analysisType,
                                   ProjectContext projectContext,
                                   RequestOptions options,
                                   Consumer<RequestTask> callback);

    long submitCodeCompletionRequest(ProviderId provider,
                                     ProviderClient client,
                                     String prompt,
                                     CodeContext codeContext,
                                     RequestOptions options);

    long submitCodeExplanationRequest(ProviderId provider,
                                      ProviderClient client,
                                      String code,
                                      CodeContext codeContext,
                                      RequestOptions options);

    /**
     * Submits a one-message {@code "ping"} chat and reports it as a health check result.
     */
    long submitHealthCheck(ProviderId provider, ProviderClient client, RequestOptions options);

    /**
     * Submits requests with at most {@code maxConcurrent} of them in flight. Blocks the calling
     * thread while waiting for concurrency permits.
     *
     * @return ids of the submitted requests, in request order; shorter than the input when
     *         fail-fast or the batch timeout stopped submission
     */
    List<Long> submitBatchRequests(List<BatchRequest> requests, BatchOptions batchOptions);

    /**
     * Blocks until the request is terminal.
     *
     * @throws RequestNotFoundException if the id is unknown
     */
    RequestTask waitForRequest(long requestId);

    /**
     * Blocks until the request is terminal or the timeout elapses.
     *
     * @throws RequestTimeoutException if the request is still running after {@code timeout}
     */
    RequestTask waitForRequest(long requestId, Duration timeout);

    /**
     * Waits for every request; results are in input order.
     */
    List<RequestTask> waitForAllRequests(List<Long> requestIds);

    /**
     * Cancels a pending or running request. The in-flight provider call, if any, is not interrupted.
     *
     * @return false if the request was already terminal
     * @throws RequestNotFoundException if the id is unknown
     */
    boolean cancelRequest(long requestId);

    /**
     * Sends the chat to every candidate and returns the first successful response; the remaining
     * requests are cancelled.
     *
     * @throws NoProvidersException        if {@code candidates} is empty
     * @throws AllProvidersFailedException if no candidate succeeded
     */
    ChatResponse raceProviders(List<ChatMessage> messages,
                               List<ProviderCandidate> candidates,
                               String model,
                               RequestOptions options);

    /**
     * Sends the chat to every candidate, waits for all of them and returns the successful
     * responses in candidate order. Failures are logged and dropped.
     *
     * @throws NoProvidersException if {@code candidates} is empty
     */
    List<ChatResponse> broadcastToProviders(List<ChatMessage> messages,
                                            List<ProviderCandidate> candidates,
                                            String model,
                                            RequestOptions options);

    /**
     * Race with high priority where both each request and the overall wait are bounded by {@code timeoutMs}.
     */
    ChatResponse parallelChatWithTimeout(List<ChatMessage> messages,
                                         List<ProviderCandidate> candidates,
                                         String model,
                                         long timeoutMs);

    /**
     * Waits for the first of the given requests to complete successfully and cancels the rest.
     *
     * @param timeoutMs overall bound on the wait, {@code <= 0} for none
     * @throws AllProvidersFailedException if none succeeded in time
     */
    RequestTask awaitFirstSuccess(List<Long> requestIds, long timeoutMs);

    Optional<RequestTask> getRequest(long requestId);

    Optional<TaskStatus> getRequestStatus(long requestId);

    int getActiveRequestCount();

    RequestStats getRequestStats();

    /**
     * Drops a request from the registry, typically after its result was consumed.
     *
     * @return true if the request was tracked
     */
    boolean removeRequest(long requestId);

    /**
     * Removes terminal requests that finished longer ago than the cleanup threshold.
     *
     * @return number of removed requests
     */
    int cleanupCompletedTasks();

    /** Cancels every request that is not yet terminal. */
    void shutdown();
}
