package com.phillippitts.modelrelay.service.orchestration;

import com.phillippitts.modelrelay.config.properties.OrchestratorProperties;
import com.phillippitts.modelrelay.domain.AnalysisType;
import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ChatResponse;
import com.phillippitts.modelrelay.domain.CodeContext;
import com.phillippitts.modelrelay.domain.ProjectContext;
import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.exception.AllProvidersFailedException;
import com.phillippitts.modelrelay.exception.ModelRelayException;
import com.phillippitts.modelrelay.exception.NoProvidersException;
import com.phillippitts.modelrelay.exception.RequestNotFoundException;
import com.phillippitts.modelrelay.exception.RequestTimeoutException;
import com.phillippitts.modelrelay.service.cache.NoOpResponseCache;
import com.phillippitts.modelrelay.service.cache.ResponseCache;
import com.phillippitts.modelrelay.service.dispatch.DispatchWorker;
import com.phillippitts.modelrelay.service.dispatch.ProviderCall;
import com.phillippitts.modelrelay.service.dispatch.TaskTimeoutEnforcer;
import com.phillippitts.modelrelay.service.dispatch.event.TaskCompletedEvent;
import com.phillippitts.modelrelay.service.metrics.DispatchMetrics;
import com.phillippitts.modelrelay.service.provider.ProviderCandidate;
import com.phillippitts.modelrelay.service.provider.ProviderClient;
import com.phillippitts.modelrelay.service.task.RequestOptions;
import com.phillippitts.modelrelay.service.task.RequestPriority;
import com.phillippitts.modelrelay.service.task.RequestStats;
import com.phillippitts.modelrelay.service.task.RequestTask;
import com.phillippitts.modelrelay.service.task.TaskKind;
import com.phillippitts.modelrelay.service.task.TaskRegistry;
import com.phillippitts.modelrelay.service.task.TaskResult;
import com.phillippitts.modelrelay.service.task.TaskStatus;
import com.phillippitts.modelrelay.util.LogSanitizer;
import com.phillippitts.modelrelay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link RequestOrchestrator} over a {@link TaskRegistry}, a {@link DispatchWorker} and a
 * {@link ResponseCache}.
 *
 * <p>Every task gets a completion hook that publishes a {@link TaskCompletedEvent} and records
 * metrics. Successful chat completions that did not come from the cache are stored in it.
 *
 * <p>Construct through {@link RequestOrchestratorBuilder}.
 */
public class DefaultRequestOrchestrator implements RequestOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultRequestOrchestrator.class);

    static final String HEALTH_CHECK_MODEL = "health-check";

    private final TaskRegistry registry;
    private final DispatchWorker worker;
    private final ResponseCache cache;
    private final TaskTimeoutEnforcer timeoutEnforcer;
    private final ApplicationEventPublisher publisher;
    private final DispatchMetrics metrics;
    private final OrchestratorProperties properties;
    private final Clock clock;
    private final boolean cacheEnabled;

    DefaultRequestOrchestrator(TaskRegistry registry,
                               DispatchWorker worker,
                               ResponseCache cache,
                               TaskTimeoutEnforcer timeoutEnforcer,
                               ApplicationEventPublisher publisher,
                               DispatchMetrics metrics,
                               OrchestratorProperties properties,
                               Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.worker = Objects.requireNonNull(worker, "worker");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.timeoutEnforcer = Objects.requireNonNull(timeoutEnforcer, "timeoutEnforcer");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cacheEnabled = !(cache instanceof NoOpResponseCache);
    }

    @Override
    public long submitChatRequest(ProviderId provider,
                                  ProviderClient client,
                                  List<ChatMessage> messages,
                                  String model,
                                  RequestOptions options,
                                  Consumer<RequestTask> callback) {
        return submitChat(provider, client, messages, model, options, callback, null);
    }

    private long submitChat(ProviderId provider,
                            ProviderClient client,
                            List<ChatMessage> messages,
                            String model,
                            RequestOptions options,
                            Consumer<RequestTask> callback,
                            Runnable onCallFinished) {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(model, "model");
        List<ChatMessage> transcript = List.copyOf(messages);

        Optional<ChatResponse> cached = cache.get(transcript, model);
        if (cached.isPresent()) {
            if (cacheEnabled) {
                metrics.incrementCacheHit();
            }
            RequestTask task = track(TaskKind.CHAT_COMPLETION, provider, options, callback, null);
            LOG.debug("Task {} answered from cache for model {}", task.getId(), model);
            task.markInProgress();
            task.completeFromCache(new TaskResult.ChatCompletion(cached.get()));
            if (onCallFinished != null) {
                onCallFinished.run();
            }
            return task.getId();
        }
        if (cacheEnabled) {
            metrics.incrementCacheMiss();
        }

        Consumer<RequestTask> cacheStore = cacheEnabled ? done -> storeInCache(done, transcript, model) : null;
        RequestTask task = track(TaskKind.CHAT_COMPLETION, provider, options, callback, cacheStore);
        LOG.debug("Submitting chat task {} to {} (model={}, messages={}, last={})",
                task.getId(), provider.displayName(), model, transcript.size(),
                transcript.isEmpty() ? "" : LogSanitizer.describeLength(transcript.get(transcript.size() - 1).content()));
        return launch(task, () -> new TaskResult.ChatCompletion(client.chatCompletion(transcript, model)),
                onCallFinished);
    }

    @Override
    public long submitCodeAnalysisRequest(ProviderId provider,
                                          ProviderClient client,
                                          String code,
                                          AnalysisType analysisType,
                                          ProjectContext projectContext,
                                          RequestOptions options,
                                          Consumer<RequestTask> callback) {
        return submitCodeAnalysis(provider, client, code, analysisType, projectContext, options, callback, null);
    }

    private long submitCodeAnalysis(ProviderId provider,
                                    ProviderClient client,
                                    String code,
                                    AnalysisType analysisType,
                                    ProjectContext projectContext,
                                    RequestOptions options,
                                    Consumer<RequestTask> callback,
                                    Runnable onCallFinished) {
        Objects.requireNonNull(client, "client");
        RequestTask task = track(TaskKind.CODE_ANALYSIS, provider, options, callback, null);
        return launch(task, () -> new TaskResult.CodeAnalysis(
                client.analyzeCode(code, analysisType, projectContext)), onCallFinished);
    }

    @Override
    public long submitCodeCompletionRequest(ProviderId provider,
                                            ProviderClient client,
                                            String prompt,
                                            CodeContext codeContext,
                                            RequestOptions options) {
        return submitCodeCompletion(provider, client, prompt, codeContext, options, null, null);
    }

    private long submitCodeCompletion(ProviderId provider,
                                      ProviderClient client,
                                      String prompt,
                                      CodeContext codeContext,
                                      RequestOptions options,
                                      Consumer<RequestTask> callback,
                                      Runnable onCallFinished) {
        Objects.requireNonNull(client, "client");
        RequestTask task = track(TaskKind.CODE_COMPLETION, provider, options, callback, null);
        return launch(task, () -> new TaskResult.CodeCompletion(client.codeCompletion(prompt, codeContext)),
                onCallFinished);
    }

    @Override
    public long submitCodeExplanationRequest(ProviderId provider,
                                             ProviderClient client,
                                             String code,
                                             CodeContext codeContext,
                                             RequestOptions options) {
        return submitCodeExplanation(provider, client, code, codeContext, options, null, null);
    }

    private long submitCodeExplanation(ProviderId provider,
                                       ProviderClient client,
                                       String code,
                                       CodeContext codeContext,
                                       RequestOptions options,
                                       Consumer<RequestTask> callback,
                                       Runnable onCallFinished) {
        Objects.requireNonNull(client, "client");
        RequestTask task = track(TaskKind.CODE_EXPLANATION, provider, options, callback, null);
        return launch(task, () -> new TaskResult.CodeExplanation(client.explainCode(code, codeContext)),
                onCallFinished);
    }

    @Override
    public long submitHealthCheck(ProviderId provider, ProviderClient client, RequestOptions options) {
        Objects.requireNonNull(client, "client");
        RequestTask task = track(TaskKind.HEALTH_CHECK, provider, options, null, null);
        return launch(task, () -> {
            long start = System.nanoTime();
            client.chatCompletion(List.of(ChatMessage.user("ping")), HEALTH_CHECK_MODEL);
            return new TaskResult.HealthCheck(true, TimeUtils.elapsedMillis(start));
        });
    }

    @Override
    public List<Long> submitBatchRequests(List<BatchRequest> requests, BatchOptions batchOptions) {
        BatchOptions opts = batchOptions == null ? BatchOptions.DEFAULTS : batchOptions;
        Semaphore permits = new Semaphore(opts.maxConcurrent());
        AtomicBoolean anyFailed = new AtomicBoolean();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(opts.timeoutMs());

        List<Long> ids = new ArrayList<>();
        List<CompletableFuture<RequestTask>> completions = new ArrayList<>();
        Consumer<RequestTask> recordFailure = task -> {
            if (task.getStatus() == TaskStatus.FAILED) {
                anyFailed.set(true);
            }
        };
        // a slot frees when the provider call returns, not when the task ends by timeout or cancel
        Runnable releasePermit = permits::release;

        for (BatchRequest request : requests) {
            if (opts.failFast() && anyFailed.get()) {
                LOG.info("Batch stopped after a failure; {} of {} request(s) submitted", ids.size(), requests.size());
                break;
            }
            boolean acquired;
            try {
                acquired = permits.tryAcquire(TimeUtils.remainingNanos(deadline), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Batch submission interrupted; {} of {} request(s) submitted", ids.size(), requests.size());
                break;
            }
            if (!acquired) {
                LOG.warn("Batch timed out after {} ms waiting for a slot; {} of {} request(s) submitted",
                        opts.timeoutMs(), ids.size(), requests.size());
                break;
            }
            if (opts.failFast() && anyFailed.get()) {
                permits.release();
                LOG.info("Batch stopped after a failure; {} of {} request(s) submitted", ids.size(), requests.size());
                break;
            }
            long id;
            try {
                id = submitBatchItem(request, recordFailure, releasePermit);
            } catch (RuntimeException e) {
                permits.release();
                throw e;
            }
            ids.add(id);
            registry.get(id).ifPresent(task -> completions.add(task.completion()));
        }

        if (opts.callback() != null) {
            CompletableFuture.allOf(completions.toArray(new CompletableFuture[0]))
                    .thenRun(() -> notifyBatch(opts.callback(), completions));
        }
        return Collections.unmodifiableList(ids);
    }

    private long submitBatchItem(BatchRequest request, Consumer<RequestTask> hook, Runnable onCallFinished) {
        ProviderCandidate target = request.target();
        if (request instanceof BatchRequest.Chat chat) {
            return submitChat(target.provider(), target.client(), chat.messages(), chat.model(),
                    chat.options(), hook, onCallFinished);
        }
        if (request instanceof BatchRequest.CodeAnalysis analysis) {
            return submitCodeAnalysis(target.provider(), target.client(), analysis.code(),
                    analysis.analysisType(), analysis.projectContext(), analysis.options(), hook, onCallFinished);
        }
        if (request instanceof BatchRequest.CodeCompletion completion) {
            return submitCodeCompletion(target.provider(), target.client(), completion.prompt(),
                    completion.codeContext(), completion.options(), hook, onCallFinished);
        }
        if (request instanceof BatchRequest.CodeExplanation explanation) {
            return submitCodeExplanation(target.provider(), target.client(), explanation.code(),
                    explanation.codeContext(), explanation.options(), hook, onCallFinished);
        }
        throw new IllegalArgumentException("Unsupported batch request: " + request.getClass().getName());
    }

    private void notifyBatch(Consumer<List<RequestTask>> callback, List<CompletableFuture<RequestTask>> completions) {
        List<RequestTask> tasks = new ArrayList<>(completions.size());
        for (CompletableFuture<RequestTask> completion : completions) {
            tasks.add(completion.join());
        }
        try {
            callback.accept(tasks);
        } catch (RuntimeException e) {
            LOG.warn("Batch callback threw: {}", e.toString());
        }
    }

    @Override
    public RequestTask waitForRequest(long requestId) {
        RequestTask task = require(requestId);
        try {
            return task.completion().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelRelayException("Interrupted while waiting for request " + requestId, e);
        } catch (ExecutionException e) {
            throw new ModelRelayException("Request " + requestId + " completed abnormally", e.getCause());
        }
    }

    @Override
    public RequestTask waitForRequest(long requestId, Duration timeout) {
        RequestTask task = require(requestId);
        try {
            return task.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new RequestTimeoutException(requestId, timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelRelayException("Interrupted while waiting for request " + requestId, e);
        } catch (ExecutionException e) {
            throw new ModelRelayException("Request " + requestId + " completed abnormally", e.getCause());
        }
    }

    @Override
    public List<RequestTask> waitForAllRequests(List<Long> requestIds) {
        List<RequestTask> results = new ArrayList<>(requestIds.size());
        for (Long id : requestIds) {
            results.add(waitForRequest(id));
        }
        return results;
    }

    @Override
    public boolean cancelRequest(long requestId) {
        RequestTask task = require(requestId);
        boolean cancelled = task.cancel();
        if (!cancelled) {
            LOG.debug("Cancel ignored for task {} already {}", requestId, task.getStatus());
        }
        return cancelled;
    }

    @Override
    public ChatResponse raceProviders(List<ChatMessage> messages,
                                      List<ProviderCandidate> candidates,
                                      String model,
                                      RequestOptions options) {
        return race(messages, candidates, model, options, 0);
    }

    @Override
    public ChatResponse parallelChatWithTimeout(List<ChatMessage> messages,
                                                List<ProviderCandidate> candidates,
                                                String model,
                                                long timeoutMs) {
        RequestOptions options = RequestOptions.withTimeout(timeoutMs).withPriority(RequestPriority.HIGH);
        return race(messages, candidates, model, options, timeoutMs);
    }

    private ChatResponse race(List<ChatMessage> messages,
                              List<ProviderCandidate> candidates,
                              String model,
                              RequestOptions options,
                              long timeoutMs) {
        if (candidates == null || candidates.isEmpty()) {
            throw new NoProvidersException("race");
        }
        List<Long> ids = new ArrayList<>(candidates.size());
        for (ProviderCandidate candidate : candidates) {
            ids.add(submitChatRequest(candidate.provider(), candidate.client(), messages, model, options));
        }
        RequestTask winner = awaitFirstSuccess(ids, timeoutMs);
        LOG.info("Race won by {} (task {}) among {} provider(s)",
                winner.getProvider().displayName(), winner.getId(), candidates.size());
        return chatResponse(winner);
    }

    @Override
    public RequestTask awaitFirstSuccess(List<Long> requestIds, long timeoutMs) {
        List<RequestTask> tasks = new ArrayList<>(requestIds.size());
        for (Long id : requestIds) {
            tasks.add(require(id));
        }
        BlockingQueue<RequestTask> finished = new LinkedBlockingQueue<>();
        for (RequestTask task : tasks) {
            task.completion().thenAccept(finished::offer);
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, timeoutMs));
        int pending = tasks.size();
        try {
            while (pending > 0) {
                RequestTask done = timeoutMs > 0
                        ? finished.poll(TimeUtils.remainingNanos(deadline), TimeUnit.NANOSECONDS)
                        : finished.take();
                if (done == null) {
                    LOG.warn("No provider succeeded within {} ms", timeoutMs);
                    break;
                }
                pending--;
                if (done.getStatus() == TaskStatus.COMPLETED) {
                    cancelAllExcept(tasks, done);
                    return done;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAllExcept(tasks, null);
            throw new ModelRelayException("Interrupted while waiting for providers", e);
        }
        cancelAllExcept(tasks, null);
        throw new AllProvidersFailedException(describeFailures(tasks));
    }

    @Override
    public List<ChatResponse> broadcastToProviders(List<ChatMessage> messages,
                                                   List<ProviderCandidate> candidates,
                                                   String model,
                                                   RequestOptions options) {
        if (candidates == null || candidates.isEmpty()) {
            throw new NoProvidersException("broadcast");
        }
        List<Long> ids = new ArrayList<>(candidates.size());
        for (ProviderCandidate candidate : candidates) {
            ids.add(submitChatRequest(candidate.provider(), candidate.client(), messages, model, options));
        }
        List<ChatResponse> responses = new ArrayList<>();
        for (RequestTask task : waitForAllRequests(ids)) {
            if (task.getStatus() == TaskStatus.COMPLETED) {
                responses.add(chatResponse(task));
            } else {
                LOG.warn("Broadcast dropped {} result from {}: {}", task.getStatus(),
                        task.getProvider().displayName(), task.getErrorInfo().orElse("cancelled"));
            }
        }
        return responses;
    }

    @Override
    public Optional<RequestTask> getRequest(long requestId) {
        return registry.get(requestId);
    }

    @Override
    public Optional<TaskStatus> getRequestStatus(long requestId) {
        return registry.get(requestId).map(RequestTask::getStatus);
    }

    @Override
    public int getActiveRequestCount() {
        return registry.activeCount();
    }

    @Override
    public RequestStats getRequestStats() {
        return registry.stats();
    }

    @Override
    public boolean removeRequest(long requestId) {
        return registry.remove(requestId).isPresent();
    }

    @Override
    public int cleanupCompletedTasks() {
        Instant now = clock.instant();
        Duration threshold = Duration.ofSeconds(properties.getCleanupThresholdSeconds());
        int removed = 0;
        for (RequestTask task : registry.snapshot()) {
            Optional<Instant> completedAt = task.getCompletionTime();
            if (completedAt.isPresent() && TimeUtils.isOlderThan(completedAt.get(), now, threshold)) {
                registry.remove(task.getId());
                removed++;
            }
        }
        if (removed > 0) {
            LOG.info("Cleaned up {} finished request(s), {} still tracked", removed, registry.activeCount());
        }
        return removed;
    }

    @Override
    public void shutdown() {
        int cancelled = 0;
        for (RequestTask task : registry.snapshot()) {
            if (task.cancel()) {
                cancelled++;
            }
        }
        LOG.info("Orchestrator shut down; cancelled {} unfinished request(s)", cancelled);
    }

    /**
     * Registers a task whose terminal callback chain runs, in order: the internal hook, event and
     * metrics publication, then the caller's callback. The chain finishes before the task's
     * completion future completes, so waiters observe all side effects.
     */
    private RequestTask track(TaskKind kind,
                              ProviderId provider,
                              RequestOptions options,
                              Consumer<RequestTask> callback,
                              Consumer<RequestTask> internalHook) {
        RequestOptions effective = options != null
                ? options
                : RequestOptions.withTimeout(properties.getDefaultTimeoutMs());
        Consumer<RequestTask> chain = task -> {
            if (internalHook != null) {
                internalHook.accept(task);
            }
            onTerminal(task);
            if (callback != null) {
                callback.accept(task);
            }
        };
        return registry.create(kind, provider, effective, chain);
    }

    private long launch(RequestTask task, ProviderCall call) {
        return launch(task, call, null);
    }

    private long launch(RequestTask task, ProviderCall call, Runnable onCallFinished) {
        timeoutEnforcer.watch(task);
        worker.dispatch(task, call, onCallFinished);
        return task.getId();
    }

    private void onTerminal(RequestTask task) {
        TaskCompletedEvent event = TaskCompletedEvent.from(task);
        metrics.recordCompletion(event);
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Listener failed for task {} completion: {}", task.getId(), e.toString());
        }
    }

    private void storeInCache(RequestTask task, List<ChatMessage> transcript, String model) {
        if (task.getStatus() != TaskStatus.COMPLETED || task.isServedFromCache()) {
            return;
        }
        task.getResult()
                .filter(TaskResult.ChatCompletion.class::isInstance)
                .map(r -> ((TaskResult.ChatCompletion) r).response())
                .ifPresent(response -> {
                    try {
                        cache.put(transcript, model, response);
                    } catch (RuntimeException e) {
                        LOG.warn("Caching response of task {} failed: {}", task.getId(), e.toString());
                    }
                });
    }

    private void cancelAllExcept(List<RequestTask> tasks, RequestTask keep) {
        for (RequestTask task : tasks) {
            if (task != keep && task.cancel()) {
                LOG.debug("Cancelled losing task {} on {}", task.getId(), task.getProvider().displayName());
            }
        }
    }

    private static List<String> describeFailures(List<RequestTask> tasks) {
        List<String> failures = new ArrayList<>(tasks.size());
        for (RequestTask task : tasks) {
            failures.add(task.getProvider().displayName() + ": "
                    + task.getErrorInfo().orElse(task.getStatus().name().toLowerCase()));
        }
        return failures;
    }

    private static ChatResponse chatResponse(RequestTask task) {
        return task.getResult()
                .filter(TaskResult.ChatCompletion.class::isInstance)
                .map(r -> ((TaskResult.ChatCompletion) r).response())
                .orElseThrow(() -> new ModelRelayException("Task " + task.getId() + " has no chat response"));
    }

    private RequestTask require(long requestId) {
        return registry.get(requestId).orElseThrow(() -> new RequestNotFoundException(requestId));
    }
}
