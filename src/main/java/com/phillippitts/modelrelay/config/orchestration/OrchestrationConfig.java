package com.phillippitts.modelrelay.config.orchestration;

import com.phillippitts.modelrelay.config.properties.OrchestratorProperties;
import com.phillippitts.modelrelay.service.cache.ResponseCache;
import com.phillippitts.modelrelay.service.dispatch.TaskTimeoutEnforcer;
import com.phillippitts.modelrelay.service.metrics.DispatchMetrics;
import com.phillippitts.modelrelay.service.orchestration.RequestOrchestrator;
import com.phillippitts.modelrelay.service.orchestration.RequestOrchestratorBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.util.concurrent.Executor;

/**
 * Wires the {@link RequestOrchestrator} explicitly through its builder.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public TaskTimeoutEnforcer taskTimeoutEnforcer(OrchestratorProperties properties,
                                                   @Qualifier("taskScheduler") TaskScheduler taskScheduler) {
        return properties.isEnforceTimeouts()
                ? new TaskTimeoutEnforcer(taskScheduler)
                : TaskTimeoutEnforcer.disabled();
    }

    /**
     * Orchestrator shared by all callers. Unfinished requests are cancelled on context close.
     */
    @Bean(destroyMethod = "shutdown")
    public RequestOrchestrator requestOrchestrator(@Qualifier("dispatchExecutor") Executor dispatchExecutor,
                                                   ResponseCache responseCache,
                                                   TaskTimeoutEnforcer taskTimeoutEnforcer,
                                                   ApplicationEventPublisher publisher,
                                                   DispatchMetrics metrics,
                                                   OrchestratorProperties properties) {
        return RequestOrchestratorBuilder.builder()
                .executor(dispatchExecutor)
                .responseCache(responseCache)
                .timeoutEnforcer(taskTimeoutEnforcer)
                .publisher(publisher)
                .metrics(metrics)
                .properties(properties)
                .build();
    }
}
