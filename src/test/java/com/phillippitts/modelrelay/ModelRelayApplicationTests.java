package com.phillippitts.modelrelay;

import com.phillippitts.modelrelay.service.assistant.ConcurrentAssistant;
import com.phillippitts.modelrelay.service.cache.ResponseCache;
import com.phillippitts.modelrelay.service.cache.TwoTierResponseCache;
import com.phillippitts.modelrelay.service.orchestration.RequestOrchestrator;
import com.phillippitts.modelrelay.service.provider.ProviderManager;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest(
    properties = {
        "relay.cache.persistent=false", // keep the test run from writing a SQLite file
        "relay.orchestrator.dispatch-mode=POOL"
    }
)
class ModelRelayApplicationTests {

    @Autowired
    private RequestOrchestrator orchestrator;

    @Autowired
    private ResponseCache responseCache;

    @Autowired
    private ProviderManager providerManager;

    @Autowired
    private ConcurrentAssistant assistant;

    @Test
    void contextLoads() {
        assertThat(responseCache).isInstanceOf(TwoTierResponseCache.class);
        assertThat(orchestrator.getActiveRequestCount()).isZero();
        assertThat(providerManager.registeredProviderHealth()).isEmpty();
        assertThat(assistant.stats().totalSubmitted()).isZero();
    }

}
