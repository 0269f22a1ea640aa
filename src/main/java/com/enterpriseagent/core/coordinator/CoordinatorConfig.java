package com.enterpriseagent.core.coordinator;

import com.enterpriseagent.core.engine.AgentOrchestratorFactory;
import com.enterpriseagent.core.events.EventBus;
import com.enterpriseagent.core.metrics.AgentMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter wiring: the remote enterprise service is primary, the local pipeline is secondary.
 */
@Configuration
public class CoordinatorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService adapterExecutor(CoordinatorProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getPoolSize()), r -> {
            Thread t = new Thread(r, "agent-adapter-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public EnterpriseAgentAdapter enterpriseAgentAdapter(CoordinatorProperties properties,
                                                         ObjectMapper objectMapper,
                                                         @Qualifier("adapterExecutor") ExecutorService adapterExecutor) {
        return new EnterpriseAgentAdapter(properties.getEnterprise(), objectMapper, adapterExecutor);
    }

    @Bean
    public LightweightAgentAdapter lightweightAgentAdapter(CoordinatorProperties properties,
                                                           AgentOrchestratorFactory orchestratorFactory,
                                                           @Qualifier("adapterExecutor") ExecutorService adapterExecutor) {
        return new LightweightAgentAdapter(properties.getLightweight(), orchestratorFactory, adapterExecutor);
    }

    @Bean
    public AgentCoordinator agentCoordinator(CoordinatorProperties properties,
                                             EnterpriseAgentAdapter enterpriseAgentAdapter,
                                             LightweightAgentAdapter lightweightAgentAdapter,
                                             EventBus eventBus,
                                             AgentMetrics metrics) {
        return new AgentCoordinator(properties, enterpriseAgentAdapter, lightweightAgentAdapter, eventBus, metrics);
    }
}
