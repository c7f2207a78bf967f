package com.meetprep.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetprep.orchestrator.pipeline.PipelineExecutor;
import com.meetprep.orchestrator.step.StepProvider;
import com.meetprep.orchestrator.step.StepProviderMode;
import com.meetprep.orchestrator.step.StepRegistry;
import com.meetprep.orchestrator.step.remote.RemoteStepProvider;
import com.meetprep.orchestrator.step.remote.ResearchToolClient;
import com.meetprep.orchestrator.step.stub.StubStepProvider;
import com.meetprep.orchestrator.store.InMemoryJobStore;
import com.meetprep.orchestrator.store.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wiring of the engine: store, worker pools, step provider and pipeline.
 *
 * The step provider is chosen once here from {@code meetprep.steps.provider};
 * the rest of the engine only ever sees the resulting {@link StepRegistry}.
 */
@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobStore jobStore(Clock clock) {
        return new InMemoryJobStore(clock);
    }

    /** One thread per accepted job; jobs never wait for each other. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService jobWorkers() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("job-"));
    }

    /** Runs step bodies so the job thread can enforce the step deadline. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stepWorkers() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("step-"));
    }

    @Bean
    public StepProvider stepProvider(
            @Value("${meetprep.steps.provider:stub}") String provider,
            @Value("${meetprep.tools.base-url:http://localhost:8090}") String toolsBaseUrl,
            @Value("${meetprep.tools.request-timeout:PT2M}") Duration requestTimeout,
            ObjectMapper objectMapper) {
        StepProviderMode mode = StepProviderMode.valueOf(provider.trim().toUpperCase());
        log.info("Using {} step provider", mode);
        return switch (mode) {
            case STUB   -> new StubStepProvider();
            case REMOTE -> new RemoteStepProvider(
                    new ResearchToolClient(toolsBaseUrl, requestTimeout, objectMapper));
        };
    }

    @Bean
    public StepRegistry stepRegistry(StepProvider provider, MeterRegistry meterRegistry) {
        return new StepRegistry(provider.steps(), meterRegistry);
    }

    @Bean
    public PipelineExecutor pipelineExecutor(JobStore store,
                                             StepRegistry registry,
                                             @Qualifier("stepWorkers") ExecutorService stepWorkers,
                                             @Value("${meetprep.steps.timeout:PT5M}") Duration stepTimeout,
                                             MeterRegistry meterRegistry) {
        return new PipelineExecutor(store, registry, stepWorkers, stepTimeout, meterRegistry);
    }
}
