package com.aigent.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool shared by step execution, parallel fan-out and submitted workflows.
 * Per-workflow parallelism is bounded separately by {@code aigent.workflow.max-parallel-steps}.
 */
@Configuration
public class OrchestratorConfig {

    @Bean(name = "orchestratorExecutor", destroyMethod = "shutdownNow")
    public ExecutorService orchestratorExecutor() {
        return Executors.newCachedThreadPool(workerThreadFactory());
    }

    static ThreadFactory workerThreadFactory() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "aigent-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
