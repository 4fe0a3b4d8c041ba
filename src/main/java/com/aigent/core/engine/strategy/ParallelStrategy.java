package com.aigent.core.engine.strategy;

import com.aigent.core.config.OrchestratorProperties;
import com.aigent.core.engine.StepRunner;
import com.aigent.core.engine.WorkflowAbortedException;
import com.aigent.core.engine.WorkflowRun;
import com.aigent.core.model.StepResult;
import com.aigent.core.model.WorkflowType;
import com.aigent.core.plan.PlanNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fans every step out to the worker pool and waits for all of them.
 * <p>
 * At most {@code aigent.workflow.max-parallel-steps} steps of one workflow run at once; with
 * the default of 0 every step gets its own task, so steps that wait on each other cannot
 * starve behind a full set of permits.
 * Dependencies are not resolved: each step sees only its own parameters. A failing step
 * never cancels its siblings.
 */
@Component
public class ParallelStrategy implements WorkflowStrategy {

    private static final Logger log = LoggerFactory.getLogger(ParallelStrategy.class);

    private final StepRunner runner;
    private final ExecutorService executor;
    private final OrchestratorProperties properties;

    public ParallelStrategy(StepRunner runner, ExecutorService executor, OrchestratorProperties properties) {
        this.runner = runner;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public WorkflowType type() {
        return WorkflowType.PARALLEL;
    }

    @Override
    public void execute(WorkflowRun run) {
        int limit = properties.getMaxParallelSteps();
        var semaphore = new Semaphore(limit > 0 ? limit : Math.max(1, run.plan().nodes().size()));
        var aborted = new AtomicReference<WorkflowAbortedException>();
        var futures = new ArrayList<CompletableFuture<Void>>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        for (PlanNode node : run.plan().nodes()) {
            futures.add(CompletableFuture.runAsync(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    semaphore.acquire();
                    try {
                        runner.run(run, node, Map.of())
                                .ifPresent(result -> run.recordResult(node.name(), StepResult.of(result)));
                    } finally {
                        semaphore.release();
                    }
                } catch (WorkflowAbortedException e) {
                    log.debug("Step {} not run: {}", node.name(), e.getMessage());
                    aborted.compareAndSet(null, e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    run.recordError("Step " + node.name() + " interrupted");
                    run.stepFinished(false);
                } catch (Exception | Error e) {
                    log.error("Unexpected error executing step {}: {}", node.name(), e.getMessage(), e);
                    run.recordError("Error in step " + node.name() + ": " + e.getMessage());
                    run.stepFinished(false);
                } finally {
                    MDC.clear();
                }
            }, executor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        if (aborted.get() != null) {
            throw aborted.get();
        }
    }
}
