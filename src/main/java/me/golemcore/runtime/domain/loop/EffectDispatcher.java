package me.golemcore.runtime.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.Action;
import me.golemcore.runtime.domain.model.DispatchOutcome;
import me.golemcore.runtime.port.outbound.ActionDispatchException;
import me.golemcore.runtime.port.outbound.ActionPort;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Dispatches actions as independent outbound calls on a worker pool.
 *
 * <p>
 * Actions are submitted in the order given; with more than one worker they may
 * complete in any order. Every action yields exactly one
 * {@link DispatchOutcome}, and a failure never affects the other actions. The
 * caller is not expected to wait for the returned future.
 */
@Slf4j
public class EffectDispatcher implements AutoCloseable {

    private final ActionPort actionPort;
    private final ExecutorService executor;
    private final RuntimeStats stats;
    private final long shutdownGraceMs;

    public EffectDispatcher(ActionPort actionPort, ExecutorService executor, RuntimeStats stats,
            long shutdownGraceMs) {
        this.actionPort = actionPort;
        this.executor = executor;
        this.stats = stats;
        this.shutdownGraceMs = shutdownGraceMs;
    }

    /**
     * Submit {@code actions} for dispatch.
     *
     * @return a future completing with one outcome per action, in submission
     *         order, once all of them have finished; it never completes
     *         exceptionally
     */
    public CompletableFuture<List<DispatchOutcome>> dispatch(List<Action> actions) {
        if (actions.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        stats.recordSubmitted(actions.size());

        List<CompletableFuture<DispatchOutcome>> futures = new ArrayList<>(actions.size());
        for (Action action : actions) {
            futures.add(submit(action));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<DispatchOutcome> outcomes = new ArrayList<>(futures.size());
                    for (CompletableFuture<DispatchOutcome> future : futures) {
                        outcomes.add(future.join());
                    }
                    return outcomes;
                });
    }

    private CompletableFuture<DispatchOutcome> submit(Action action) {
        try {
            return CompletableFuture.supplyAsync(() -> execute(action), executor);
        } catch (RejectedExecutionException e) {
            log.error("[Dispatch] {} rejected: dispatcher is shut down", action.describe());
            stats.recordFailed();
            return CompletableFuture.completedFuture(DispatchOutcome.failed(action, "Dispatcher is shut down"));
        }
    }

    private DispatchOutcome execute(Action action) {
        try {
            actionPort.execute(action);
            stats.recordSucceeded();
            log.debug("[Dispatch] {} delivered", action.describe());
            return DispatchOutcome.succeeded(action);
        } catch (ActionDispatchException e) {
            stats.recordFailed();
            log.error("[Dispatch] {} failed: {}", action.describe(), e.getMessage());
            return DispatchOutcome.failed(action, e.getMessage());
        } catch (RuntimeException e) { // NOSONAR
            stats.recordFailed();
            log.error("[Dispatch] {} failed unexpectedly", action.describe(), e);
            return DispatchOutcome.failed(action, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Stop accepting actions and give in-flight ones a grace period to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGraceMs, TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = executor.shutdownNow();
                log.warn("[Dispatch] Shutdown grace expired, {} queued actions dropped", dropped.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
