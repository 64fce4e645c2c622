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
import me.golemcore.runtime.domain.model.DispatchOutcome;
import me.golemcore.runtime.domain.model.EventBatch;
import me.golemcore.runtime.domain.model.FoldResult;
import me.golemcore.runtime.domain.model.Identity;
import me.golemcore.runtime.domain.model.RuntimeState;
import me.golemcore.runtime.domain.reducer.ReducerInvoker;
import me.golemcore.runtime.port.outbound.EventSourcePort;
import me.golemcore.runtime.port.outbound.TransportException;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Top-level driver: bootstraps the identity once, then repeatedly fetches a
 * batch at the cursor, folds it through the reducer, hands the resulting
 * actions to the dispatcher and advances the cursor.
 *
 * <p>
 * State machine:
 *
 * <pre>
 * UNINITIALIZED → BOOTSTRAPPING → RUNNING → STOPPED
 *                              ↘ ERRORED
 * </pre>
 *
 * <p>
 * The reducer state and the cursor are written only by the thread running the
 * loop. The cursor moves only after a batch has been completely folded, so an
 * event is never skipped: after a crash at most the in-flight batch is fetched
 * and folded again (at-least-once delivery). Dispatch results never feed back
 * into state or cursor.
 *
 * <p>
 * Fetch failures are retried with the same cursor after a bounded exponential
 * backoff. {@link #stop()} is checked between cycles and cancels the fetch in
 * progress, so a stop request does not wait out the long poll.
 *
 * @param <S>
 *            reducer state type
 */
@Slf4j
public class RuntimeLoop<S> {

    private final IdentityBootstrapper<S> bootstrapper;
    private final EventSourcePort eventSource;
    private final ReducerInvoker<S> invoker;
    private final EffectDispatcher dispatcher;
    private final RuntimeLoopConfig config;
    private final RuntimeStats stats;
    private final FetchBackoff backoff;

    private volatile RuntimeState status = RuntimeState.UNINITIALIZED;
    private volatile Identity identity;
    private volatile S state;
    private volatile long cursor;
    private volatile boolean stopRequested;
    private volatile Thread loopThread;

    public RuntimeLoop(IdentityBootstrapper<S> bootstrapper, EventSourcePort eventSource,
            ReducerInvoker<S> invoker, EffectDispatcher dispatcher, RuntimeLoopConfig config, RuntimeStats stats) {
        this.bootstrapper = bootstrapper;
        this.eventSource = eventSource;
        this.invoker = invoker;
        this.dispatcher = dispatcher;
        this.config = config;
        this.stats = stats;
        this.backoff = FetchBackoff.from(config);
        this.cursor = config.getInitialCursor();
    }

    /**
     * Resolve the identity and the reducer's initial state, then dispatch the
     * init-time actions. On failure the loop is left in {@link RuntimeState#ERRORED}
     * and will never fetch.
     *
     * @return the dispatch of the init-time actions
     */
    public CompletableFuture<List<DispatchOutcome>> bootstrap() throws BootstrapException {
        synchronized (this) {
            if (status != RuntimeState.UNINITIALIZED) {
                throw new IllegalStateException("Runtime already bootstrapped (state " + status + ")");
            }
            status = RuntimeState.BOOTSTRAPPING;
        }
        log.info("[Runtime] Bootstrapping");

        BootstrapResult<S> result;
        try {
            result = bootstrapper.bootstrap();
        } catch (BootstrapException e) {
            status = RuntimeState.ERRORED;
            log.error("[Runtime] Bootstrap failed, runtime will not start: {}", e.getMessage());
            throw e;
        }

        identity = result.identity();
        state = result.initial().state();
        status = RuntimeState.RUNNING;
        log.info("[Runtime] Running as @{}, polling from cursor {}", identity.username(), cursor);
        return dispatcher.dispatch(result.initial().actions());
    }

    /**
     * Run one fetch → fold → dispatch → advance cycle. Never throws once the
     * runtime is running: transport problems and unexpected failures are reported
     * through the returned outcome, with state and cursor left as they were.
     */
    public CycleResult runCycle() {
        if (status != RuntimeState.RUNNING) {
            throw new IllegalStateException("Runtime is not running (state " + status + ")");
        }
        stats.recordCycle();

        long fetchCursor = cursor;
        try {
            return cycle(fetchCursor);
        } catch (TransportException e) {
            return fetchFailed(fetchCursor, e);
        } catch (RuntimeException e) { // NOSONAR
            stats.recordFetchFailure();
            long delay = backoff.onFailure();
            log.error("[Runtime] Cycle at cursor {} failed unexpectedly (attempt {}, retrying in {}ms)",
                    fetchCursor, backoff.getConsecutiveFailures(), delay, e);
            return CycleResult.fetchFailed(delay);
        }
    }

    private CycleResult cycle(long fetchCursor) throws TransportException {
        EventBatch batch = eventSource.fetch(fetchCursor, config.getPollTimeout());
        backoff.reset();

        if (batch.isEmpty()) {
            log.debug("[Runtime] No new events at cursor {}", fetchCursor);
            return CycleResult.idle(config.getIdlePauseMs());
        }
        if (batch.skipped() > 0) {
            stats.recordSkipped(batch.skipped());
            log.warn("[Runtime] {} update(s) in batch could not be used and were skipped", batch.skipped());
        }

        FoldResult<S> result = invoker.fold(state, batch.events());
        CompletableFuture<List<DispatchOutcome>> dispatch = dispatcher.dispatch(result.actions());

        long next = batch.lastUpdateId().getAsLong() + 1;
        state = result.state();
        cursor = Math.max(fetchCursor, next);
        stats.recordFolded(batch.events().size());
        log.debug("[Runtime] Folded {} event(s), submitted {} action(s), cursor {} -> {}",
                batch.events().size(), result.actions().size(), fetchCursor, cursor);
        return CycleResult.processed(batch.events().size(), result.actions().size(), dispatch);
    }

    private CycleResult fetchFailed(long fetchCursor, TransportException e) {
        stats.recordFetchFailure();
        long delay = backoff.onFailure();
        if (stopRequested) {
            log.info("[Runtime] Fetch aborted by stop request");
        } else {
            log.error("[Runtime] Fetch at cursor {} failed: {} (attempt {}, retrying in {}ms)",
                    fetchCursor, e.getMessage(), backoff.getConsecutiveFailures(), delay);
        }
        return CycleResult.fetchFailed(delay);
    }

    /**
     * Bootstrap, then cycle until {@link #stop()} is called. Blocks the calling
     * thread.
     *
     * @throws BootstrapException
     *             if bootstrap fails; no event is fetched in that case
     */
    public void run() throws BootstrapException {
        loopThread = Thread.currentThread();
        try {
            bootstrap();
            while (!stopRequested) {
                CycleResult cycle = runCycle();
                if (cycle.pauseMs() > 0 && !stopRequested) {
                    pause(cycle.pauseMs());
                }
            }
            status = RuntimeState.STOPPED;
            log.info("[Runtime] Stopped at cursor {} ({})", cursor, stats);
        } finally {
            loopThread = null;
        }
    }

    /**
     * Ask the loop to exit after the current cycle. An in-progress long poll is
     * cancelled and a backoff pause is interrupted.
     */
    public void stop() {
        stopRequested = true;
        eventSource.cancel();
        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
        }
    }

    void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            // interrupt means stop
            stopRequested = true;
            Thread.currentThread().interrupt();
        }
    }

    public RuntimeState getStatus() {
        return status;
    }

    public Identity getIdentity() {
        return identity;
    }

    public S getState() {
        return state;
    }

    public long getCursor() {
        return cursor;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public RuntimeStats getStats() {
        return stats;
    }
}
