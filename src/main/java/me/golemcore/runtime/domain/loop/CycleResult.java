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

import me.golemcore.runtime.domain.model.DispatchOutcome;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * What one fetch → fold → dispatch cycle did.
 *
 * @param outcome
 *            how the cycle ended
 * @param eventsFolded
 *            events handed to the reducer
 * @param actionsSubmitted
 *            actions handed to the dispatcher
 * @param pauseMs
 *            how long the loop should wait before the next cycle
 * @param dispatch
 *            completes once every submitted action has an outcome
 */
public record CycleResult(Outcome outcome, int eventsFolded, int actionsSubmitted, long pauseMs,
        CompletableFuture<List<DispatchOutcome>> dispatch) {

    public enum Outcome {
        /** The fetch failed; cursor and state untouched. */
        FETCH_FAILED,
        /** Nothing new arrived. */
        IDLE,
        /** A batch was folded and the cursor advanced. */
        PROCESSED
    }

    static CycleResult fetchFailed(long retryDelayMs) {
        return new CycleResult(Outcome.FETCH_FAILED, 0, 0, retryDelayMs,
                CompletableFuture.completedFuture(List.of()));
    }

    static CycleResult idle(long pauseMs) {
        return new CycleResult(Outcome.IDLE, 0, 0, pauseMs, CompletableFuture.completedFuture(List.of()));
    }

    static CycleResult processed(int events, int actions, CompletableFuture<List<DispatchOutcome>> dispatch) {
        return new CycleResult(Outcome.PROCESSED, events, actions, 0, dispatch);
    }
}
