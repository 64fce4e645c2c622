package me.golemcore.runtime.domain.reducer;

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
import me.golemcore.runtime.domain.model.Event;
import me.golemcore.runtime.domain.model.FoldResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds an ordered batch of events through a {@link Reducer}.
 *
 * <p>
 * Each event sees the state produced by the previous one; actions are
 * concatenated in event order. If the reducer throws (or returns {@code null})
 * for an event, that event is skipped: it contributes no actions and the state
 * carried forward is the one it received. Other events in the batch are not
 * affected.
 *
 * @param <S>
 *            reducer state type
 */
@Slf4j
public class ReducerInvoker<S> {

    private final Reducer<S> reducer;

    public ReducerInvoker(Reducer<S> reducer) {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
    }

    public FoldResult<S> fold(S state, List<Event> events) {
        requireAscending(events);

        S current = state;
        List<Action> actions = new ArrayList<>();
        for (Event event : events) {
            FoldResult<S> step;
            try {
                step = reducer.reduce(event, current);
            } catch (RuntimeException e) {
                log.error("[Reducer] Failed on update {} ({}), skipping it", event.updateId(),
                        event.getClass().getSimpleName(), e);
                continue;
            }
            if (step == null) {
                log.error("[Reducer] Returned null for update {}, skipping it", event.updateId());
                continue;
            }
            current = step.state();
            actions.addAll(step.actions());
        }
        return FoldResult.of(current, actions);
    }

    private static void requireAscending(List<Event> events) {
        long previous = Long.MIN_VALUE;
        for (Event event : events) {
            if (event.updateId() <= previous) {
                throw new IllegalArgumentException("Events out of order: update " + event.updateId()
                        + " follows " + previous);
            }
            previous = event.updateId();
        }
    }
}
