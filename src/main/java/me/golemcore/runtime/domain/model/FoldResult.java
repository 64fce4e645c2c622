package me.golemcore.runtime.domain.model;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Result of one reducer invocation, or of folding a whole batch: the new state
 * and the actions to dispatch, in emission order.
 *
 * @param <S>
 *            reducer state type
 */
public record FoldResult<S>(S state, List<Action> actions) {

    public FoldResult {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static <S> FoldResult<S> unchanged(S state) {
        return new FoldResult<>(state, List.of());
    }

    public static <S> FoldResult<S> of(S state, Action... actions) {
        return new FoldResult<>(state, Arrays.asList(actions));
    }

    public static <S> FoldResult<S> of(S state, List<Action> actions) {
        return new FoldResult<>(state, actions);
    }

    /**
     * Copy of this result with {@code more} appended after the existing actions.
     */
    public FoldResult<S> withActions(List<Action> more) {
        if (more.isEmpty()) {
            return this;
        }
        List<Action> combined = new ArrayList<>(actions.size() + more.size());
        combined.addAll(actions);
        combined.addAll(more);
        return new FoldResult<>(state, combined);
    }
}
