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

import me.golemcore.runtime.domain.model.Event;
import me.golemcore.runtime.domain.model.FoldResult;
import me.golemcore.runtime.domain.model.Identity;

/**
 * Caller-supplied state machine driven by the runtime loop.
 *
 * <p>
 * Implementations must be pure: the same {@code (event, state)} pair always
 * yields an equal result, and no side effect happens outside the returned
 * actions. The runtime relies on this to replay a batch safely after a crash.
 *
 * @param <S>
 *            state type; should be immutable
 */
public interface Reducer<S> {

    /**
     * Produce the initial state once the bot's identity is known. Actions returned
     * here are dispatched before the first event is fetched.
     */
    FoldResult<S> init(Identity identity);

    /**
     * Apply one event to {@code state}.
     */
    FoldResult<S> reduce(Event event, S state);
}
