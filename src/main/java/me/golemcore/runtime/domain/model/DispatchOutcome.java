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

/**
 * Outcome of dispatching a single {@link Action}.
 *
 * @param action
 *            the dispatched action
 * @param success
 *            whether the platform accepted the call
 * @param error
 *            error description when {@code success} is false
 */
public record DispatchOutcome(Action action, boolean success, String error) {

    public static DispatchOutcome succeeded(Action action) {
        return new DispatchOutcome(action, true, null);
    }

    public static DispatchOutcome failed(Action action, String error) {
        return new DispatchOutcome(action, false, error);
    }
}
