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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Configuration parameters for the runtime loop: long-poll duration, idle pause
 * and the bounds of the fetch retry backoff.
 */
@Data
@Builder
public class RuntimeLoopConfig {

    @Builder.Default
    private Duration pollTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private long idlePauseMs = 0;

    @Builder.Default
    private long initialCursor = 0;

    @Builder.Default
    private long backoffInitialDelayMs = 500;

    @Builder.Default
    private long backoffMaxDelayMs = 30000;

    @Builder.Default
    private double backoffMultiplier = 2.0;

    public static RuntimeLoopConfig defaultConfig() {
        return RuntimeLoopConfig.builder().build();
    }
}
