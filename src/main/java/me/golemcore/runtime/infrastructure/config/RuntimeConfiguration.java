package me.golemcore.runtime.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.loop.EffectDispatcher;
import me.golemcore.runtime.domain.loop.IdentityBootstrapper;
import me.golemcore.runtime.domain.loop.RuntimeLoop;
import me.golemcore.runtime.domain.loop.RuntimeLoopConfig;
import me.golemcore.runtime.domain.loop.RuntimeStats;
import me.golemcore.runtime.domain.reducer.Reducer;
import me.golemcore.runtime.domain.reducer.ReducerInvoker;
import me.golemcore.runtime.port.outbound.ActionPort;
import me.golemcore.runtime.port.outbound.EventSourcePort;
import me.golemcore.runtime.port.outbound.IdentityPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the runtime loop from the configured ports and the single
 * {@link Reducer} bean.
 *
 * @since 1.0
 */
@Configuration
@Slf4j
public class RuntimeConfiguration {

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public RuntimeStats runtimeStats() {
        return new RuntimeStats();
    }

    @Bean
    public RuntimeLoopConfig runtimeLoopConfig(BotProperties properties) {
        return toLoopConfig(properties);
    }

    @Bean
    public EffectDispatcher effectDispatcher(ActionPort actionPort, RuntimeStats stats, BotProperties properties) {
        BotProperties.DispatchProperties dispatch = properties.getDispatch();
        return new EffectDispatcher(actionPort, dispatchExecutor(dispatch.getThreads()), stats,
                dispatch.getShutdownGraceMs());
    }

    @Bean
    public RuntimeLoop<?> runtimeLoop(IdentityPort identityPort, EventSourcePort eventSource, Reducer<?> reducer,
            EffectDispatcher dispatcher, RuntimeLoopConfig config, RuntimeStats stats) {
        log.info("[Runtime] Using reducer {}", reducer.getClass().getSimpleName());
        return createLoop(identityPort, eventSource, reducer, dispatcher, config, stats);
    }

    static RuntimeLoopConfig toLoopConfig(BotProperties properties) {
        BotProperties.PollingProperties polling = properties.getPolling();
        BotProperties.BackoffProperties backoff = properties.getBackoff();
        return RuntimeLoopConfig.builder()
                .pollTimeout(Duration.ofSeconds(polling.getTimeoutSeconds()))
                .idlePauseMs(polling.getIdlePauseMs())
                .backoffInitialDelayMs(backoff.getInitialDelayMs())
                .backoffMaxDelayMs(backoff.getMaxDelayMs())
                .backoffMultiplier(backoff.getMultiplier())
                .build();
    }

    static ExecutorService dispatchExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "runtime-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static <S> RuntimeLoop<S> createLoop(IdentityPort identityPort, EventSourcePort eventSource,
            Reducer<S> reducer, EffectDispatcher dispatcher, RuntimeLoopConfig config, RuntimeStats stats) {
        return new RuntimeLoop<>(new IdentityBootstrapper<>(identityPort, reducer), eventSource,
                new ReducerInvoker<>(reducer), dispatcher, config, stats);
    }
}
