package me.golemcore.runtime.infrastructure;

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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.loop.BootstrapException;
import me.golemcore.runtime.domain.loop.RuntimeLoop;
import me.golemcore.runtime.infrastructure.config.BotProperties;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs the {@link RuntimeLoop} on a dedicated thread once the application is
 * ready, and stops it on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RuntimeLoopRunner {

    static final String THREAD_NAME = "runtime-loop";

    private final RuntimeLoop<?> runtimeLoop;
    private final BotProperties properties;

    private volatile Thread thread;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getRuntime().isAutoStart()) {
            log.info("[Runtime] Auto-start disabled (bot.runtime.auto-start=false)");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (thread != null) {
            log.warn("[Runtime] Loop already started");
            return;
        }
        thread = new Thread(this::runLoop, THREAD_NAME);
        thread.start();
    }

    void runLoop() {
        try {
            runtimeLoop.run();
        } catch (BootstrapException e) {
            log.error("[Runtime] Bot did not start: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("[Runtime] Loop terminated unexpectedly", e);
        }
    }

    @PreDestroy
    public void stop() {
        Thread current = thread;
        runtimeLoop.stop();
        if (current == null) {
            return;
        }
        try {
            current.join(properties.getRuntime().getStopTimeoutMs());
            if (current.isAlive()) {
                log.warn("[Runtime] Loop did not stop within {}ms", properties.getRuntime().getStopTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    boolean isStarted() {
        return thread != null;
    }
}
