package me.golemcore.orchestrator.infrastructure.config;

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Worker pool shared by all conversation runners. Its size bounds how many
 * runs execute at once across conversation keys.
 */
@Configuration
@Slf4j
public class EventQueueConfiguration {

    private final OrchestratorProperties properties;
    private ExecutorService executor;

    public EventQueueConfiguration(OrchestratorProperties properties) {
        this.properties = properties;
    }

    @Bean
    public synchronized ExecutorService eventRunExecutor() {
        if (executor == null) {
            int workers = Math.max(1, properties.getQueue().getWorkers());
            executor = Executors.newFixedThreadPool(workers, r -> {
                Thread t = new Thread(r, "event-run");
                t.setDaemon(true);
                return t;
            });
            log.debug("[Queue] Worker pool created with {} thread(s)", workers);
        }
        return executor;
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
