package me.golemcore.orchestrator.adapter.outbound.monitor;

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
import me.golemcore.orchestrator.domain.model.MonitorEvent;
import me.golemcore.orchestrator.port.outbound.MonitorPort;
import org.springframework.stereotype.Component;

/**
 * Default monitor sink: writes every monitor event to the application log.
 */
@Component
@Slf4j
public class LoggingMonitorAdapter implements MonitorPort {

    @Override
    public void publishEvent(MonitorEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("[Monitor] {} event={} key={} {}", event.type(), event.eventId(), event.conversationKey(),
                    event.payload());
        }
    }
}
