package me.golemcore.pilot.adapter.outbound.store;

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

import me.golemcore.pilot.domain.model.PlanningResult;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.PlanCachePort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Least-recently-used plan cache bounded by
 * {@code pilot.planner.cache-max-entries}.
 */
@Component
public class InMemoryPlanCache implements PlanCachePort {

    private final Map<String, PlanningResult> entries;

    public InMemoryPlanCache(PilotProperties properties) {
        int maxEntries = Math.max(1, properties.getPlanner().getCacheMaxEntries());
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PlanningResult> eldest) {
                return size() > maxEntries;
            }
        };
    }

    @Override
    public synchronized Optional<PlanningResult> lookup(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void store(String key, PlanningResult result) {
        entries.put(key, result);
    }

    synchronized int size() {
        return entries.size();
    }
}
