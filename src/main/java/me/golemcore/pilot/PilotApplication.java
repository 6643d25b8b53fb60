package me.golemcore.pilot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Pilot.
 *
 * <p>
 * GolemCore Pilot drives a browser automation agent towards a natural language
 * objective: it plans the objective, runs the model in an action-calling loop
 * against the registered actions, summarizes the outcome and retries once
 * with an adjusted objective when the task was not completed.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → RetryCoordinator, PlannerService, ToolLoopSystem, SummarizerService
 * Ports              → LlmPort, ConversationStorePort, TelemetryPort, PlanCachePort
 * Infrastructure     → langchain4j, in-memory stores, SLF4J telemetry
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration under the {@code pilot.*} prefix, see
 * {@code application.yml}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(PilotApplication.class, args);
    }

}
