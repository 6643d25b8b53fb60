package me.golemcore.pilot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the orchestrator, bound from the {@code pilot.*}
 * namespace.
 *
 * <p>
 * Sections:
 * <ul>
 * <li>{@link LlmProperties} - model provider and credentials</li>
 * <li>{@link ToolLoopProperties} - stop conditions and action set policy</li>
 * <li>{@link PlannerProperties} - plan bounds and caching</li>
 * <li>{@link SummarizerProperties} - report narrative source</li>
 * <li>{@link RetryProperties} - automatic recovery attempt</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "pilot")
@Data
public class PilotProperties {

    private LlmProperties llm = new LlmProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private PlannerProperties planner = new PlannerProperties();
    private SummarizerProperties summarizer = new SummarizerProperties();
    private RetryProperties retry = new RetryProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";

        /**
         * Model used for loop turns, in {@code provider/model} form.
         */
        private String model = "openai/gpt-4o-mini";

        /**
         * Model used for structured calls. Falls back to {@link #model}.
         */
        private String plannerModel;

        private Duration timeout = Duration.ofSeconds(60);
        private double temperature = 0.3;
        private Map<String, ProviderProperties> providers = new HashMap<>();

        public String resolvePlannerModel() {
            return plannerModel != null && !plannerModel.isBlank() ? plannerModel : model;
        }
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class ToolLoopProperties {
        private int maxTurns = 15;

        /**
         * The loop stops once consecutive failed calls exceed this value.
         */
        private int maxConsecutiveFailures = 3;

        /**
         * Identical consecutive navigation targets that count as a loop.
         */
        private int loopGuardRepeats = 3;

        private long tokenBudget = 200_000L;
        private Duration toolTimeout = Duration.ofSeconds(30);
        private List<String> navigationTools = new ArrayList<>(List.of("navigate"));
        private String stateCheckTool = "getPageContext";
        private boolean forceStateCheckOnFirstTurn = true;
        private boolean requireToolCall = false;
    }

    @Data
    public static class PlannerProperties {
        private int maxSteps = 100;
        private boolean cacheEnabled = true;
        private int cacheMaxEntries = 256;
    }

    @Data
    public static class SummarizerProperties {
        private boolean llmNarrativeEnabled = false;
    }

    @Data
    public static class RetryProperties {
        private boolean enabled = true;
        private String marker = "[AUTO-RETRY]";
        private int maxRecentSteps = 10;
    }
}
