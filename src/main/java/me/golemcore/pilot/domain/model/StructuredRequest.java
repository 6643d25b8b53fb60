package me.golemcore.pilot.domain.model;

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

import java.util.Map;

/**
 * One-shot request for a JSON object matching {@link #schema}. Used for plan
 * generation, argument repair, recovery queries and narratives.
 */
@Data
@Builder
public class StructuredRequest {

    /** Schema name, also used by providers that label response formats. */
    private String name;
    private String systemPrompt;
    private String prompt;
    private Map<String, Object> schema;
    private String model;

    @Builder.Default
    private double temperature = 0.3;

    private Integer maxTokens;
}
