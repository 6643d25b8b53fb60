package me.golemcore.pilot.port.outbound;

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

import me.golemcore.pilot.domain.model.LlmEvent;
import me.golemcore.pilot.domain.model.LlmRequest;
import me.golemcore.pilot.domain.model.StructuredRequest;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Port for integrating with LLM providers (OpenAI, Anthropic, etc.). Provides
 * a streamed action-calling turn and one-shot structured JSON generation.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Issues one model turn and streams its events: text deltas, action calls as
     * they stream and complete, and a single finish event with usage. Cancelling
     * the subscription cancels the in-flight request.
     */
    Flux<LlmEvent> issue(LlmRequest request);

    /**
     * Generates a JSON object conforming to the request schema and returns its raw
     * text. The caller parses and validates it.
     */
    CompletableFuture<String> generateStructured(StructuredRequest request);

    /**
     * Returns the current or default model identifier used by this provider.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();

    /**
     * Checks if {@code model} can be served, which may depend on a different
     * provider credential than the default model.
     */
    default boolean isAvailable(String model) {
        return isAvailable();
    }
}
