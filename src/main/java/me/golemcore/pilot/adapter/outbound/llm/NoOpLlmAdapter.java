package me.golemcore.pilot.adapter.outbound.llm;

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
import me.golemcore.pilot.domain.model.LlmEvent;
import me.golemcore.pilot.domain.model.LlmRequest;
import me.golemcore.pilot.domain.model.LlmUsage;
import me.golemcore.pilot.domain.model.StructuredRequest;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no provider is configured.
 *
 * <p>
 * Turns end immediately with a placeholder answer and structured calls fail,
 * so the planner and recovery reasoning degrade to their deterministic
 * fallbacks.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public Flux<LlmEvent> issue(LlmRequest request) {
        log.warn("NoOpLlmAdapter: issue() called - no LLM configured");
        return Flux.just(
                LlmEvent.textDelta("[No LLM configured]"),
                LlmEvent.finish(LlmEvent.FINISH_STOP, LlmUsage.empty()));
    }

    @Override
    public CompletableFuture<String> generateStructured(StructuredRequest request) {
        return CompletableFuture.failedFuture(new IllegalStateException("No LLM configured"));
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
