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

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a run. Observed by the model stream (through
 * {@link #whenAborted()}) and by pending executor calls (through
 * {@link #await(CompletableFuture, Duration)}).
 */
public final class AbortSignal {

    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final Sinks.One<Boolean> sink = Sinks.one();
    private final CompletableFuture<Void> future = new CompletableFuture<>();
    private volatile String reason;

    public static AbortSignal create() {
        return new AbortSignal();
    }

    /**
     * Aborts the run. Only the first call has an effect.
     */
    public void abort(String abortReason) {
        if (aborted.compareAndSet(false, true)) {
            this.reason = abortReason;
            sink.tryEmitValue(Boolean.TRUE);
            future.complete(null);
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * Emits once the run is aborted. Late subscribers see the value immediately.
     */
    public Mono<Boolean> whenAborted() {
        return sink.asMono();
    }

    /**
     * Waits for {@code pending}, giving up when the run is aborted or the timeout
     * elapses. On abort the pending future is cancelled.
     *
     * @throws CancellationException
     *             if the run was aborted before the future completed
     */
    public <T> T await(CompletableFuture<T> pending, Duration timeout)
            throws ExecutionException, TimeoutException, InterruptedException {
        if (isAborted()) {
            pending.cancel(true);
            throw new CancellationException("Run aborted");
        }
        CompletableFuture<Object> race = CompletableFuture.anyOf(pending, future);
        try {
            race.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw e;
        }
        if (!pending.isDone()) {
            pending.cancel(true);
            throw new CancellationException("Run aborted");
        }
        return pending.get();
    }
}
