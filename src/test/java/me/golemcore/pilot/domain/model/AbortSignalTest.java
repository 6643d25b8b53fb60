package me.golemcore.pilot.domain.model;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AbortSignalTest {

    @Test
    void shouldKeepFirstReason() {
        AbortSignal signal = AbortSignal.create();

        signal.abort("user cancelled");
        signal.abort("shutdown");

        assertTrue(signal.isAborted());
        assertEquals("user cancelled", signal.getReason());
    }

    @Test
    void shouldEmitToLateSubscribers() {
        AbortSignal signal = AbortSignal.create();
        signal.abort("stop");

        StepVerifier.create(signal.whenAborted())
                .expectNext(Boolean.TRUE)
                .verifyComplete();
    }

    @Test
    void shouldReturnValueOfCompletedFuture() throws Exception {
        AbortSignal signal = AbortSignal.create();

        String value = signal.await(CompletableFuture.completedFuture("done"), Duration.ofSeconds(1));

        assertEquals("done", value);
    }

    @Test
    void shouldCancelPendingFutureWhenAlreadyAborted() {
        AbortSignal signal = AbortSignal.create();
        signal.abort("stop");
        CompletableFuture<String> pending = new CompletableFuture<>();

        assertThrows(CancellationException.class, () -> signal.await(pending, Duration.ofSeconds(1)));
        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldUnblockWaiterOnAbort() {
        AbortSignal signal = AbortSignal.create();
        CompletableFuture<String> pending = new CompletableFuture<>();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(() -> signal.abort("stop"), 50, TimeUnit.MILLISECONDS);

            assertThrows(CancellationException.class, () -> signal.await(pending, Duration.ofSeconds(5)));
            assertTrue(pending.isCancelled());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void shouldTimeOutAndCancelPendingFuture() {
        AbortSignal signal = AbortSignal.create();
        CompletableFuture<String> pending = new CompletableFuture<>();

        assertThrows(TimeoutException.class, () -> signal.await(pending, Duration.ofMillis(20)));
        assertTrue(pending.isCancelled());
        assertFalse(signal.isAborted());
    }
}
