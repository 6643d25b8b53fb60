package me.golemcore.pilot.testsupport;

import me.golemcore.pilot.domain.model.LlmEvent;
import me.golemcore.pilot.domain.model.LlmRequest;
import me.golemcore.pilot.domain.model.LlmUsage;
import me.golemcore.pilot.domain.model.Message;
import me.golemcore.pilot.domain.model.StructuredRequest;
import me.golemcore.pilot.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Deterministic model fake. Loop turns are answered by a responder keyed by the
 * turn index, which is the number of assistant messages already in the
 * request. Structured calls are answered by request name; unscripted names
 * fail.
 */
public class ScriptedLlmPort implements LlmPort {

    public static final LlmUsage TURN_USAGE = LlmUsage.of(10, 5);

    private final List<LlmRequest> requests = new CopyOnWriteArrayList<>();
    private final List<StructuredRequest> structuredRequests = new CopyOnWriteArrayList<>();
    private final Map<String, Function<StructuredRequest, String>> structured = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<String>> hanging = new ConcurrentHashMap<>();
    private volatile Function<Integer, Flux<LlmEvent>> responder = turn -> text("Done.");
    private volatile boolean available = true;

    public ScriptedLlmPort onTurn(Function<Integer, Flux<LlmEvent>> turnResponder) {
        this.responder = turnResponder;
        return this;
    }

    public ScriptedLlmPort onStructured(String name, Function<StructuredRequest, String> answer) {
        structured.put(name, answer);
        return this;
    }

    /**
     * Structured calls with this name return a future that never completes on
     * its own.
     */
    public CompletableFuture<String> hangStructured(String name) {
        CompletableFuture<String> pending = new CompletableFuture<>();
        hanging.put(name, pending);
        return pending;
    }

    public ScriptedLlmPort available(boolean value) {
        this.available = value;
        return this;
    }

    public List<LlmRequest> requests() {
        return requests;
    }

    public List<StructuredRequest> structuredRequests() {
        return structuredRequests;
    }

    public static Flux<LlmEvent> call(String id, String tool, Map<String, Object> args) {
        return Flux.just(
                LlmEvent.callStreaming(id, tool),
                LlmEvent.callEmitted(id, tool, args),
                LlmEvent.finish(LlmEvent.FINISH_TOOL_CALLS, TURN_USAGE));
    }

    public static Flux<LlmEvent> text(String text) {
        return Flux.just(
                LlmEvent.textDelta(text),
                LlmEvent.finish(LlmEvent.FINISH_STOP, TURN_USAGE));
    }

    @Override
    public String getProviderId() {
        return "scripted";
    }

    @Override
    public Flux<LlmEvent> issue(LlmRequest request) {
        requests.add(request);
        int turn = (int) request.getMessages().stream().filter(Message::isAssistantMessage).count();
        return responder.apply(turn);
    }

    @Override
    public CompletableFuture<String> generateStructured(StructuredRequest request) {
        structuredRequests.add(request);
        CompletableFuture<String> pending = hanging.get(request.getName());
        if (pending != null) {
            return pending;
        }
        Function<StructuredRequest, String> answer = structured.get(request.getName());
        if (answer == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("No scripted answer for " + request.getName()));
        }
        try {
            return CompletableFuture.completedFuture(answer.apply(request));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public String getCurrentModel() {
        return "scripted/model";
    }

    @Override
    public boolean isAvailable() {
        return available;
    }
}
