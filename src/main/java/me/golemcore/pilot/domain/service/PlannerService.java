package me.golemcore.pilot.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.AbortSignal;
import me.golemcore.pilot.domain.model.ExecutionPlan;
import me.golemcore.pilot.domain.model.PlanStep;
import me.golemcore.pilot.domain.model.PlanningResult;
import me.golemcore.pilot.domain.model.StateSnapshot;
import me.golemcore.pilot.domain.model.StructuredRequest;
import me.golemcore.pilot.domain.system.StructuredOutputReader;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.LlmPort;
import me.golemcore.pilot.port.outbound.PlanCachePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Produces the execution plan for a run.
 *
 * <p>
 * Planning never fails the run: when the model is unavailable, the response is
 * malformed, or the plan does not pass validation, a fixed single-step fallback
 * plan is returned instead. Raw responses go through a repair pass before
 * validation (misplaced confidence, unknown action names, nested fallbacks).
 */
@Service
@Slf4j
public class PlannerService {

    static final List<String> PLAN_ACTIONS = List.of("navigate", "click", "type", "scroll", "wait",
            "getPageContext");

    static final Map<String, String> ACTION_ALIASES = Map.of(
            "waitForElement", "wait",
            "waitFor", "wait",
            "getContext", "getPageContext",
            "getPage", "getPageContext",
            "clickElement", "click",
            "typeText", "type",
            "scrollPage", "scroll");

    static final double DEFAULT_CONFIDENCE = 0.5;
    static final double FALLBACK_CONFIDENCE = 0.3;
    static final String FALLBACK_ISSUE = "Planning generation failed, using fallback";

    private static final String SCHEMA_NAME = "ExecutionPlan";
    private static final int PAGE_TEXT_PREVIEW = 500;

    private static final String SYSTEM_PROMPT = """
            You are an expert planning agent that creates step-by-step browser automation plans.
            Plans must be granular, robust and optimized for execution.

            Available actions:
            - navigate(url): open a URL
            - type(selector, text): enter text into an element
            - click(selector): click an element
            - scroll(direction): scroll the page
            - wait(selector or milliseconds): wait for an element or a delay
            - getPageContext(): read the current page title, text, links and forms

            For every step provide the action, its target, a short rationale, the expected outcome,
            a verifiable validation condition and, when useful, one fallback action.
            Put the confidence score at the root of the response, not inside the plan.
            """;

    private final LlmPort llmPort;
    private final PlanCachePort planCache;
    private final StructuredOutputReader reader;
    private final ObjectMapper objectMapper;
    private final PilotProperties properties;

    public PlannerService(LlmPort llmPort, PlanCachePort planCache, ObjectMapper objectMapper,
            PilotProperties properties) {
        this.llmPort = llmPort;
        this.planCache = planCache;
        this.objectMapper = objectMapper;
        this.reader = new StructuredOutputReader(objectMapper);
        this.properties = properties;
    }

    /**
     * Plans the objective, starting from {@code state} when known. An abort
     * during the model call cancels it and yields the fallback plan.
     */
    public PlanningResult plan(String objective, StateSnapshot state, AbortSignal abortSignal) {
        String cacheKey = cacheKey(objective, state);
        boolean cacheEnabled = properties.getPlanner().isCacheEnabled() && planCache != null;
        if (cacheEnabled) {
            Optional<PlanningResult> cached = lookupCache(cacheKey);
            if (cached.isPresent()) {
                log.info("[Planner] Cache hit for objective ({} steps)", cached.get().getPlan().getSteps().size());
                return cached.get();
            }
        }

        if (!llmPort.isAvailable(properties.getLlm().resolvePlannerModel())) {
            log.warn("[Planner] No model credential configured, using fallback plan");
            return fallback(objective);
        }
        if (abortSignal.isAborted()) {
            log.info("[Planner] Run already aborted, using fallback plan");
            return fallback(objective);
        }

        PlanningResult result;
        try {
            String raw = abortSignal.await(llmPort.generateStructured(buildRequest(objective, state)),
                    properties.getLlm().getTimeout());
            result = parse(raw, objective);
        } catch (CancellationException e) {
            log.info("[Planner] Planning cancelled by abort, using fallback plan");
            return fallback(objective);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Planner] Interrupted while planning, using fallback plan");
            return fallback(objective);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Planner] Plan generation failed: {}", e.getMessage());
            return fallback(objective);
        } catch (JsonProcessingException | PlanValidationException e) {
            log.warn("[Planner] Plan rejected: {}", e.getMessage());
            return fallback(objective);
        } catch (RuntimeException e) {
            log.warn("[Planner] Plan generation failed: {}", e.getMessage());
            return fallback(objective);
        }

        logMetrics(result);
        if (cacheEnabled) {
            storeCache(cacheKey, result);
        }
        return result;
    }

    /**
     * The plan used when generation or validation fails: a single state check.
     */
    public PlanningResult fallback(String objective) {
        PlanStep step = PlanStep.builder()
                .step(1)
                .action(properties.getToolLoop().getStateCheckTool())
                .target("current_page")
                .reasoning("Need to understand current page state before proceeding")
                .expectedOutcome("Page context retrieved (title, text, links, forms)")
                .validationCriteria("Context object returned with title and URL")
                .build();
        ExecutionPlan plan = ExecutionPlan.builder()
                .objective(objective)
                .approach("Sequential execution with validation")
                .steps(List.of(step))
                .criticalPaths(List.of(1))
                .estimatedSteps(1)
                .complexityScore(0.5)
                .potentialIssues(List.of(FALLBACK_ISSUE))
                .optimizations(List.of())
                .build();
        return PlanningResult.builder()
                .plan(plan)
                .gaps(List.of())
                .confidence(FALLBACK_CONFIDENCE)
                .fallback(true)
                .build();
    }

    PlanningResult parse(String raw, String objective) throws JsonProcessingException {
        ObjectNode root = reader.readObject(raw);
        repair(root);
        PlanningResult parsed = objectMapper.treeToValue(root, PlanningResult.class);
        return validate(parsed, objective);
    }

    /**
     * Fixes common shape mistakes in place before validation.
     */
    void repair(ObjectNode root) {
        if (!root.has("plan") && root.has("steps")) {
            ObjectNode plan = root.deepCopy();
            plan.remove(List.of("confidence", "optimizedQuery", "gaps"));
            ObjectNode wrapped = root.objectNode();
            wrapped.set("plan", plan);
            copyIfPresent(root, wrapped, "confidence");
            copyIfPresent(root, wrapped, "optimizedQuery");
            copyIfPresent(root, wrapped, "gaps");
            root.removeAll();
            root.setAll(wrapped);
            log.debug("[Planner] Repaired: wrapped bare plan");
        }

        JsonNode planNode = root.get("plan");
        if (!(planNode instanceof ObjectNode plan)) {
            return;
        }

        if (plan.has("confidence") && !root.has("confidence")) {
            root.set("confidence", plan.get("confidence"));
            log.debug("[Planner] Repaired: moved confidence from plan to root");
        }
        plan.remove("confidence");
        if (!root.hasNonNull("confidence")) {
            root.put("confidence", DEFAULT_CONFIDENCE);
            log.debug("[Planner] Repaired: added default confidence");
        }

        if (plan.get("steps") instanceof ArrayNode steps) {
            for (JsonNode stepNode : steps) {
                if (stepNode instanceof ObjectNode step) {
                    repairStep(step);
                }
            }
        }
    }

    private void repairStep(ObjectNode step) {
        JsonNode action = step.get("action");
        if (action != null && action.isTextual() && !PLAN_ACTIONS.contains(action.asText())) {
            String mapped = ACTION_ALIASES.getOrDefault(action.asText(), "wait");
            log.debug("[Planner] Repaired: invalid action '{}' -> '{}'", action.asText(), mapped);
            step.put("action", mapped);
        }
        if (step.get("fallbackAction") instanceof ObjectNode fallback && fallback.has("fallbackAction")) {
            ObjectNode flat = step.objectNode();
            flat.put("action", fallback.path("action").asText("wait"));
            flat.put("target", fallback.path("target").asText("1"));
            flat.put("reasoning", fallback.path("reasoning").asText("Fallback action"));
            step.set("fallbackAction", flat);
            log.debug("[Planner] Repaired: flattened nested fallback of step {}", step.path("step").asInt());
        }
    }

    private PlanningResult validate(PlanningResult parsed, String objective) {
        if (parsed == null || parsed.getPlan() == null) {
            throw new PlanValidationException("response has no plan");
        }
        ExecutionPlan plan = parsed.getPlan();
        List<PlanStep> steps = plan.getSteps();
        if (steps == null || steps.isEmpty()) {
            throw new PlanValidationException("plan has no steps");
        }
        int maxSteps = properties.getPlanner().getMaxSteps();
        if (steps.size() > maxSteps) {
            throw new PlanValidationException("plan has " + steps.size() + " steps, limit is " + maxSteps);
        }
        if (plan.getComplexityScore() < 0 || plan.getComplexityScore() > 1) {
            throw new PlanValidationException("complexityScore out of range: " + plan.getComplexityScore());
        }
        if (parsed.getConfidence() < 0 || parsed.getConfidence() > 1) {
            throw new PlanValidationException("confidence out of range: " + parsed.getConfidence());
        }

        List<PlanStep> normalizedSteps = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            PlanStep step = steps.get(i);
            if (step == null || step.getAction() == null || !PLAN_ACTIONS.contains(step.getAction())) {
                throw new PlanValidationException("step " + (i + 1) + " has no valid action");
            }
            if (step.getTarget() == null) {
                throw new PlanValidationException("step " + (i + 1) + " has no target");
            }
            normalizedSteps.add(step.getStep() > 0 ? step : step.toBuilder().step(i + 1).build());
        }

        ExecutionPlan normalized = plan.toBuilder()
                .objective(isBlank(plan.getObjective()) ? objective : plan.getObjective())
                .approach(plan.getApproach() != null ? plan.getApproach() : "")
                .steps(List.copyOf(normalizedSteps))
                .criticalPaths(plan.getCriticalPaths() != null ? plan.getCriticalPaths() : List.of())
                .estimatedSteps(plan.getEstimatedSteps() > 0 ? plan.getEstimatedSteps() : normalizedSteps.size())
                .potentialIssues(plan.getPotentialIssues() != null ? plan.getPotentialIssues() : List.of())
                .optimizations(plan.getOptimizations() != null ? plan.getOptimizations() : List.of())
                .build();
        return parsed.toBuilder()
                .plan(normalized)
                .gaps(parsed.getGaps() != null ? parsed.getGaps() : List.of())
                .fallback(false)
                .build();
    }

    private StructuredRequest buildRequest(String objective, StateSnapshot state) {
        return StructuredRequest.builder()
                .name(SCHEMA_NAME)
                .systemPrompt(SYSTEM_PROMPT)
                .prompt(buildUserPrompt(objective, state))
                .schema(planningSchema(properties.getPlanner().getMaxSteps()))
                .model(properties.getLlm().resolvePlannerModel())
                .temperature(properties.getLlm().getTemperature())
                .build();
    }

    private String buildUserPrompt(String objective, StateSnapshot state) {
        StringBuilder sb = new StringBuilder();
        sb.append("User Query: \"").append(objective).append("\"\n\n");
        if (state != null && !isBlank(state.url())) {
            sb.append("Current URL: ").append(state.url()).append('\n');
            sb.append("Page Title: ").append(state.title() != null ? state.title() : "Unknown").append('\n');
            if (state.text() != null) {
                String preview = state.text().length() > PAGE_TEXT_PREVIEW
                        ? state.text().substring(0, PAGE_TEXT_PREVIEW)
                        : state.text();
                sb.append("Page Text Preview: ").append(preview).append('\n');
            }
        } else {
            sb.append("Starting from a blank page or unknown context.\n");
        }
        sb.append("""

                Requirements:
                1. After every navigate, call getPageContext before interacting with the page.
                2. Never assume form elements exist; verify them with getPageContext first.
                3. Break the query into small, non-overlapping steps.
                4. Give each step a validation condition and a fallback where it helps.
                5. Mark the steps that must succeed as critical paths (by step number).
                6. List anticipated issues and optimizations.
                7. Prefer CSS selectors over coordinates.
                """);
        return sb.toString();
    }

    static Map<String, Object> planningSchema(int maxSteps) {
        Map<String, Object> fallbackAction = objectSchema(Map.of(
                "action", Map.of("type", "string"),
                "target", Map.of("type", "string"),
                "reasoning", Map.of("type", "string")), List.of("action", "target", "reasoning"));

        Map<String, Object> stepProperties = new LinkedHashMap<>();
        stepProperties.put("step", Map.of("type", "integer"));
        stepProperties.put("action", Map.of("type", "string", "enum", PLAN_ACTIONS));
        stepProperties.put("target", Map.of("type", "string"));
        stepProperties.put("reasoning", Map.of("type", "string"));
        stepProperties.put("expectedOutcome", Map.of("type", "string"));
        stepProperties.put("validationCriteria", Map.of("type", "string"));
        stepProperties.put("fallbackAction", fallbackAction);
        Map<String, Object> step = objectSchema(stepProperties,
                List.of("step", "action", "target", "reasoning", "expectedOutcome"));

        Map<String, Object> planProperties = new LinkedHashMap<>();
        planProperties.put("objective", Map.of("type", "string"));
        planProperties.put("approach", Map.of("type", "string"));
        planProperties.put("steps", Map.of("type", "array", "items", step, "minItems", 1, "maxItems", maxSteps));
        planProperties.put("criticalPaths", Map.of("type", "array", "items", Map.of("type", "integer")));
        planProperties.put("estimatedSteps", Map.of("type", "integer"));
        planProperties.put("complexityScore", Map.of("type", "number", "minimum", 0, "maximum", 1));
        planProperties.put("potentialIssues", Map.of("type", "array", "items", Map.of("type", "string")));
        planProperties.put("optimizations", Map.of("type", "array", "items", Map.of("type", "string")));
        Map<String, Object> plan = objectSchema(planProperties, List.of("objective", "approach", "steps",
                "criticalPaths", "estimatedSteps", "complexityScore", "potentialIssues", "optimizations"));

        Map<String, Object> rootProperties = new LinkedHashMap<>();
        rootProperties.put("plan", plan);
        rootProperties.put("optimizedQuery", Map.of("type", "string"));
        rootProperties.put("gaps", Map.of("type", "array", "items", Map.of("type", "string")));
        rootProperties.put("confidence", Map.of("type", "number", "minimum", 0, "maximum", 1));
        return objectSchema(rootProperties, List.of("plan", "confidence"));
    }

    private static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    private Optional<PlanningResult> lookupCache(String key) {
        try {
            return planCache.lookup(key);
        } catch (Exception e) { // NOSONAR - cache is an optimization only
            log.debug("[Planner] Cache lookup failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void storeCache(String key, PlanningResult result) {
        try {
            planCache.store(key, result);
        } catch (Exception e) { // NOSONAR - cache is an optimization only
            log.debug("[Planner] Cache store failed: {}", e.getMessage());
        }
    }

    static String cacheKey(String objective, StateSnapshot state) {
        String location = state != null && state.url() != null ? state.url() : "";
        return objective + " @ " + location;
    }

    private void logMetrics(PlanningResult result) {
        ExecutionPlan plan = result.getPlan();
        log.info("[Planner] Plan ready: {} step(s), complexity {}%, confidence {}%, {} critical path(s)",
                plan.getSteps().size(), Math.round(plan.getComplexityScore() * 100),
                Math.round(result.getConfidence() * 100), plan.getCriticalPaths().size());
    }

    private static void copyIfPresent(ObjectNode from, ObjectNode to, String field) {
        if (from.has(field)) {
            to.set(field, from.get(field));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Raised when a parsed plan does not have the required shape.
     */
    static class PlanValidationException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        PlanValidationException(String message) {
            super(message);
        }
    }
}
