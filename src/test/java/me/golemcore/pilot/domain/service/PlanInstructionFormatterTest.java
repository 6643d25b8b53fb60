package me.golemcore.pilot.domain.service;

import me.golemcore.pilot.domain.model.ExecutionPlan;
import me.golemcore.pilot.domain.model.FallbackAction;
import me.golemcore.pilot.domain.model.PlanStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanInstructionFormatterTest {

    private final PlanInstructionFormatter formatter = new PlanInstructionFormatter();

    private static ExecutionPlan plan() {
        return ExecutionPlan.builder()
                .objective("Search for shoes")
                .approach("Use the site search")
                .steps(List.of(
                        PlanStep.builder().step(1).action("navigate").target("https://shop.test")
                                .reasoning("Open shop").expectedOutcome("Home page").build(),
                        PlanStep.builder().step(2).action("type").target("#search")
                                .reasoning("Enter query").expectedOutcome("Query typed")
                                .validationCriteria("Input has value")
                                .fallbackAction(FallbackAction.builder().action("click").target("#search-icon")
                                        .reasoning("Search box hidden").build())
                                .build()))
                .criticalPaths(List.of(1, 7))
                .estimatedSteps(2)
                .complexityScore(0.42)
                .potentialIssues(List.of("Cookie banner"))
                .optimizations(List.of())
                .build();
    }

    @Test
    void shouldRenderHeaderAndMandatoryNotice() {
        String prompt = formatter.format(plan());

        assertTrue(prompt.startsWith("# Execution Plan\n\n"));
        assertTrue(prompt.contains("**MANDATORY:** This plan contains 2 step(s) that MUST ALL be executed in sequence."));
        assertTrue(prompt.contains("Do NOT stop after the first state check."));
        assertTrue(prompt.contains("**Objective:** Search for shoes"));
        assertTrue(prompt.contains("**Complexity:** 42%"));
        assertTrue(prompt.contains("**Total Steps in Plan:** 2 (all must be executed)"));
    }

    @Test
    void shouldListOnlyResolvableCriticalSteps() {
        String prompt = formatter.format(plan());

        assertTrue(prompt.contains("- Step 1: navigate - https://shop.test"));
        assertFalse(prompt.contains("- Step 7"));
    }

    @Test
    void shouldRenderNumberedIssues() {
        String prompt = formatter.format(plan());

        assertTrue(prompt.contains("## Potential Issues & Mitigations\n1. Cookie banner\n"));
        assertTrue(prompt.contains("## Optimizations\n\n"));
    }

    @Test
    void shouldRenderEveryStepWithOptionalParts() {
        String prompt = formatter.format(plan());

        assertTrue(prompt.contains("### Step 1: NAVIGATE\n**Target:** https://shop.test\n"));
        assertTrue(prompt.contains("### Step 2: TYPE\n"));
        assertTrue(prompt.contains("**Validation:** Input has value"));
        assertTrue(prompt.contains("**Fallback:** If this fails, click #search-icon (Search box hidden)"));
        assertEquals(1, prompt.split("\\*\\*Validation:\\*\\*", -1).length - 1);
    }

    @Test
    void shouldToleratePlanWithoutLists() {
        ExecutionPlan bare = ExecutionPlan.builder().objective("x").approach("y").build();

        String prompt = formatter.format(bare);

        assertTrue(prompt.contains("This plan contains 0 step(s)"));
        assertTrue(prompt.endsWith("Execute ALL of them unless the objective is explicitly achieved."));
    }
}
