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

import me.golemcore.pilot.domain.model.ExecutionPlan;
import me.golemcore.pilot.domain.model.FallbackAction;
import me.golemcore.pilot.domain.model.PlanStep;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders an {@link ExecutionPlan} into the system prompt that drives the tool
 * loop. The prompt tells the model to carry out every step, not just the first
 * state check.
 */
@Component
public class PlanInstructionFormatter {

    public String format(ExecutionPlan plan) {
        List<PlanStep> steps = plan.getSteps() != null ? plan.getSteps() : List.of();
        StringBuilder sb = new StringBuilder();
        sb.append("# Execution Plan\n\n");
        sb.append("**MANDATORY:** This plan contains ").append(steps.size())
                .append(" step(s) that MUST ALL be executed in sequence.\n");
        sb.append("Do NOT stop after the first state check. Continue with ALL remaining steps.\n\n");

        sb.append("**Objective:** ").append(plan.getObjective()).append('\n');
        sb.append("**Approach:** ").append(plan.getApproach()).append('\n');
        sb.append("**Complexity:** ").append(Math.round(plan.getComplexityScore() * 100)).append("%\n");
        sb.append("**Estimated Steps:** ").append(plan.getEstimatedSteps()).append('\n');
        sb.append("**Total Steps in Plan:** ").append(steps.size()).append(" (all must be executed)\n\n");

        sb.append("## Critical Path Steps\n");
        if (plan.getCriticalPaths() != null) {
            for (Integer index : plan.getCriticalPaths()) {
                PlanStep step = index != null ? plan.findStep(index) : null;
                if (step != null) {
                    sb.append("- Step ").append(step.getStep()).append(": ").append(step.getAction())
                            .append(" - ").append(step.getTarget()).append('\n');
                }
            }
        }
        sb.append('\n');

        appendNumbered(sb, "## Potential Issues & Mitigations", plan.getPotentialIssues());
        appendNumbered(sb, "## Optimizations", plan.getOptimizations());

        sb.append("## Step-by-Step Instructions (Execute ALL Steps)\n\n");
        sb.append("**IMPORTANT:** There are ").append(steps.size())
                .append(" steps in this plan. Execute ALL of them unless the objective is explicitly achieved.\n\n");
        for (PlanStep step : steps) {
            appendStep(sb, step);
        }
        return sb.toString().stripTrailing();
    }

    private void appendStep(StringBuilder sb, PlanStep step) {
        String action = step.getAction() != null ? step.getAction().toUpperCase(Locale.ROOT) : "UNKNOWN";
        sb.append("### Step ").append(step.getStep()).append(": ").append(action).append('\n');
        sb.append("**Target:** ").append(step.getTarget()).append('\n');
        sb.append("**Reasoning:** ").append(step.getReasoning()).append('\n');
        sb.append("**Expected Outcome:** ").append(step.getExpectedOutcome()).append('\n');
        if (step.getValidationCriteria() != null && !step.getValidationCriteria().isBlank()) {
            sb.append("**Validation:** ").append(step.getValidationCriteria()).append('\n');
        }
        FallbackAction fallback = step.getFallbackAction();
        if (fallback != null) {
            sb.append("**Fallback:** If this fails, ").append(fallback.getAction()).append(' ')
                    .append(fallback.getTarget()).append(" (").append(fallback.getReasoning()).append(")\n");
        }
        sb.append('\n');
    }

    private void appendNumbered(StringBuilder sb, String heading, List<String> items) {
        sb.append(heading).append('\n');
        if (items != null) {
            for (int i = 0; i < items.size(); i++) {
                sb.append(i + 1).append(". ").append(items.get(i)).append('\n');
            }
        }
        sb.append('\n');
    }
}
