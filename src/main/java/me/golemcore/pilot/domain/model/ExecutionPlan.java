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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structured plan produced once per run, before any action executes.
 *
 * <p>
 * {@code criticalPaths} holds step numbers whose failure compromises the run.
 * {@code complexityScore} is in [0, 1].
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionPlan {

    String objective;
    String approach;
    List<PlanStep> steps;
    List<Integer> criticalPaths;
    int estimatedSteps;
    double complexityScore;
    List<String> potentialIssues;
    List<String> optimizations;

    /**
     * Finds a step by its 1-based number, falling back to list position.
     */
    public PlanStep findStep(int stepNumber) {
        if (steps == null) {
            return null;
        }
        for (PlanStep candidate : steps) {
            if (candidate.getStep() == stepNumber) {
                return candidate;
            }
        }
        if (stepNumber >= 0 && stepNumber < steps.size()) {
            return steps.get(stepNumber);
        }
        return null;
    }
}
