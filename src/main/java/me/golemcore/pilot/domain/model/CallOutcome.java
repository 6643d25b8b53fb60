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

/**
 * Terminal outcome of an action call: either the executor output or a
 * classified failure.
 */
public record CallOutcome(boolean success, Object output, ToolFailureKind failureKind, String errorText) {

    public static CallOutcome success(Object output) {
        return new CallOutcome(true, output, null, null);
    }

    public static CallOutcome failure(ToolFailureKind kind, String errorText) {
        return new CallOutcome(false, null, kind, errorText);
    }

    /**
     * Maps an executor result. Only an explicit {@code success=false} is a
     * failure; a missing result counts as success with no output.
     */
    public static CallOutcome fromResult(ToolResult result) {
        if (result == null) {
            return success(null);
        }
        if (!result.isSuccess()) {
            ToolFailureKind kind = result.getFailureKind() != null
                    ? result.getFailureKind()
                    : ToolFailureKind.EXECUTION_FAILED;
            String error = result.getError() != null ? result.getError() : "Action reported failure";
            return failure(kind, error);
        }
        return success(result.getData() != null ? result.getData() : result.getOutput());
    }
}
