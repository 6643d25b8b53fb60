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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single action call emitted by the model: correlation id, action name,
 * structured arguments and the instant the call was first observed.
 */
public record ActionCall(String id, String name, Map<String, Object> args, Instant startedAt) {

    public ActionCall {
        args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
    }

    /**
     * Returns a copy of this call carrying repaired arguments.
     */
    public ActionCall withArgs(Map<String, Object> newArgs) {
        return new ActionCall(id, name, newArgs, startedAt);
    }
}
