package me.golemcore.pilot.domain.component;

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

import me.golemcore.pilot.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name-to-action map supplied by the caller. The full set is offered
 * to the model on every turn.
 */
public final class ToolRegistry {

    private static final ToolRegistry EMPTY = new ToolRegistry(Map.of());

    private final Map<String, ToolComponent> tools;

    private ToolRegistry(Map<String, ToolComponent> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static ToolRegistry empty() {
        return EMPTY;
    }

    /**
     * Builds a registry from the enabled components. A later component with the
     * same name replaces an earlier one.
     */
    public static ToolRegistry of(Collection<? extends ToolComponent> components) {
        Map<String, ToolComponent> byName = new LinkedHashMap<>();
        if (components != null) {
            for (ToolComponent component : components) {
                if (component != null && component.isEnabled()) {
                    byName.put(component.getToolName(), component);
                }
            }
        }
        return new ToolRegistry(byName);
    }

    /**
     * Returns a new registry that also contains {@code tool}.
     */
    public ToolRegistry withTool(ToolComponent tool) {
        Map<String, ToolComponent> copy = new LinkedHashMap<>(tools);
        copy.put(tool.getToolName(), tool);
        return new ToolRegistry(copy);
    }

    public Optional<ToolComponent> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>(tools.size());
        for (ToolComponent tool : tools.values()) {
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public int size() {
        return tools.size();
    }
}
