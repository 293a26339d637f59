package me.golemcore.chains.domain.agent;

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

import me.golemcore.chains.domain.component.ToolComponent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Name lookup over an agent's enabled tools. A requested name matches exactly
 * first, then in normalised form (lower case, spaces as underscores).
 */
public final class ToolCatalog {

    private final Map<String, ToolComponent> byName = new LinkedHashMap<>();
    private final Map<String, ToolComponent> byNormalizedName = new LinkedHashMap<>();

    public ToolCatalog(List<ToolComponent> tools) {
        for (ToolComponent tool : tools) {
            if (!tool.isEnabled()) {
                continue;
            }
            String name = tool.getToolName();
            if (byName.putIfAbsent(name, tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + name);
            }
            byNormalizedName.putIfAbsent(normalize(name), tool);
        }
    }

    public static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    public ToolComponent find(String name) {
        if (name == null) {
            return null;
        }
        ToolComponent tool = byName.get(name);
        return tool != null ? tool : byNormalizedName.get(normalize(name));
    }

    public List<ToolComponent> getTools() {
        return List.copyOf(byName.values());
    }

    /**
     * One {@code > name: description} line per tool.
     */
    public String describe() {
        return byName.values().stream()
                .map(tool -> "> " + tool.getToolName() + ": " + tool.getDescription())
                .collect(Collectors.joining("\n"));
    }

    public String names() {
        return String.join(", ", byName.keySet());
    }
}
