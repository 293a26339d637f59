package me.golemcore.chains.domain.model;

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
 * Tool invocation decided by the agent. {@code id} correlates results of
 * parallel tool calls and is {@code null} for text-based agents; {@code log}
 * is the raw model text that produced the action.
 */
public record AgentAction(String id, String tool, String toolInput, String log) {

    public AgentAction {
        toolInput = toolInput != null ? toolInput : "";
        log = log != null ? log : "";
    }

    public static AgentAction of(String tool, String toolInput, String log) {
        return new AgentAction(null, tool, toolInput, log);
    }
}
