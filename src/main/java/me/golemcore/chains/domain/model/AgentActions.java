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

import java.util.List;

/**
 * One or more tool invocations requested in a single model turn, in request
 * order.
 */
public record AgentActions(List<AgentAction> actions) implements AgentDecision {

    public AgentActions {
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("At least one action is required");
        }
        actions = List.copyOf(actions);
    }

    public static AgentActions of(AgentAction action) {
        return new AgentActions(List.of(action));
    }

    @Override
    public boolean isFinish() {
        return false;
    }
}
