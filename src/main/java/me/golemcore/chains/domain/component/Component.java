package me.golemcore.chains.domain.component;

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
 * Pluggable collaborator of chains and agents (tools, memories).
 */
public interface Component {

    /**
     * Returns the kind of collaborator, e.g. {@code "tool"} or {@code "memory"}.
     */
    String getComponentType();

    /**
     * Whether the component may be used. Agents skip disabled tools when building
     * their catalogue.
     */
    default boolean isEnabled() {
        return true;
    }
}
