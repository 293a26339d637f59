package me.golemcore.chains.domain.exception;

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

import lombok.Getter;
import me.golemcore.chains.domain.model.AgentStep;

import java.time.Duration;
import java.util.List;

@Getter
public class AgentTimeoutException extends AgentExecutionException {

    private final Duration timeout;

    public AgentTimeoutException(Duration timeout, List<AgentStep> steps) {
        super(ErrorKind.TIMEOUT_EXCEEDED, "Agent exceeded its time budget of " + timeout, steps, null);
        this.timeout = timeout;
    }
}
