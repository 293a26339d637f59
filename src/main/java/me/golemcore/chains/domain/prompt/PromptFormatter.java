package me.golemcore.chains.domain.prompt;

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

import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.PromptValue;

import java.util.Set;

/**
 * Anything that turns chain variables into a {@link PromptValue}.
 * Implementations are immutable and safe to share between concurrent calls.
 */
public interface PromptFormatter {

    /**
     * Names that must be present in the variables passed to
     * {@link #formatPrompt(ChainValues)}.
     */
    Set<String> getInputVariables();

    /**
     * @throws me.golemcore.chains.domain.exception.MissingVariableException
     *             if a required variable is absent
     */
    PromptValue formatPrompt(ChainValues values);
}
