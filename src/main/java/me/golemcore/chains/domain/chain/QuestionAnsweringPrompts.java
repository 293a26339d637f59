package me.golemcore.chains.domain.chain;

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

import me.golemcore.chains.domain.prompt.PromptTemplate;

/**
 * Default prompts of the retrieval chains. Both use {@code {{ name }}}
 * placeholders.
 */
public final class QuestionAnsweringPrompts {

    public static final String STUFF_QA_TEMPLATE = """
            Use the following pieces of context to answer the question at the end. If you don't know the \
            answer, just say that you don't know, don't try to make up an answer.

            {{context}}

            Question:{{question}}
            Helpful Answer:""";

    public static final String CONDENSE_QUESTION_TEMPLATE = """
            Given the following conversation and a follow up question, rephrase the follow up question to be \
            a standalone question, in its original language.

            Chat History:
            {{chat_history}}
            Follow Up Input: {{question}}
            Standalone question:""";

    private QuestionAnsweringPrompts() {
    }

    public static PromptTemplate stuffQa() {
        return PromptTemplate.jinja2(STUFF_QA_TEMPLATE);
    }

    public static PromptTemplate condenseQuestion() {
        return PromptTemplate.jinja2(CONDENSE_QUESTION_TEMPLATE);
    }
}
