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

/**
 * Prompt texts shared by the agents and the executor. Templates use
 * {@code {{ name }}} placeholders.
 */
public final class AgentPrompts {

    public static final String DEFAULT_SYSTEM_PROMPT = """
            Assistant is designed to be able to assist with a wide range of tasks, from answering simple \
            questions to providing in-depth explanations and discussions on a wide range of topics. As a \
            language model, Assistant is able to generate human-like text based on the input it receives, \
            allowing it to engage in natural-sounding conversations and provide responses that are coherent \
            and relevant to the topic at hand.

            Assistant is constantly learning and improving, and its capabilities are constantly evolving. It \
            is able to process and understand large amounts of text, and can use this knowledge to provide \
            accurate and informative responses to a wide range of questions. Additionally, Assistant is able \
            to generate its own text based on the input it receives, allowing it to engage in discussions and \
            provide explanations and descriptions on a wide range of topics.

            Overall, Assistant is a powerful system that can help with a wide range of tasks and provide \
            valuable insights and information on a wide range of topics. Whether you need help with a \
            specific question or just want to have a conversation about a particular topic, Assistant is here \
            to assist.""";

    public static final String FORMAT_INSTRUCTIONS = """
            RESPONSE FORMAT INSTRUCTIONS
            ----------------------------

            You MUST either use a tool (use one at time) OR give your best final answer not both at the same \
            time. When responding, you must use the following format:

            ```json
            {
                "action": string, // The action to take, should be one of [{{tool_names}}]
                "action_input": object // The input to the action, object enclosed in curly braces
            }
            ```
            This Thought/Action/Action Input/Result can repeat N times.

            Once you know the final answer, you must give it using the following format:

            ```json
            {
                "final_answer": string // Your final answer must be the great and the most complete as possible
            }
            ```

            The following is the description of the tools available to you:
            {{tools}}""";

    public static final String DEFAULT_INITIAL_PROMPT = """
            Current Task: {{input}}

            Begin! This is VERY important to you, use the tools available and give your best Final Answer, \
            your job depends on it!""";

    public static final String TOOL_RESPONSE_TEMPLATE = """
            TOOL RESPONSE:
            ---------------------
            {{observation}}

            USER'S INPUT
            --------------------

            Okay, so what is the response to my last comment? If using information obtained from the tools you \
            must mention it explicitly without mentioning the tool names - I have forgotten all TOOL RESPONSES! \
            Remember to respond with a markdown code snippet of a json blob with a single action, and NOTHING \
            else.""";

    public static final String INVALID_FORMAT_ERROR =
            "Invalid format, remember the instructions regarding the format and try again";

    public static final String FORCE_FINAL_ANSWER = "Now it's time you MUST give your absolute best final "
            + "answer. You'll ignore all previous instructions, stop using any tools, and just return your "
            + "absolute BEST Final answer.";

    public static final String TOOL_NOT_FOUND =
            "%s is not a tool, You MUST use a tool OR give your best final answer.";

    public static final String TOOL_USAGE_LIMIT =
            "You have used the tool %s too many times, you CANNOT and MUST NOT use it again";

    public static final String TOOL_ERROR = "The tool return the following error: %s";

    private AgentPrompts() {
    }
}
