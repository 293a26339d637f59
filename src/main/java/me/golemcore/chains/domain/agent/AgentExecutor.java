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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.chain.Chain;
import me.golemcore.chains.domain.chain.ChainCallOptions;
import me.golemcore.chains.domain.chain.ChainFutures;
import me.golemcore.chains.domain.chain.ConversationMemory;
import me.golemcore.chains.domain.component.MemoryComponent;
import me.golemcore.chains.domain.component.ToolComponent;
import me.golemcore.chains.domain.exception.AgentParseException;
import me.golemcore.chains.domain.exception.AgentTimeoutException;
import me.golemcore.chains.domain.exception.ChainsException;
import me.golemcore.chains.domain.exception.MaxIterationsExceededException;
import me.golemcore.chains.domain.exception.MemoryException;
import me.golemcore.chains.domain.exception.ToolException;
import me.golemcore.chains.domain.exception.UnparsableOutputException;
import me.golemcore.chains.domain.model.AgentAction;
import me.golemcore.chains.domain.model.AgentActions;
import me.golemcore.chains.domain.model.AgentDecision;
import me.golemcore.chains.domain.model.AgentFinish;
import me.golemcore.chains.domain.model.AgentStep;
import me.golemcore.chains.domain.model.ChainResult;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.ToolFailureKind;
import me.golemcore.chains.domain.model.ToolResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Runs an {@link Agent} until it gives a final answer.
 *
 * <p>
 * Each iteration makes one model call through the agent, runs the requested
 * tools and appends the observations to the scratchpad. Unknown tools, usage
 * limits and tool failures become observations the model can react to.
 * Unparsable replies are answered with a format reminder up to
 * {@code maxParseRetries} consecutive times.
 *
 * <p>
 * Bounds are checked before every model call: the iteration budget counts
 * model calls and the time budget is measured from the start of the call, so
 * a running tool is never interrupted. Cancelling the returned future cancels
 * the pending model call or tool futures, stops the loop and skips the memory
 * save.
 */
@Slf4j
public class AgentExecutor implements Chain {

    static final String PARSE_FAILURE_TOOL = "_exception";

    @Getter
    private final Agent agent;
    @Getter
    private final MemoryComponent memory;
    @Getter
    private final AgentExecutorSettings settings;
    private final ToolCatalog catalog;
    private final ToolInputs toolInputs;
    private final Clock clock;

    @Builder
    private AgentExecutor(Agent agent, MemoryComponent memory, AgentExecutorSettings settings, Clock clock,
            ObjectMapper objectMapper) {
        this.agent = Objects.requireNonNull(agent, "agent");
        this.memory = memory;
        this.settings = settings != null ? settings : AgentExecutorSettings.defaults();
        if (this.settings.getMaxIterations() <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        if (this.settings.getMaxParseRetries() < 0) {
            throw new IllegalArgumentException("maxParseRetries must not be negative");
        }
        this.catalog = new ToolCatalog(agent.getTools());
        this.toolInputs = new ToolInputs(objectMapper != null ? objectMapper : new ObjectMapper());
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public CompletableFuture<ChainResult> call(ChainValues inputs, ChainCallOptions options) {
        ChainCallOptions effective = options != null ? options : ChainCallOptions.defaults();
        ChainValues values = inputs;
        try {
            effective.validate();
            if (memory != null && !values.containsKey(Agent.CHAT_HISTORY_KEY)) {
                values = values.with(Agent.CHAT_HISTORY_KEY, ConversationMemory.load(memory));
            }
        } catch (IllegalArgumentException | MemoryException e) {
            return CompletableFuture.failedFuture(e);
        }
        Invocation invocation = new Invocation(values, effective);
        invocation.run();
        return invocation.result;
    }

    @Override
    public List<String> getInputKeys() {
        return agent.getInputKeys();
    }

    @Override
    public List<String> getOutputKeys() {
        if (settings.isReturnIntermediateSteps()) {
            return List.of(settings.getOutputKey(), AgentExecutorSettings.INTERMEDIATE_STEPS_KEY);
        }
        return List.of(settings.getOutputKey());
    }

    /**
     * State of one agent run. Never shared between calls.
     */
    private final class Invocation {

        private final CompletableFuture<ChainResult> result = new CompletableFuture<>();
        private final ChainValues values;
        private final ChainCallOptions planOptions;
        private final int maxIterations;
        private final Duration timeout;
        private final Instant deadline;
        private final List<AgentStep> steps = new ArrayList<>();
        private final List<CompletableFuture<?>> inFlight = new CopyOnWriteArrayList<>();
        private final Map<String, Integer> toolUsage = new HashMap<>();
        private int modelCalls;
        private int parseFailures;

        private Invocation(ChainValues values, ChainCallOptions options) {
            this.values = values;
            this.planOptions = options.toBuilder().streamingSink(null).build();
            this.maxIterations = options.getMaxIterations() != null
                    ? options.getMaxIterations()
                    : settings.getMaxIterations();
            this.timeout = options.getTimeout() != null ? options.getTimeout() : settings.getTimeout();
            this.deadline = timeout != null ? clock.instant().plus(timeout) : null;
            result.whenComplete((ignored, error) -> {
                if (result.isCancelled()) {
                    cancelInFlight();
                }
            });
        }

        /**
         * Runs turns until one suspends on an incomplete future or the result is
         * settled. Turns that complete synchronously are looped here rather than
         * chained through callbacks, so the stack depth does not grow with the
         * number of iterations.
         */
        private void run() {
            try {
                while (!result.isDone()) {
                    CompletableFuture<Void> turn = turn();
                    if (!turn.isDone()) {
                        turn.whenComplete((ignored, error) -> resume(error));
                        return;
                    }
                    if (turn.isCompletedExceptionally()) {
                        turn.whenComplete((ignored, error) -> fail(error));
                        return;
                    }
                }
            } catch (RuntimeException e) {
                fail(e);
            }
        }

        private void resume(Throwable error) {
            if (error != null) {
                fail(error);
            } else {
                run();
            }
        }

        private void fail(Throwable error) {
            if (result.isDone()) {
                log.debug("[Agent] Invocation already settled, dropping: {}", error.toString());
                return;
            }
            Throwable cause = ChainFutures.unwrap(error);
            if (!(cause instanceof ChainsException)) {
                log.error("[Agent] Run failed unexpectedly", cause);
            }
            result.completeExceptionally(ChainFutures.toChainFailure(cause, "Agent run"));
        }

        private CompletableFuture<Void> turn() {
            inFlight.clear();
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                log.warn("[Agent] Time budget {} exhausted after {} model call(s)", timeout, modelCalls);
                result.completeExceptionally(new AgentTimeoutException(timeout, steps));
                return CompletableFuture.completedFuture(null);
            }
            if (modelCalls >= maxIterations) {
                log.warn("[Agent] Iteration budget {} exhausted", maxIterations);
                result.completeExceptionally(new MaxIterationsExceededException(maxIterations, steps));
                return CompletableFuture.completedFuture(null);
            }
            if (settings.isForceFinalAnswer() && maxIterations > 1 && modelCalls == maxIterations - 1
                    && !steps.isEmpty()) {
                steps.add(AgentStep.of(null, AgentPrompts.FORCE_FINAL_ANSWER));
            }
            modelCalls++;
            log.debug("[Agent] Thinking, iteration {}/{}", modelCalls, maxIterations);

            CompletableFuture<AgentDecision> decision;
            try {
                decision = agent.plan(List.copyOf(steps), values, planOptions);
            } catch (RuntimeException e) {
                decision = CompletableFuture.failedFuture(e);
            }
            track(decision);
            return decision
                    .handle((next, error) -> error != null ? onPlanFailure(error) : onDecision(next))
                    .thenCompose(Function.identity());
        }

        private CompletableFuture<Void> onPlanFailure(Throwable error) {
            Throwable cause = ChainFutures.unwrap(error);
            if (!(cause instanceof UnparsableOutputException unparsable)) {
                throw ChainFutures.toChainFailure(cause, "Agent model call");
            }
            parseFailures++;
            if (parseFailures > settings.getMaxParseRetries()) {
                log.warn("[Agent] Giving up after {} unparsable replies", parseFailures);
                throw new AgentParseException(parseFailures, steps, unparsable);
            }
            log.warn("[Agent] Unparsable reply ({}/{}): {}", parseFailures, settings.getMaxParseRetries(),
                    unparsable.getMessage());
            String raw = unparsable.getRawText();
            steps.add(new AgentStep(AgentAction.of(PARSE_FAILURE_TOOL, raw, raw), AgentPrompts.INVALID_FORMAT_ERROR,
                    ToolFailureKind.INVALID_FORMAT));
            return CompletableFuture.completedFuture(null);
        }

        private CompletableFuture<Void> onDecision(AgentDecision decision) {
            parseFailures = 0;
            if (decision instanceof AgentFinish finish) {
                finish(finish);
                return CompletableFuture.completedFuture(null);
            }
            if (!(decision instanceof AgentActions actions)) {
                throw new IllegalStateException("Agent returned no decision");
            }
            List<CompletableFuture<AgentStep>> pending = new ArrayList<>();
            for (AgentAction action : actions.actions()) {
                pending.add(act(action));
            }
            return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).thenRun(() -> {
                for (CompletableFuture<AgentStep> step : pending) {
                    steps.add(step.join());
                }
            });
        }

        private void track(CompletableFuture<?> future) {
            inFlight.add(future);
            if (result.isCancelled()) {
                future.cancel(true);
            }
        }

        private void cancelInFlight() {
            log.debug("[Agent] Invocation cancelled after {} model call(s)", modelCalls);
            for (CompletableFuture<?> future : inFlight) {
                future.cancel(true);
            }
        }

        private CompletableFuture<AgentStep> act(AgentAction action) {
            ToolComponent tool = catalog.find(action.tool());
            if (tool == null) {
                log.warn("[Agent] Model requested unknown tool: {}", action.tool());
                return CompletableFuture.completedFuture(new AgentStep(action,
                        String.format(AgentPrompts.TOOL_NOT_FOUND, action.tool()), ToolFailureKind.NOT_FOUND));
            }
            String name = tool.getToolName();
            int used = toolUsage.merge(name, 1, Integer::sum);
            if (tool.getUsageLimit() > 0 && used > tool.getUsageLimit()) {
                log.warn("[Agent] Tool {} exceeded its usage limit of {}", name, tool.getUsageLimit());
                return CompletableFuture.completedFuture(new AgentStep(action,
                        String.format(AgentPrompts.TOOL_USAGE_LIMIT, name), ToolFailureKind.USAGE_LIMIT_EXCEEDED));
            }

            String input = toolInputs.normalize(action.toolInput());
            log.debug("[Agent] Calling tool {} with input: {}", name, input);
            CompletableFuture<ToolResult> execution;
            try {
                execution = tool.execute(input);
            } catch (RuntimeException e) {
                execution = CompletableFuture.failedFuture(e);
            }
            track(execution);
            return execution.handle((toolResult, error) -> {
                String failure = null;
                if (error != null) {
                    failure = String.valueOf(ChainFutures.unwrap(error).getMessage());
                } else if (toolResult == null) {
                    failure = "no result";
                } else if (!toolResult.isSuccess()) {
                    failure = toolResult.getError() != null ? toolResult.getError() : "unknown error";
                }
                if (failure == null) {
                    return AgentStep.of(action, toolResult.getOutput());
                }
                log.warn("[Agent] Tool {} failed: {}", name, failure);
                if (settings.isStopOnToolFailure()) {
                    throw new ToolException(name, "Tool " + name + " failed: " + failure,
                            error != null ? ChainFutures.unwrap(error) : null);
                }
                return new AgentStep(action, String.format(AgentPrompts.TOOL_ERROR, failure),
                        ToolFailureKind.EXECUTION_FAILED);
            });
        }

        private void finish(AgentFinish finish) {
            if (result.isDone()) {
                log.debug("[Agent] Invocation cancelled, final answer discarded");
                return;
            }
            String output = finish.output();
            if (memory != null) {
                String input = values.containsKey(Agent.INPUT_KEY) ? values.getText(Agent.INPUT_KEY) : "";
                ConversationMemory.saveTurn(memory, input, output);
            }
            ChainValues outputs = ChainValues.of(settings.getOutputKey(), output);
            if (settings.isReturnIntermediateSteps()) {
                outputs = outputs.with(AgentExecutorSettings.INTERMEDIATE_STEPS_KEY, List.copyOf(steps));
            }
            log.info("[Agent] Finished after {} model call(s) and {} step(s)", modelCalls, steps.size());
            result.complete(new ChainResult(outputs, output, null, steps));
        }
    }
}
