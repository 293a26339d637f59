package me.golemcore.chains.domain.agent;

import me.golemcore.chains.adapter.outbound.memory.SimpleMemory;
import me.golemcore.chains.domain.chain.ChainCallOptions;
import me.golemcore.chains.domain.component.MemoryComponent;
import me.golemcore.chains.domain.component.ToolComponent;
import me.golemcore.chains.domain.exception.AgentParseException;
import me.golemcore.chains.domain.exception.AgentTimeoutException;
import me.golemcore.chains.domain.exception.ChainsException;
import me.golemcore.chains.domain.exception.ErrorKind;
import me.golemcore.chains.domain.exception.MaxIterationsExceededException;
import me.golemcore.chains.domain.exception.MemoryException;
import me.golemcore.chains.domain.exception.ToolException;
import me.golemcore.chains.domain.model.AgentAction;
import me.golemcore.chains.domain.model.AgentActions;
import me.golemcore.chains.domain.model.AgentDecision;
import me.golemcore.chains.domain.model.AgentFinish;
import me.golemcore.chains.domain.model.AgentStep;
import me.golemcore.chains.domain.model.ChainResult;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.Message;
import me.golemcore.chains.domain.model.ToolDefinition;
import me.golemcore.chains.domain.model.ToolFailureKind;
import me.golemcore.chains.domain.model.ToolResult;
import me.golemcore.chains.testsupport.ScriptedLlmPort;
import me.golemcore.chains.tools.FunctionTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentExecutorTest {

    private static final String LOOKUP = "{\"action\": \"lookup\", \"action_input\": \"population of Oslo\"}";
    private static final String FINAL = "```json\n{\"final_answer\": \"About 700,000 people.\"}\n```";

    private ScriptedLlmPort llm;
    private AtomicInteger lookups;
    private FunctionTool lookupTool;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLlmPort();
        lookups = new AtomicInteger();
        lookupTool = FunctionTool.builder()
                .name("lookup")
                .description("Looks up facts")
                .function(input -> {
                    lookups.incrementAndGet();
                    return "Oslo has 700,000 inhabitants";
                })
                .build();
    }

    private AgentExecutor executor(AgentExecutorSettings settings, ToolComponent... tools) {
        return AgentExecutor.builder()
                .agent(ConversationalAgent.builder().llmPort(llm).tools(List.of(tools)).build())
                .settings(settings)
                .build();
    }

    private static String lastMessage(ScriptedLlmPort port) {
        List<Message> messages = port.lastRequest().getMessages();
        return messages.get(messages.size() - 1).getContent();
    }

    @Test
    void shouldFinishWithoutToolsAndSaveMemory() {
        llm.reply(FINAL);
        SimpleMemory memory = new SimpleMemory();
        AgentExecutor executor = AgentExecutor.builder()
                .agent(ConversationalAgent.builder().llmPort(llm).tools(List.of(lookupTool)).build())
                .memory(memory)
                .build();

        ChainResult result = executor.call(ChainValues.of("input", "How many people live in Oslo?")).join();

        assertEquals("About 700,000 people.", result.text());
        assertEquals("About 700,000 people.", result.outputs().get("output"));
        assertEquals(1, llm.getCallCount());
        assertEquals(List.of(Message.human("How many people live in Oslo?"), Message.ai("About 700,000 people.")),
                memory.load());
    }

    @Test
    void shouldFeedToolObservationIntoNextPrompt() {
        llm.reply(LOOKUP).reply(FINAL);

        ChainResult result = executor(AgentExecutorSettings.defaults(), lookupTool)
                .call(ChainValues.of("input", "How many people live in Oslo?")).join();

        assertEquals("About 700,000 people.", result.text());
        assertEquals(2, llm.getCallCount());
        assertEquals(1, lookups.get());
        assertEquals(1, result.steps().size());
        assertEquals("Oslo has 700,000 inhabitants", result.steps().get(0).observation());
        assertTrue(lastMessage(llm).contains("TOOL RESPONSE:"));
        assertTrue(lastMessage(llm).contains("Oslo has 700,000 inhabitants"));
    }

    @Test
    void shouldStopAfterExactlyMaxIterationsModelCalls() {
        llm.reply(LOOKUP);
        AgentExecutor executor = executor(AgentExecutorSettings.builder().maxIterations(3).build(), lookupTool);

        CompletionException error = assertThrows(CompletionException.class,
                () -> executor.call(ChainValues.of("input", "loop forever")).join());

        MaxIterationsExceededException exceeded = assertInstanceOf(MaxIterationsExceededException.class,
                error.getCause());
        assertEquals(3, llm.getCallCount());
        assertEquals(4, exceeded.getSteps().size());
        assertNull(exceeded.getSteps().get(2).action());
        assertEquals(3, lookups.get());
        assertTrue(llm.getRequests().get(2).getMessages().stream()
                .anyMatch(m -> m.getContent().contains(AgentPrompts.FORCE_FINAL_ANSWER)));
    }

    @Test
    void shouldHonourMaxIterationsFromCallOptions() {
        llm.reply(LOOKUP);
        AgentExecutor executor = executor(AgentExecutorSettings.defaults(), lookupTool);

        CompletionException error = assertThrows(CompletionException.class,
                () -> executor.call(ChainValues.of("input", "loop"),
                        ChainCallOptions.builder().maxIterations(1).build()).join());

        assertInstanceOf(MaxIterationsExceededException.class, error.getCause());
        assertEquals(1, llm.getCallCount());
    }

    @Test
    void shouldReportUnknownToolAsObservation() {
        llm.reply("{\"action\": \"search\", \"action_input\": \"Oslo\"}").reply(FINAL);

        ChainResult result = executor(AgentExecutorSettings.defaults(), lookupTool)
                .call(ChainValues.of("input", "How many people live in Oslo?")).join();

        AgentStep step = result.steps().get(0);
        assertEquals(ToolFailureKind.NOT_FOUND, step.failureKind());
        assertTrue(lastMessage(llm).contains("search is not a tool"));
        assertEquals(0, lookups.get());
    }

    @Test
    void shouldMatchToolNameLoosely() {
        llm.reply("{\"action\": \"Lookup\", \"action_input\": \"Oslo\"}").reply(FINAL);

        ChainResult result = executor(AgentExecutorSettings.defaults(), lookupTool)
                .call(ChainValues.of("input", "How many people live in Oslo?")).join();

        assertEquals(1, lookups.get());
        assertNull(result.steps().get(0).failureKind());
    }

    @Test
    void shouldTurnToolFailureIntoObservation() {
        FunctionTool broken = FunctionTool.builder()
                .name("lookup")
                .description("Always fails")
                .function(input -> {
                    throw new IllegalStateException("service unavailable");
                })
                .build();
        llm.reply(LOOKUP).reply(FINAL);

        ChainResult result = executor(AgentExecutorSettings.defaults(), broken)
                .call(ChainValues.of("input", "How many people live in Oslo?")).join();

        AgentStep step = result.steps().get(0);
        assertEquals(ToolFailureKind.EXECUTION_FAILED, step.failureKind());
        assertEquals("The tool return the following error: service unavailable", step.observation());
        assertEquals("About 700,000 people.", result.text());
    }

    @Test
    void shouldFailOnToolErrorWhenConfigured() {
        FunctionTool broken = FunctionTool.builder()
                .name("lookup")
                .function(input -> {
                    throw new IllegalStateException("service unavailable");
                })
                .build();
        llm.reply(LOOKUP).reply(FINAL);
        AgentExecutor executor = executor(AgentExecutorSettings.builder().stopOnToolFailure(true).build(), broken);

        CompletionException error = assertThrows(CompletionException.class,
                () -> executor.call(ChainValues.of("input", "Oslo?")).join());

        ToolException toolError = assertInstanceOf(ToolException.class, error.getCause());
        assertTrue(toolError.getMessage().contains("service unavailable"));
        assertEquals(1, llm.getCallCount());
    }

    @Test
    void shouldEnforceToolUsageLimit() {
        FunctionTool limited = FunctionTool.builder()
                .name("lookup")
                .function(input -> {
                    lookups.incrementAndGet();
                    return "ok";
                })
                .usageLimit(1)
                .build();
        llm.reply(LOOKUP).reply(LOOKUP).reply(FINAL);

        ChainResult result = executor(AgentExecutorSettings.defaults(), limited)
                .call(ChainValues.of("input", "Oslo?")).join();

        assertEquals(1, lookups.get());
        assertEquals(ToolFailureKind.USAGE_LIMIT_EXCEEDED, result.steps().get(1).failureKind());
        assertTrue(lastMessage(llm).contains("You have used the tool lookup too many times"));
    }

    @Test
    void shouldRemindModelOfFormatAfterUnparsableReply() {
        llm.reply("I am not sure what to do").reply(FINAL);

        ChainResult result = executor(AgentExecutorSettings.defaults(), lookupTool)
                .call(ChainValues.of("input", "Oslo?")).join();

        assertEquals("About 700,000 people.", result.text());
        assertEquals(ToolFailureKind.INVALID_FORMAT, result.steps().get(0).failureKind());
        assertTrue(lastMessage(llm).contains(AgentPrompts.INVALID_FORMAT_ERROR));
    }

    @Test
    void shouldGiveUpAfterConsecutiveParseFailures() {
        llm.reply("still rambling");
        AgentExecutor executor = executor(AgentExecutorSettings.builder().maxParseRetries(2).build(), lookupTool);

        CompletionException error = assertThrows(CompletionException.class,
                () -> executor.call(ChainValues.of("input", "Oslo?")).join());

        assertInstanceOf(AgentParseException.class, error.getCause());
        assertEquals(3, llm.getCallCount());
    }

    @Test
    void shouldTimeOutBeforeNextModelCall() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        FunctionTool slow = FunctionTool.builder()
                .name("lookup")
                .function(input -> {
                    clock.advance(Duration.ofSeconds(10));
                    return "late";
                })
                .build();
        llm.reply(LOOKUP).reply(FINAL);
        AgentExecutor executor = AgentExecutor.builder()
                .agent(ConversationalAgent.builder().llmPort(llm).tools(List.of(slow)).build())
                .settings(AgentExecutorSettings.builder().timeout(Duration.ofSeconds(5)).build())
                .clock(clock)
                .build();

        CompletionException error = assertThrows(CompletionException.class,
                () -> executor.call(ChainValues.of("input", "Oslo?")).join());

        AgentTimeoutException timeout = assertInstanceOf(AgentTimeoutException.class, error.getCause());
        assertEquals(1, timeout.getSteps().size());
        assertEquals(1, llm.getCallCount());
    }

    @Test
    void shouldReturnIntermediateStepsWhenRequested() {
        llm.reply(LOOKUP).reply(FINAL);
        AgentExecutor executor = executor(
                AgentExecutorSettings.builder().returnIntermediateSteps(true).outputKey("answer").build(), lookupTool);

        ChainResult result = executor.call(ChainValues.of("input", "Oslo?")).join();

        assertEquals(List.of("answer", "intermediate_steps"), executor.getOutputKeys());
        assertEquals("About 700,000 people.", result.outputs().get("answer"));
        assertEquals(result.steps(), result.outputs().get("intermediate_steps"));
    }

    @Test
    void shouldInjectMemoryAsChatHistory() {
        llm.reply(FINAL);
        SimpleMemory memory = new SimpleMemory();
        memory.save(Message.human("I live in Oslo"), Message.ai("Nice city."));
        AgentExecutor executor = AgentExecutor.builder()
                .agent(ConversationalAgent.builder().llmPort(llm).build())
                .memory(memory)
                .build();

        executor.call(ChainValues.of("input", "How many people live in my city?")).join();

        List<Message> messages = llm.lastRequest().getMessages();
        assertEquals(Message.human("I live in Oslo"), messages.get(1));
        assertEquals(Message.ai("Nice city."), messages.get(2));
        assertEquals(4, memory.load().size());
    }

    @Test
    void shouldSkipMemorySaveWhenCancelled() {
        CompletableFuture<AgentDecision> pending = new CompletableFuture<>();
        Agent agent = mock(Agent.class);
        when(agent.getTools()).thenReturn(List.of());
        when(agent.plan(any(), any(), any())).thenReturn(pending);
        SimpleMemory memory = new SimpleMemory();
        AgentExecutor executor = AgentExecutor.builder().agent(agent).memory(memory).build();

        CompletableFuture<ChainResult> call = executor.call(ChainValues.of("input", "Oslo?"));
        call.cancel(true);
        pending.complete(AgentFinish.of("too late"));

        assertTrue(call.isCancelled());
        assertTrue(pending.isCancelled());
        assertTrue(memory.load().isEmpty());
        verify(agent, times(1)).plan(any(), any(), any());
    }

    @Test
    void shouldCancelRunningToolWhenCallIsCancelled() {
        CompletableFuture<ToolResult> running = new CompletableFuture<>();
        ToolComponent slow = new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.builder().name("lookup").description("Slow lookup").build();
            }

            @Override
            public CompletableFuture<ToolResult> execute(String input) {
                return running;
            }
        };
        llm.reply(LOOKUP).reply(FINAL);
        AgentExecutor executor = executor(AgentExecutorSettings.defaults(), slow);

        CompletableFuture<ChainResult> call = executor.call(ChainValues.of("input", "Oslo?"));
        assertFalse(call.isDone());
        call.cancel(true);

        assertTrue(running.isCancelled());
        assertEquals(1, llm.getCallCount());
    }

    @Test
    void shouldFailWhenMemorySaveThrows() {
        llm.reply(FINAL);
        MemoryComponent memory = mock(MemoryComponent.class);
        when(memory.load()).thenReturn(List.of());
        doThrow(new IllegalStateException("disk full")).when(memory).save(any(), any());
        AgentExecutor executor = AgentExecutor.builder()
                .agent(ConversationalAgent.builder().llmPort(llm).build())
                .memory(memory)
                .build();

        CompletableFuture<ChainResult> call = executor.call(ChainValues.of("input", "Oslo?"));

        assertTrue(call.isDone());
        CompletionException error = assertThrows(CompletionException.class, call::join);
        MemoryException memoryError = assertInstanceOf(MemoryException.class, error.getCause());
        assertEquals(ErrorKind.MEMORY, memoryError.getKind());
        assertTrue(memoryError.getMessage().contains("disk full"));
    }

    @Test
    void shouldReturnFailedFutureWhenMemoryLoadThrows() {
        MemoryComponent memory = mock(MemoryComponent.class);
        when(memory.load()).thenThrow(new IllegalStateException("store offline"));
        AgentExecutor executor = AgentExecutor.builder()
                .agent(ConversationalAgent.builder().llmPort(llm).build())
                .memory(memory)
                .build();

        CompletableFuture<ChainResult> call = executor.call(ChainValues.of("input", "Oslo?"));

        CompletionException error = assertThrows(CompletionException.class, call::join);
        assertInstanceOf(MemoryException.class, error.getCause());
        assertEquals(0, llm.getCallCount());
    }

    @Test
    void shouldFailWhenAgentReturnsNoDecision() {
        Agent agent = mock(Agent.class);
        when(agent.getTools()).thenReturn(List.of());
        when(agent.plan(any(), any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        AgentExecutor executor = AgentExecutor.builder().agent(agent).build();

        CompletableFuture<ChainResult> call = executor.call(ChainValues.of("input", "Oslo?"));

        assertTrue(call.isDone());
        CompletionException error = assertThrows(CompletionException.class, call::join);
        assertInstanceOf(ChainsException.class, error.getCause());
    }

    @Test
    void shouldRunManySynchronousIterationsUntilBudgetIsExhausted() {
        AtomicInteger plans = new AtomicInteger();
        Agent agent = mock(Agent.class);
        when(agent.getTools()).thenReturn(List.of());
        when(agent.plan(any(), any(), any())).thenAnswer(invocation -> {
            plans.incrementAndGet();
            return CompletableFuture.completedFuture(AgentActions.of(AgentAction.of("search", "Oslo", "search")));
        });
        AgentExecutor executor = AgentExecutor.builder()
                .agent(agent)
                .settings(AgentExecutorSettings.builder().maxIterations(3000).build())
                .build();

        CompletableFuture<ChainResult> call = executor.call(ChainValues.of("input", "Oslo?"));

        assertTrue(call.isDone());
        CompletionException error = assertThrows(CompletionException.class, call::join);
        assertInstanceOf(MaxIterationsExceededException.class, error.getCause());
        assertEquals(3000, plans.get());
    }

    @Test
    void shouldRejectInvalidSettings() {
        ConversationalAgent agent = ConversationalAgent.builder().llmPort(llm).build();

        assertThrows(IllegalArgumentException.class, () -> AgentExecutor.builder()
                .agent(agent)
                .settings(AgentExecutorSettings.builder().maxIterations(0).build())
                .build());
        assertThrows(IllegalArgumentException.class, () -> AgentExecutor.builder()
                .agent(agent)
                .settings(AgentExecutorSettings.builder().maxParseRetries(-1).build())
                .build());
    }

    private static final class MutableClock extends Clock {

        private volatile Instant now;

        private MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
