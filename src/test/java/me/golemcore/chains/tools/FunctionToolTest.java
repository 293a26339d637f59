package me.golemcore.chains.tools;

import me.golemcore.chains.domain.model.ToolFailureKind;
import me.golemcore.chains.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunctionToolTest {

    @Test
    void shouldReturnFunctionOutput() {
        FunctionTool tool = FunctionTool.builder()
                .name("reverse")
                .description("Reverses text")
                .function(input -> new StringBuilder(input).reverse().toString())
                .build();

        ToolResult result = tool.execute("abc").join();

        assertTrue(result.isSuccess());
        assertEquals("cba", result.getOutput());
        assertEquals("reverse", tool.getToolName());
        assertEquals("Reverses text", tool.getDescription());
        assertEquals("tool", tool.getComponentType());
    }

    @Test
    void shouldReportFunctionFailure() {
        FunctionTool tool = FunctionTool.builder()
                .name("divide")
                .function(input -> String.valueOf(1 / Integer.parseInt(input)))
                .build();

        ToolResult result = tool.execute("0").join();

        assertFalse(result.isSuccess());
        assertEquals("/ by zero", result.getError());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
    }

    @Test
    void shouldValidateConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> FunctionTool.builder().name(" ").function(input -> input).build());
        assertThrows(IllegalArgumentException.class,
                () -> FunctionTool.builder().name("x").function(input -> input).usageLimit(-1).build());
        assertThrows(NullPointerException.class, () -> FunctionTool.builder().name("x").build());
    }
}
