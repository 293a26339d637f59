package me.golemcore.chains.domain.agent;

import me.golemcore.chains.domain.component.ToolComponent;
import me.golemcore.chains.domain.model.ToolDefinition;
import me.golemcore.chains.tools.FunctionTool;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolCatalogTest {

    private final FunctionTool search = FunctionTool.builder()
            .name("web_search")
            .description("Searches the web")
            .function(input -> "")
            .build();
    private final FunctionTool calculator = FunctionTool.builder()
            .name("calculator")
            .description("Evaluates arithmetic")
            .function(input -> "")
            .build();

    @Test
    void shouldDescribeToolsInRegistrationOrder() {
        ToolCatalog catalog = new ToolCatalog(List.of(search, calculator));

        assertEquals("> web_search: Searches the web\n> calculator: Evaluates arithmetic", catalog.describe());
        assertEquals("web_search, calculator", catalog.names());
    }

    @Test
    void shouldFindByExactOrNormalizedName() {
        ToolCatalog catalog = new ToolCatalog(List.of(search, calculator));

        assertSame(search, catalog.find("web_search"));
        assertSame(search, catalog.find(" Web Search "));
        assertNull(catalog.find("browser"));
        assertNull(catalog.find(null));
    }

    @Test
    void shouldSkipDisabledTools() {
        ToolComponent disabled = mock(ToolComponent.class);
        when(disabled.isEnabled()).thenReturn(false);
        when(disabled.getToolName()).thenReturn("hidden");

        ToolCatalog catalog = new ToolCatalog(List.of(search, disabled));

        assertEquals(List.of(search), catalog.getTools());
        assertNull(catalog.find("hidden"));
    }

    @Test
    void shouldRejectDuplicateNames() {
        FunctionTool duplicate = FunctionTool.builder().name("calculator").function(input -> "").build();

        assertThrows(IllegalArgumentException.class, () -> new ToolCatalog(List.of(calculator, duplicate)));
    }

    @Test
    void shouldExposeTextInputSchema() {
        ToolDefinition definition = calculator.getDefinition();

        assertEquals("object", definition.getInputSchema().get("type"));
        assertEquals(List.of("input"), definition.getInputSchema().get("required"));
    }
}
