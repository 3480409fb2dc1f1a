package io.turnstile.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.turnstile.core.tool.impl.PositioningReadinessTool;
import io.turnstile.core.tool.impl.ProductAnalysisTool;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

    @Test
    void shouldExposeDefinitionsOrderedByName() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new ProductAnalysisTool());
        registry.register(new PositioningReadinessTool());

        List<Map<String, Object>> definitions = registry.toolDefinitions();

        assertThat(definitions).hasSize(2);
        assertThat(definitions).extracting(definition -> (Object) ((Map<?, ?>) definition.get("function")).get("name"))
            .containsExactly("analyze_product", "calculate_positioning_readiness");
        assertThat(definitions.get(0)).containsEntry("type", "function");
    }

    @Test
    void shouldFindRegisteredToolsByName() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new ProductAnalysisTool());

        assertThat(registry.find("analyze_product")).isPresent();
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void shouldRejectBlankNames() {
        ToolRegistry registry = new ToolRegistry();
        Tool nameless = new Tool() {
            @Override
            public String name() {
                return " ";
            }

            @Override
            public String description() {
                return "";
            }

            @Override
            public String execute(Map<String, Object> input, ToolContext context) {
                return "";
            }
        };

        assertThatThrownBy(() -> registry.register(nameless)).isInstanceOf(IllegalArgumentException.class);
    }
}
