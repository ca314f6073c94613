package io.ragent.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

    @Test
    void shouldRegisterAndResolveTool() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new EchoTool());

        assertThat(registry.find("echo")).isPresent();
        assertThat(registry.find("echo").orElseThrow().execute(Map.of("text", "ok"), new ToolContext(null)))
            .isEqualTo("ok");
        assertThat(registry.find("missing")).isEmpty();
    }

    @Test
    void shouldRejectDuplicateNames() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new EchoTool());

        assertThatThrownBy(() -> registry.register(new EchoTool()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("echo");
    }

    @Test
    void specsShouldExposeSchemaAsFunctionDefinition() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new EchoTool());

        List<ToolSpec> specs = registry.specs();

        assertThat(specs).extracting(ToolSpec::name).containsExactly("echo");
        assertThat(specs.get(0).toFunctionDefinition()).containsEntry("type", "function");
        assertThat(specs.get(0).parameters()).containsKey("required");
    }

    @Test
    void shouldValidateRequiredArgumentsAndTypes() {
        ToolRegistry registry = new ToolRegistry();
        EchoTool tool = new EchoTool();

        assertThatCode(() -> registry.validate(tool, Map.of("text", "hi", "times", 2))).doesNotThrowAnyException();
        assertThatThrownBy(() -> registry.validate(tool, Map.of()))
            .isInstanceOf(ToolArgumentException.class)
            .hasMessageContaining("Missing required argument 'text'");
        assertThatThrownBy(() -> registry.validate(tool, Map.of("text", 5)))
            .isInstanceOf(ToolArgumentException.class)
            .hasMessageContaining("must be of type string");
        assertThatThrownBy(() -> registry.validate(tool, Map.of("text", "hi", "times", 1.5)))
            .isInstanceOf(ToolArgumentException.class);
    }

    private static final class EchoTool implements Tool {
        @Override
        public String name() {
            return "echo";
        }

        @Override
        public String description() {
            return "Echo tool";
        }

        @Override
        public Map<String, Object> schema() {
            return Map.of(
                "type", "object",
                "properties", Map.of(
                    "text", Map.of("type", "string"),
                    "times", Map.of("type", "integer")
                ),
                "required", List.of("text")
            );
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            return String.valueOf(input.getOrDefault("text", ""));
        }
    }
}
