package com.z254.butterfly.conclave.tool;

import com.z254.butterfly.conclave.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for Tool.
 */
class ToolTest {

    @Test
    void shouldEchoArgumentsWithoutCallback() {
        Tool tool = Tool.builder().name("echo").build();

        assertThat(tool.invoke(Map.of("city", "Oslo"))).isEqualTo("{\"city\":\"Oslo\"}");
        assertThat(tool.invoke(null)).isEqualTo("{}");
    }

    @Test
    void shouldRunCallback() {
        Tool tool = Tool.builder()
                .name("weather")
                .callback(args -> "Sunny in " + args.get("city"))
                .build();

        assertThat(tool.invoke(Map.of("city", "Oslo"))).isEqualTo("Sunny in Oslo");
    }

    @Test
    void shouldDescribeAsFunction() {
        Map<String, Object> schema = Map.of("type", "object", "properties", Map.of("city", Map.of("type", "string")));
        Tool tool = Tool.builder().name("weather").description("Current weather").parametersSchema(schema).build();

        ToolDefinition definition = tool.toDefinition();

        assertThat(definition.type()).isEqualTo(ToolDefinition.FUNCTION_TYPE);
        assertThat(definition.function().name()).isEqualTo("weather");
        assertThat(definition.function().description()).isEqualTo("Current weather");
        assertThat(definition.function().parameters()).isEqualTo(schema);
    }
}
