package com.z254.butterfly.conclave.registry;

import com.z254.butterfly.conclave.tool.Tool;

import java.util.Map;

/**
 * Stored form of a {@link Tool}, without its callback.
 */
public record ToolDescriptor(String name, String description, Map<String, Object> parametersSchema,
                             boolean agentTool) {

    static ToolDescriptor of(Tool tool) {
        return new ToolDescriptor(tool.getName(), tool.getDescription(), tool.getParametersSchema(),
                tool.isAgentTool());
    }

    Tool toTool() {
        return Tool.builder()
                .name(name)
                .description(description)
                .parametersSchema(parametersSchema == null ? Map.of() : parametersSchema)
                .agentTool(agentTool)
                .build();
    }
}
