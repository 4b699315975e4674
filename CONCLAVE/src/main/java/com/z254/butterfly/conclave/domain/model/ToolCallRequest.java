package com.z254.butterfly.conclave.domain.model;

import java.util.Map;

/**
 * A tool invocation requested by the LLM.
 *
 * @param id        call id used to correlate the tool result
 * @param name      tool name
 * @param arguments named arguments
 */
public record ToolCallRequest(String id, String name, Map<String, Object> arguments) {

    public ToolCallRequest {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }
}
