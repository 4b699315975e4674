package com.z254.butterfly.conclave.domain.model;

import java.util.Map;

/**
 * Tool descriptor in function-calling format, as offered to the LLM for a chat.
 *
 * @param type     always {@code function}
 * @param function the function signature
 */
public record ToolDefinition(String type, FunctionDefinition function) {

    public static final String FUNCTION_TYPE = "function";

    public static ToolDefinition function(String name, String description, Map<String, Object> parameters) {
        return new ToolDefinition(FUNCTION_TYPE, new FunctionDefinition(name, description, parameters));
    }

    public String name() {
        return function != null ? function.name() : null;
    }

    /**
     * Function signature with JSON Schema parameters.
     */
    public record FunctionDefinition(String name, String description, Map<String, Object> parameters) {
    }
}
