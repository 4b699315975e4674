package com.z254.butterfly.conclave.tool;

import java.util.Map;

/**
 * Process-local implementation of a tool.
 */
@FunctionalInterface
public interface ToolCallback {

    /**
     * @param arguments named arguments as requested by the LLM
     * @return the tool result as text
     */
    String call(Map<String, Object> arguments);
}
