package com.z254.butterfly.conclave.llm;

import com.z254.butterfly.conclave.domain.model.ToolCallRequest;

import java.util.List;

/**
 * Assistant turn returned by an {@link LlmClient}.
 *
 * @param content   text content, may be null when the model only calls tools
 * @param toolCalls requested tool calls, empty when none
 */
public record LlmCompletion(String content, List<ToolCallRequest> toolCalls) {

    public LlmCompletion {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static LlmCompletion text(String content) {
        return new LlmCompletion(content, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
