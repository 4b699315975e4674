package com.z254.butterfly.conclave.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Role-tagged record of a chat history, in the shape chat-completion APIs expect.
 *
 * @param role       system, user, assistant or tool
 * @param content    text content, may be null for assistant tool-call turns
 * @param name       tool name for tool results
 * @param toolCallId id of the tool call a tool result answers
 * @param toolCalls  tool calls requested by an assistant turn
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
        String role,
        String content,
        String name,
        String toolCallId,
        List<ToolCallRequest> toolCalls
) {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    public static ChatMessage system(String content) {
        return new ChatMessage(ROLE_SYSTEM, content, null, null, null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(ROLE_USER, content, null, null, null);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ROLE_ASSISTANT, content, null, null, null);
    }

    public static ChatMessage assistantToolCalls(String content, List<ToolCallRequest> toolCalls) {
        return new ChatMessage(ROLE_ASSISTANT, content, null, null, List.copyOf(toolCalls));
    }

    public static ChatMessage toolResult(String toolCallId, String toolName, String content) {
        return new ChatMessage(ROLE_TOOL, content, toolName, toolCallId, null);
    }

    public boolean isAssistant() {
        return ROLE_ASSISTANT.equals(role);
    }
}
