package com.z254.butterfly.conclave.llm;

import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.domain.model.ToolDefinition;

import java.util.List;

/**
 * Interface for LLM backends used by {@code LlmAgent}.
 * Calls block the calling agent until the model answers.
 */
public interface LlmClient {

    /**
     * Complete a single prompt.
     *
     * @param prompt the prompt text
     * @return the completion text
     */
    String processSinglePrompt(String prompt);

    /**
     * Complete a chat, offering the given tools.
     *
     * @param messages the conversation so far
     * @param tools    tools the model may call, possibly empty
     * @return the assistant turn, with tool calls when the model requests any
     */
    LlmCompletion processChatCompletion(List<ChatMessage> messages, List<ToolDefinition> tools);

    /**
     * Get the provider ID.
     *
     * @return provider ID (e.g., "openai", "ollama")
     */
    String getProviderId();
}
