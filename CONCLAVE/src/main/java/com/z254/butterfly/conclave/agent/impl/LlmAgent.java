package com.z254.butterfly.conclave.agent.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.conclave.agent.AgentRuntime;
import com.z254.butterfly.conclave.agent.AgentServices;
import com.z254.butterfly.conclave.context.Context;
import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.domain.model.Message;
import com.z254.butterfly.conclave.domain.model.ToolCallRequest;
import com.z254.butterfly.conclave.domain.model.ToolDefinition;
import com.z254.butterfly.conclave.llm.LlmClient;
import com.z254.butterfly.conclave.llm.LlmCompletion;
import com.z254.butterfly.conclave.support.ConclaveJson;
import com.z254.butterfly.conclave.tool.Tool;
import com.z254.butterfly.conclave.transport.AgentTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent answering requests with an LLM.
 *
 * <p>The chat sent to the model is the system message, the history the collaboration type
 * exposes, and the request. Tools listed in the context for the chat are offered to the
 * model. Function tools run in place. Agent tools are sent as requests to the agent of the
 * same name on a sub-chat; the conversation is suspended and resumes once every pending
 * call of the chat has been answered.
 *
 * <p>Tool rounds are bounded; when the bound is reached the model is asked to answer
 * without tools.
 */
@Slf4j
public class LlmAgent extends AgentRuntime {

    private static final ObjectMapper JSON = ConclaveJson.mapper();

    private final LlmClient llm;
    private final String systemMessage;
    private final int maxToolRounds;

    // Conversations waiting for agent tools, keyed by chat id
    private final Map<String, SuspendedChat> suspended = new ConcurrentHashMap<>();
    // Outstanding agent tool calls, keyed by sub-chat id
    private final Map<String, PendingCall> pendingCalls = new ConcurrentHashMap<>();

    public LlmAgent(String name, String description, AgentTransport transport, AgentServices services,
                    LlmClient llm, String systemMessage, int maxToolRounds) {
        super(name, description, transport, services);
        this.llm = llm;
        this.systemMessage = systemMessage;
        this.maxToolRounds = maxToolRounds;
    }

    @Override
    protected Optional<String> processRequest(Message request, List<ChatMessage> history) {
        String chatKey = request.getChatId() != null ? request.getChatId() : request.getId();
        Context context = registry.getOrCreateContext(request.getContextName());
        List<ToolDefinition> tools = context.getAvailableTools(chatKey);

        List<ChatMessage> messages = new ArrayList<>();
        if (systemMessage != null && !systemMessage.isBlank()) {
            messages.add(ChatMessage.system(systemMessage));
        }
        messages.addAll(history);
        ChatMessage query = ChatMessage.user(request.getContent());
        if (!history.contains(query)) {
            messages.add(query);
        }

        if (tools.isEmpty() && messages.size() == 1) {
            log.debug("Agent {} sending single prompt to {}", name, llm.getProviderId());
            return Optional.ofNullable(llm.processSinglePrompt(request.getContent()));
        }
        return converse(new SuspendedChat(request, chatKey, messages, tools, 0));
    }

    @Override
    protected void processResponse(Message response) {
        if (response.isAck()) {
            log.debug("Agent {} got acknowledgment from {}", name, response.getSender());
            return;
        }
        PendingCall call = pendingCalls.remove(response.getChatId() == null ? "" : response.getChatId());
        if (call == null) {
            log.warn("Agent {} got unexpected response from {} on chat {}",
                    name, response.getSender(), response.getChatId());
            return;
        }
        SuspendedChat chat = suspended.get(call.chatKey());
        if (chat == null) {
            log.warn("Agent {} has no suspended conversation {}", name, call.chatKey());
            return;
        }
        chat.messages().add(ChatMessage.toolResult(call.toolCallId(), call.toolName(), response.getContent()));
        Context context = registry.getOrCreateContext(chat.request().getContextName());
        context.removeRequiredToolCall(call.chatKey(), call.toolName());

        boolean waiting = pendingCalls.values().stream().anyMatch(p -> p.chatKey().equals(call.chatKey()));
        if (waiting || !context.getRequiredToolCalls(call.chatKey()).isEmpty()) {
            return;
        }
        suspended.remove(call.chatKey());
        converse(chat).ifPresent(output -> routeResponse(chat.request(), output));
    }

    /**
     * Runs model turns until the model answers in text, or suspends the conversation when an
     * agent tool was called.
     */
    private Optional<String> converse(SuspendedChat chat) {
        Context context = registry.getOrCreateContext(chat.request().getContextName());
        int round = chat.round();
        while (true) {
            List<ToolDefinition> offered = round < maxToolRounds ? chat.tools() : List.of();
            LlmCompletion completion = llm.processChatCompletion(List.copyOf(chat.messages()), offered);
            if (!completion.hasToolCalls() || offered.isEmpty()) {
                return Optional.ofNullable(completion.content());
            }
            round++;
            chat.messages().add(ChatMessage.assistantToolCalls(completion.content(), completion.toolCalls()));

            List<ToolCallRequest> delegated = new ArrayList<>();
            for (ToolCallRequest toolCall : completion.toolCalls()) {
                Optional<Tool> tool = registry.getTool(toolCall.name());
                if (tool.isEmpty()) {
                    log.warn("Agent {} asked for unknown tool {}", name, toolCall.name());
                    chat.messages().add(ChatMessage.toolResult(toolCall.id(), toolCall.name(),
                            "Unknown tool: " + toolCall.name()));
                    continue;
                }
                context.appendRequiredToolCall(chat.chatKey(), toolCall.name());
                if (tool.get().isAgentTool()) {
                    delegated.add(toolCall);
                } else {
                    String result = tool.get().invoke(toolCall.arguments());
                    chat.messages().add(ChatMessage.toolResult(toolCall.id(), toolCall.name(), result));
                    context.removeRequiredToolCall(chat.chatKey(), toolCall.name());
                }
            }
            if (!delegated.isEmpty()) {
                SuspendedChat waiting = chat.withRound(round);
                suspended.put(chat.chatKey(), waiting);
                delegated.forEach(toolCall -> delegate(waiting, toolCall));
                return Optional.empty();
            }
        }
    }

    private void delegate(SuspendedChat chat, ToolCallRequest toolCall) {
        String subChat = chat.chatKey() + ":" + toolCall.id();
        pendingCalls.put(subChat, new PendingCall(chat.chatKey(), toolCall.id(), toolCall.name()));
        String content;
        try {
            content = JSON.writeValueAsString(toolCall.arguments());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Arguments of tool call " + toolCall.id() + " are not serializable", e);
        }
        log.debug("Agent {} delegating tool call {} to agent {}", name, toolCall.id(), toolCall.name());
        sendRequest(Message.request(chat.request().getContextName(), subChat, content), toolCall.name());
    }

    private record SuspendedChat(Message request, String chatKey, List<ChatMessage> messages,
                                 List<ToolDefinition> tools, int round) {

        SuspendedChat withRound(int next) {
            return new SuspendedChat(request, chatKey, messages, tools, next);
        }
    }

    private record PendingCall(String chatKey, String toolCallId, String toolName) {
    }
}
