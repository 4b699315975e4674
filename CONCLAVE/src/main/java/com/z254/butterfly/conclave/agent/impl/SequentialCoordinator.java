package com.z254.butterfly.conclave.agent.impl;

import com.z254.butterfly.conclave.agent.AgentRuntime;
import com.z254.butterfly.conclave.agent.AgentServices;
import com.z254.butterfly.conclave.context.Context;
import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.domain.model.CollaborationType;
import com.z254.butterfly.conclave.domain.model.Message;
import com.z254.butterfly.conclave.transport.AgentTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Starts a chain of agents: each agent's output is the next agent's request and the last
 * agent answers whoever asked the coordinator.
 */
@Slf4j
public class SequentialCoordinator extends AgentRuntime {

    private final List<String> agents;

    public SequentialCoordinator(String name, String description, AgentTransport transport,
                                 AgentServices services, List<String> agents) {
        super(name, description, transport, services);
        if (agents.isEmpty()) {
            throw new IllegalArgumentException("Sequential coordinator " + name + " needs at least one agent");
        }
        this.agents = List.copyOf(agents);
    }

    public List<String> getAgents() {
        return agents;
    }

    @Override
    protected Optional<String> processRequest(Message request, List<ChatMessage> history) {
        String chatId = request.getChatId() != null ? request.getChatId() : UUID.randomUUID().toString();
        Context context = registry.getOrCreateContext(request.getContextName());
        context.setCollaborationType(chatId, CollaborationType.SEQUENTIAL);
        context.setAgentSequence(chatId, agents);
        context.setRouteResponseTo(chatId, request.getSender() != null ? request.getSender() : name);
        context.addQuery(chatId, request.getContent());

        log.info("Starting sequence {} for chat {}", agents, chatId);
        sendRequest(Message.request(context.getName(), chatId, request.getContent()), agents.get(0));
        return Optional.empty();
    }

    @Override
    protected void processResponse(Message response) {
        log.info("Sequence for chat {} finished with response from {}", response.getChatId(), response.getSender());
    }
}
