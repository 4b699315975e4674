package com.z254.butterfly.conclave.agent.impl;

import com.z254.butterfly.conclave.agent.AgentRuntime;
import com.z254.butterfly.conclave.agent.AgentServices;
import com.z254.butterfly.conclave.context.Context;
import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.domain.model.CollaborationType;
import com.z254.butterfly.conclave.domain.model.Message;
import com.z254.butterfly.conclave.transport.AgentTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs agents in phases over a shared chat history.
 *
 * <p>All agents of a phase receive the query; each one appends its answer to the history
 * and acknowledges. The acknowledgment that completes the phase starts the next one. After
 * the last phase the latest answer in the history is the response.
 */
@Slf4j
public class PhasedCoordinator extends AgentRuntime {

    private final List<List<String>> phases;

    public PhasedCoordinator(String name, String description, AgentTransport transport,
                             AgentServices services, List<List<String>> phases) {
        super(name, description, transport, services);
        if (phases.isEmpty() || phases.stream().anyMatch(List::isEmpty)) {
            throw new IllegalArgumentException("Phased coordinator " + name + " needs non-empty phases");
        }
        List<List<String>> copy = new ArrayList<>();
        phases.forEach(phase -> copy.add(List.copyOf(phase)));
        this.phases = List.copyOf(copy);
    }

    public List<List<String>> getPhases() {
        return phases;
    }

    @Override
    protected Optional<String> processRequest(Message request, List<ChatMessage> history) {
        String chatId = request.getChatId() != null ? request.getChatId() : UUID.randomUUID().toString();
        Context context = registry.getOrCreateContext(request.getContextName());
        context.setCollaborationType(chatId, CollaborationType.PHASED);
        context.setAgentPhaseAssignments(chatId, phases);
        context.setRouteResponseTo(chatId, request.getSender() != null ? request.getSender() : name);
        context.addQuery(chatId, request.getContent());
        context.appendChatHistory(chatId, ChatMessage.user(request.getContent()));
        context.setCurrentPhase(chatId, 0);

        log.info("Starting {} phases for chat {}", phases.size(), chatId);
        dispatch(context, chatId, phases.get(0));
        return Optional.empty();
    }

    @Override
    protected void processResponse(Message response) {
        String chatId = response.getChatId();
        if (!response.isAck()) {
            log.info("Phased chat {} finished with response from {}", chatId, response.getSender());
            return;
        }
        Context context = registry.getOrCreateContext(response.getContextName());
        if (!context.removeRequiredAgentForCurrentPhase(chatId, response.getSender())) {
            log.debug("Phase {} of chat {} still waiting for {}", context.getCurrentPhase(chatId).orElse(-1),
                    chatId, context.getRequiredAgentsForCurrentPhase(chatId));
            return;
        }
        Optional<List<String>> next = context.getAgentsForNextPhase(chatId);
        if (next.isPresent()) {
            log.debug("Chat {} entering phase {}", chatId, context.getCurrentPhase(chatId).orElse(-1));
            dispatch(context, chatId, next.get());
        } else {
            finish(context, chatId);
        }
    }

    private void dispatch(Context context, String chatId, List<String> agents) {
        String query = context.getCurrentQuery(chatId).orElse("");
        for (String agent : agents) {
            sendRequest(Message.request(context.getName(), chatId, query), agent);
        }
    }

    private void finish(Context context, String chatId) {
        List<ChatMessage> history = context.getChatHistory(chatId);
        String answer = null;
        for (int i = history.size() - 1; i >= 0 && answer == null; i--) {
            if (history.get(i).isAssistant()) {
                answer = history.get(i).content();
            }
        }
        String target = context.getRouteResponseTo(chatId).orElse(name);
        if (target.equals(name)) {
            log.info("Phased chat {} finished: {}", chatId, answer);
            return;
        }
        sendResponse(Message.response(context.getName(), chatId, answer), target);
    }
}
