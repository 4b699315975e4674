package com.z254.butterfly.conclave.agent;

import com.z254.butterfly.conclave.collaboration.CollaborationController;
import com.z254.butterfly.conclave.collaboration.RoutingDecision;
import com.z254.butterfly.conclave.context.Context;
import com.z254.butterfly.conclave.domain.model.AgentEvent;
import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.domain.model.CollaborationType;
import com.z254.butterfly.conclave.domain.model.Message;
import com.z254.butterfly.conclave.observability.ConclaveMetrics;
import com.z254.butterfly.conclave.registry.Registry;
import com.z254.butterfly.conclave.transport.AgentTransport;
import com.z254.butterfly.conclave.transport.TransportListener;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class of all agents: registration, message bookkeeping and request routing.
 *
 * <p>On a request the runtime resolves the context and the chat's collaboration type,
 * hands the request and the visible history to {@link #processRequest}, and routes the
 * result through the {@link CollaborationController}. Every message the agent sends is
 * stamped with its name, traced in the context and recorded among the participants.
 *
 * <p>Subclasses implement the processing callbacks. Failures thrown by them reach
 * {@link #processError} and never stop the transport.
 */
@Slf4j
public abstract class AgentRuntime implements TransportListener {

    protected final String name;
    protected final String description;
    protected final AgentTransport transport;
    protected final Registry registry;
    protected final CollaborationController controller;
    protected final ConclaveMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);

    protected AgentRuntime(String name, String description, AgentTransport transport, AgentServices services) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description == null ? "" : description;
        this.transport = Objects.requireNonNull(transport, "transport");
        this.registry = services.registry();
        this.controller = services.controller();
        this.metrics = services.metrics();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Registers the agent, then starts receiving.
     *
     * @throws com.z254.butterfly.conclave.registry.AgentNameConflictException if the name is
     *                                                                         taken; the transport is not started
     */
    public void start() {
        if (running.get()) {
            return;
        }
        registry.registerAgent(name, description);
        try {
            transport.setListener(this);
            transport.start();
        } catch (RuntimeException e) {
            registry.unregisterAgent(name);
            throw e;
        }
        running.set(true);
        publishEvent("agent.started", Map.of("description", description));
        log.info("Agent {} started", name);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            publishEvent("agent.stopped", Map.of());
            transport.stop();
        } finally {
            registry.unregisterAgent(name);
        }
        log.info("Agent {} stopped", name);
    }

    // --------------------------------------------------------------------------------------------
    // Sending
    // --------------------------------------------------------------------------------------------

    public final void sendRequest(Message message, String destinationAgent) {
        Message stamped = record(message);
        transport.sendRequest(stamped, destinationAgent);
        metrics.recordMessageSent(stamped.getType());
        log.debug("{} -> {} {} (chat {})", name, destinationAgent, stamped.getType(), stamped.getChatId());
    }

    public final void sendResponse(Message message, String destinationAgent) {
        Message stamped = record(message);
        transport.sendResponse(stamped, destinationAgent);
        metrics.recordMessageSent(stamped.getType());
        log.debug("{} -> {} {} (chat {})", name, destinationAgent, stamped.getType(), stamped.getChatId());
    }

    /**
     * Broadcasts an event to every other agent on the transport.
     */
    public void publishEvent(String eventName, Map<String, Object> payload) {
        transport.publishEvent(AgentEvent.builder().source(name).name(eventName).payload(payload).build());
    }

    private Message record(Message message) {
        Message stamped = message.withSender(name);
        Context context = registry.getOrCreateContext(stamped.getContextName());
        context.addParticipant(name);
        context.trace(stamped);
        return stamped;
    }

    // --------------------------------------------------------------------------------------------
    // Receiving
    // --------------------------------------------------------------------------------------------

    @Override
    public final void onRequest(Message request) {
        handleRequest(request);
    }

    /**
     * Runs the request state machine for one request.
     */
    public void handleRequest(Message request) {
        withMdc(request, () -> {
            Context context = registry.getOrCreateContext(request.getContextName());
            CollaborationType type = context.getCollaborationType(request.getChatId());
            metrics.recordRequestHandled(type);
            List<ChatMessage> history = controller.historyFor(context, request.getChatId(), type);
            Optional<String> output = processRequest(request, history).filter(text -> !text.isEmpty());
            if (output.isPresent()) {
                routeResponse(request, output.get());
            } else {
                log.debug("Agent {} produced no output for request {}", name, request.getId());
            }
        });
    }

    /**
     * Routes the output produced for a request. Agents that finish a request later, after
     * their own sub-requests are answered, call this themselves. Empty output is not routed.
     */
    protected void routeResponse(Message request, String output) {
        if (output == null || output.isEmpty()) {
            log.debug("Agent {} has no output yet for request {}", name, request.getId());
            return;
        }
        Context context = registry.getOrCreateContext(request.getContextName());
        CollaborationType type = context.getCollaborationType(request.getChatId());
        RoutingDecision decision = controller.route(context, request, name, output, type);
        if (decision.historyEntry() != null) {
            context.appendChatHistory(request.getChatId(), decision.historyEntry());
        }
        switch (decision.delivery()) {
            case REQUEST -> sendRequest(decision.message(), decision.destination());
            case RESPONSE -> sendResponse(decision.message(), decision.destination());
            case NONE -> log.warn("Output of agent {} for request {} not routed", name, request.getId());
        }
    }

    @Override
    public final void onResponse(Message response) {
        withMdc(response, () -> processResponse(response));
    }

    @Override
    public final void onEvent(AgentEvent event) {
        try {
            processEvent(event);
        } catch (RuntimeException e) {
            onError(e);
        }
    }

    @Override
    public final void onError(Throwable error) {
        metrics.recordProcessingError();
        processError(error);
    }

    // --------------------------------------------------------------------------------------------
    // Agent capabilities
    // --------------------------------------------------------------------------------------------

    /**
     * Processes a request.
     *
     * @param history the chat's shared history for PHASED and CHAT collaboration, empty otherwise
     * @return the output to route; empty, or an empty string, routes nothing
     */
    protected abstract Optional<String> processRequest(Message request, List<ChatMessage> history);

    /**
     * Processes a response or acknowledgment addressed to this agent.
     */
    protected abstract void processResponse(Message response);

    protected void processEvent(AgentEvent event) {
        log.debug("Agent {} ignoring event {} from {}", name, event.getName(), event.getSource());
    }

    protected void processError(Throwable error) {
        log.error("Agent {} failed to process message", name, error);
    }

    private void withMdc(Message message, Runnable action) {
        MDC.put("agent", name);
        putIfPresent("context", message.getContextName());
        putIfPresent("chatId", message.getChatId());
        try {
            action.run();
        } catch (RuntimeException e) {
            onError(e);
        } finally {
            MDC.remove("agent");
            MDC.remove("context");
            MDC.remove("chatId");
        }
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
