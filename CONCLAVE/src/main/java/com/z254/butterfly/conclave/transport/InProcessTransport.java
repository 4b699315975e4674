package com.z254.butterfly.conclave.transport;

import com.z254.butterfly.conclave.domain.model.AgentEvent;
import com.z254.butterfly.conclave.domain.model.Message;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.function.Consumer;

/**
 * {@link AgentTransport} over an {@link InProcessMessageBus}.
 *
 * <p>Everything addressed to the agent is delivered on one single-threaded scheduler, so
 * the agent handles one message at a time.
 */
@Slf4j
public class InProcessTransport implements AgentTransport {

    private final String agentName;
    private final InProcessMessageBus bus;
    private final MessageCodec codec;

    private volatile TransportListener listener;
    private Scheduler scheduler;
    private Disposable.Composite subscriptions;

    public InProcessTransport(String agentName, InProcessMessageBus bus, MessageCodec codec) {
        this.agentName = agentName;
        this.bus = bus;
        this.codec = codec;
    }

    @Override
    public void setListener(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public synchronized void start() {
        if (listener == null) {
            throw new IllegalStateException("No listener set for transport of agent " + agentName);
        }
        if (subscriptions != null) {
            return;
        }
        scheduler = Schedulers.newSingle("agent-" + agentName);
        subscriptions = Disposables.composite(
                bus.subscribe(InProcessMessageBus.requestQueue(agentName))
                        .publishOn(scheduler)
                        .subscribe(frame -> deliver(frame, listener::onRequest)),
                bus.subscribe(InProcessMessageBus.responseQueue(agentName))
                        .publishOn(scheduler)
                        .subscribe(frame -> deliver(frame, listener::onResponse)),
                bus.events()
                        .publishOn(scheduler)
                        .subscribe(this::deliverEvent));
        log.debug("Transport started for agent {}", agentName);
    }

    @Override
    public synchronized void stop() {
        if (subscriptions == null) {
            return;
        }
        subscriptions.dispose();
        scheduler.dispose();
        subscriptions = null;
        scheduler = null;
        log.debug("Transport stopped for agent {}", agentName);
    }

    @Override
    public void sendRequest(Message message, String destinationAgent) {
        bus.send(InProcessMessageBus.requestQueue(destinationAgent), codec.encode(message));
    }

    @Override
    public void sendResponse(Message message, String destinationAgent) {
        bus.send(InProcessMessageBus.responseQueue(destinationAgent), codec.encode(message));
    }

    @Override
    public void publishEvent(AgentEvent event) {
        bus.publishEvent(codec.encodeEvent(event));
    }

    private void deliver(String frame, Consumer<Message> handler) {
        try {
            handler.accept(codec.decode(frame));
        } catch (RuntimeException e) {
            listener.onError(e);
        }
    }

    private void deliverEvent(String frame) {
        try {
            AgentEvent event = codec.decodeEvent(frame);
            if (!agentName.equals(event.getSource())) {
                listener.onEvent(event);
            }
        } catch (RuntimeException e) {
            listener.onError(e);
        }
    }
}
