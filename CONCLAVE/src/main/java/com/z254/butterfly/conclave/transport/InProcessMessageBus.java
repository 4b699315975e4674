package com.z254.butterfly.conclave.transport;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Message bus for agents running in the same process.
 *
 * <p>Each destination (an agent's request or response queue) is a sink with an unbounded
 * buffer holding frames until the agent subscribes or catches up, so a message sent before
 * its receiver starts is not lost. Events go to a topic every subscriber sees from the
 * moment it subscribes.
 *
 * <p>Queues outlive their subscribers so an agent can stop and start again. Queues of
 * agents that are gone are only dropped by {@link #pruneQueues}.
 */
@Slf4j
public class InProcessMessageBus {

    private static final String REQUEST_QUEUE = "/queue/request/";
    private static final String RESPONSE_QUEUE = "/queue/response/";

    private final Map<String, Sinks.Many<String>> queues = new ConcurrentHashMap<>();
    private final Sinks.Many<String> eventTopic = Sinks.many().multicast().directBestEffort();
    private final AtomicLong framesSent = new AtomicLong();

    public InProcessMessageBus() {
        log.info("Initialized InProcessMessageBus");
    }

    public static String requestQueue(String agentName) {
        return REQUEST_QUEUE + agentName;
    }

    public static String responseQueue(String agentName) {
        return RESPONSE_QUEUE + agentName;
    }

    /**
     * Enqueues a frame for the destination.
     */
    public void send(String destination, String frame) {
        Sinks.Many<String> sink = queue(destination);
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(frame);
        }
        if (result.isFailure()) {
            log.warn("Failed to enqueue frame for {}: {}", destination, result);
            return;
        }
        framesSent.incrementAndGet();
        log.debug("Frame sent to {}", destination);
    }

    /**
     * Frames sent to the destination, starting with those buffered before the subscription.
     */
    public Flux<String> subscribe(String destination) {
        return queue(destination).asFlux()
                .doOnSubscribe(s -> log.debug("Subscribed to {}", destination))
                .doOnCancel(() -> log.debug("Unsubscribed from {}", destination));
    }

    public void publishEvent(String frame) {
        Sinks.EmitResult result;
        synchronized (eventTopic) {
            result = eventTopic.tryEmitNext(frame);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Failed to publish event: {}", result);
        }
    }

    public Flux<String> events() {
        return eventTopic.asFlux();
    }

    /**
     * Drops the queues of agents not in {@code liveAgents} that nobody is subscribed to,
     * together with any frames still buffered in them.
     *
     * @return the number of queues dropped
     */
    public int pruneQueues(Collection<String> liveAgents) {
        int dropped = 0;
        for (Map.Entry<String, Sinks.Many<String>> entry : queues.entrySet()) {
            String destination = entry.getKey();
            if (liveAgents.contains(agentOf(destination)) || entry.getValue().currentSubscriberCount() > 0) {
                continue;
            }
            if (queues.remove(destination, entry.getValue())) {
                dropped++;
                log.debug("Dropped queue {}", destination);
            }
        }
        if (dropped > 0) {
            log.info("Dropped {} queues of departed agents", dropped);
        }
        return dropped;
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("queues", queues.size());
        stats.put("framesSent", framesSent.get());
        return stats;
    }

    private Sinks.Many<String> queue(String destination) {
        // Integer.MAX_VALUE selects an unbounded buffer
        return queues.computeIfAbsent(destination,
                k -> Sinks.many().multicast().onBackpressureBuffer(Integer.MAX_VALUE, false));
    }

    private static String agentOf(String destination) {
        if (destination.startsWith(REQUEST_QUEUE)) {
            return destination.substring(REQUEST_QUEUE.length());
        }
        if (destination.startsWith(RESPONSE_QUEUE)) {
            return destination.substring(RESPONSE_QUEUE.length());
        }
        return destination;
    }
}
