package com.z254.butterfly.conclave.observability;

import com.z254.butterfly.conclave.domain.model.CollaborationType;
import com.z254.butterfly.conclave.domain.model.MessageType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for CONCLAVE.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Shared store commits (optimistic conflicts)</li>
 *     <li>Messages sent by agents, per message type</li>
 *     <li>Requests handled, per collaboration type</li>
 *     <li>Processing failures</li>
 * </ul>
 */
@Component
public class ConclaveMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter commitConflicts;
    @Getter
    private final Counter processingErrors;
    private final Map<MessageType, Counter> messagesSent = new ConcurrentHashMap<>();
    private final Map<CollaborationType, Counter> requestsHandled = new ConcurrentHashMap<>();

    public ConclaveMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.commitConflicts = Counter.builder("conclave.store.commit.conflicts")
                .description("Optimistic commits aborted by a concurrent writer")
                .register(meterRegistry);
        this.processingErrors = Counter.builder("conclave.agent.processing.errors")
                .description("Failures while an agent processed a message")
                .register(meterRegistry);
    }

    public void recordConflict() {
        commitConflicts.increment();
    }

    public void recordMessageSent(MessageType type) {
        messagesSent.computeIfAbsent(type, t -> Counter.builder("conclave.messages.sent")
                .description("Messages sent by agents")
                .tag("type", t.name())
                .register(meterRegistry)).increment();
    }

    public void recordRequestHandled(CollaborationType type) {
        requestsHandled.computeIfAbsent(type, t -> Counter.builder("conclave.requests.handled")
                .description("Requests handled by agents")
                .tag("collaboration", t.name())
                .register(meterRegistry)).increment();
    }

    public void recordProcessingError() {
        processingErrors.increment();
    }
}
