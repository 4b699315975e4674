package com.z254.butterfly.conclave.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A context-free notification delivered to agents by the transport.
 */
@Value
@Builder
@Jacksonized
public class AgentEvent {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    /**
     * Agent or component that raised the event.
     */
    String source;

    /**
     * Event name, e.g. {@code agent.started}.
     */
    String name;

    Map<String, Object> payload;

    @Builder.Default
    Instant timestamp = Instant.now();
}
