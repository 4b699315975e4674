package com.z254.butterfly.conclave.domain.model;

/**
 * Types of messages exchanged between agents.
 */
public enum MessageType {

    /**
     * Request for another agent to process content.
     */
    REQUEST,

    /**
     * Response carrying the result of a request.
     */
    RESPONSE,

    /**
     * Acknowledgment that an agent finished its share of a shared-history conversation.
     */
    ACK,

    /**
     * Context-free notification.
     */
    EVENT
}
