package com.z254.butterfly.conclave.domain.model;

/**
 * Collaboration mode of a chat. Governs which history an agent sees and where its
 * output is routed.
 */
public enum CollaborationType {

    /**
     * Agents run as a chain; each receives only the previous agent's output.
     */
    SEQUENTIAL,

    /**
     * Barrier-synchronized rounds over a shared history.
     */
    PHASED,

    /**
     * Direct request/response between two agents.
     */
    INDEPENDENT,

    /**
     * Shared history, acknowledgment based.
     */
    CHAT;

    /**
     * Whether agents in this mode read and extend the chat's shared history.
     */
    public boolean usesSharedHistory() {
        return this == PHASED || this == CHAT;
    }
}
