package com.z254.butterfly.conclave.registry;

import lombok.Getter;

/**
 * Raised when an agent registers under a name already taken.
 */
@Getter
public class AgentNameConflictException extends RuntimeException {

    private final String agentName;

    public AgentNameConflictException(String agentName) {
        super("Agent with name '" + agentName + "' already exists");
        this.agentName = agentName;
    }
}
