package com.z254.butterfly.conclave.context;

import java.util.List;

/**
 * Phase progress of one chat: the current phase index and the agents of that phase that
 * have not yet acknowledged. Stored as one value so both change in the same commit.
 */
public record PhaseState(int currentPhase, List<String> requiredAgents) {

    public PhaseState {
        requiredAgents = requiredAgents == null ? List.of() : List.copyOf(requiredAgents);
    }
}
