package com.z254.butterfly.conclave.agent;

import com.z254.butterfly.conclave.collaboration.CollaborationController;
import com.z254.butterfly.conclave.observability.ConclaveMetrics;
import com.z254.butterfly.conclave.registry.Registry;

/**
 * Collaborators every agent needs, bundled so agent constructors stay short.
 */
public record AgentServices(Registry registry, CollaborationController controller, ConclaveMetrics metrics) {
}
