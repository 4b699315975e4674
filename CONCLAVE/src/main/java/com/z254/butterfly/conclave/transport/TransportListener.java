package com.z254.butterfly.conclave.transport;

import com.z254.butterfly.conclave.domain.model.AgentEvent;
import com.z254.butterfly.conclave.domain.model.Message;

/**
 * Receives what a transport delivers to an agent.
 */
public interface TransportListener {

    void onRequest(Message request);

    /**
     * Responses and acknowledgments addressed to the agent.
     */
    void onResponse(Message response);

    void onEvent(AgentEvent event);

    /**
     * Failures while receiving or handling a delivery. The transport keeps running.
     */
    void onError(Throwable error);
}
