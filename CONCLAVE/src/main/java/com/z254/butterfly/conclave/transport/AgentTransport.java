package com.z254.butterfly.conclave.transport;

import com.z254.butterfly.conclave.domain.model.AgentEvent;
import com.z254.butterfly.conclave.domain.model.Message;

/**
 * Moves messages between agents. Sending is fire-and-forget.
 */
public interface AgentTransport {

    void setListener(TransportListener listener);

    /**
     * Starts delivering to the listener.
     *
     * @throws IllegalStateException if no listener is set
     */
    void start();

    void stop();

    void sendRequest(Message message, String destinationAgent);

    void sendResponse(Message message, String destinationAgent);

    void publishEvent(AgentEvent event);
}
