package com.z254.butterfly.conclave.collaboration;

import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.domain.model.Message;

/**
 * Where an agent's output goes once it has processed a request.
 *
 * @param delivery     how the message is sent
 * @param destination  receiving agent, null when nothing is sent
 * @param message      message to send, sender not yet stamped
 * @param historyEntry entry to append to the chat's shared history, or null
 */
public record RoutingDecision(Delivery delivery, String destination, Message message, ChatMessage historyEntry) {

    public enum Delivery {
        REQUEST,
        RESPONSE,
        NONE
    }

    public static RoutingDecision request(String destination, Message message) {
        return new RoutingDecision(Delivery.REQUEST, destination, message, null);
    }

    public static RoutingDecision response(String destination, Message message) {
        return new RoutingDecision(Delivery.RESPONSE, destination, message, null);
    }

    public static RoutingDecision none() {
        return new RoutingDecision(Delivery.NONE, null, null, null);
    }
}
