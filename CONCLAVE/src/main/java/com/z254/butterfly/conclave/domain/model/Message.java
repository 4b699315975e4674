package com.z254.butterfly.conclave.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * A message exchanged between agents.
 *
 * <p>Messages are immutable. The sending agent stamps itself as {@code sender} by
 * producing a copy through {@link #withSender(String)} right before dispatch.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Message {

    /**
     * Unique identifier for this message.
     */
    @Builder.Default
    String id = UUID.randomUUID().toString();

    /**
     * Name of the agent that sent this message.
     */
    @With
    String sender;

    /**
     * Name of the context the conversation lives in.
     */
    String contextName;

    /**
     * Conversation instance within the context. May be null for one-shot exchanges.
     */
    String chatId;

    /**
     * Type of message.
     */
    @Builder.Default
    MessageType type = MessageType.REQUEST;

    /**
     * Text content of the message.
     */
    String content;

    /**
     * When this message was created.
     */
    @Builder.Default
    Instant timestamp = Instant.now();

    // Factory methods for common message types

    /**
     * Create a request message.
     */
    public static Message request(String contextName, String chatId, String content) {
        return Message.builder()
                .type(MessageType.REQUEST)
                .contextName(contextName)
                .chatId(chatId)
                .content(content)
                .build();
    }

    /**
     * Create a response message.
     */
    public static Message response(String contextName, String chatId, String content) {
        return Message.builder()
                .type(MessageType.RESPONSE)
                .contextName(contextName)
                .chatId(chatId)
                .content(content)
                .build();
    }

    /**
     * Create an acknowledgment carrying the content the agent contributed.
     */
    public static Message ack(String contextName, String chatId, String content) {
        return Message.builder()
                .type(MessageType.ACK)
                .contextName(contextName)
                .chatId(chatId)
                .content(content)
                .build();
    }

    @JsonIgnore
    public boolean isAck() {
        return type == MessageType.ACK;
    }
}
