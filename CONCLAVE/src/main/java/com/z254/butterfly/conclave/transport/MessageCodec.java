package com.z254.butterfly.conclave.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.conclave.domain.model.AgentEvent;
import com.z254.butterfly.conclave.domain.model.Message;

/**
 * JSON framing of messages and events.
 */
public class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(Message message) {
        return write(message);
    }

    public Message decode(String frame) {
        return read(frame, Message.class);
    }

    public String encodeEvent(AgentEvent event) {
        return write(event);
    }

    public AgentEvent decodeEvent(String frame) {
        return read(frame, AgentEvent.class);
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MessageCodecException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String frame, Class<T> type) {
        try {
            return mapper.readValue(frame, type);
        } catch (JsonProcessingException e) {
            throw new MessageCodecException("Failed to decode " + type.getSimpleName() + " frame", e);
        }
    }
}
