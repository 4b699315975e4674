package com.z254.butterfly.conclave.transport;

/**
 * A frame could not be encoded or decoded.
 */
public class MessageCodecException extends RuntimeException {

    public MessageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
