package com.z254.butterfly.conclave.bootstrap;

import lombok.Getter;

import java.util.List;

/**
 * The {@code conclave.agents} definitions cannot be started.
 */
@Getter
public class InvalidAgentDefinitionException extends RuntimeException {

    private final List<String> errors;

    public InvalidAgentDefinitionException(List<String> errors) {
        super("Invalid agent definitions: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
