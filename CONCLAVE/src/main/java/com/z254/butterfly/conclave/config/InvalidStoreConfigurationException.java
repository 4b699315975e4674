package com.z254.butterfly.conclave.config;

import lombok.Getter;

import java.util.List;

/**
 * The {@code conclave.store} settings are inconsistent.
 */
@Getter
public class InvalidStoreConfigurationException extends RuntimeException {

    private final List<String> errors;

    public InvalidStoreConfigurationException(List<String> errors) {
        super("Invalid store configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
