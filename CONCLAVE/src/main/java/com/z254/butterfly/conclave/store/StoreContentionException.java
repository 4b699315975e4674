package com.z254.butterfly.conclave.store;

import lombok.Getter;

/**
 * Raised when an optimistic commit keeps conflicting past the configured attempt bound.
 */
@Getter
public class StoreContentionException extends StoreException {

    private final String key;
    private final int attempts;

    public StoreContentionException(String key, int attempts) {
        super("Commit on key '" + key + "' still conflicting after " + attempts + " attempts");
        this.key = key;
        this.attempts = attempts;
    }
}
