package com.z254.butterfly.conclave.registry;

import java.time.Instant;

/**
 * Stored registration of a context.
 */
public record ContextDescriptor(String name, Instant createdAt) {
}
