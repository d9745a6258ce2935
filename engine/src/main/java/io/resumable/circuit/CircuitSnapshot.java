package io.resumable.circuit;

import java.time.Instant;

/**
 * Read-only view of one dependency's breaker. {@code openedAt} is null while the circuit has never opened.
 */
public record CircuitSnapshot(
        String dependencyName,
        CircuitState state,
        int consecutiveFailures,
        int halfOpenSuccesses,
        Instant openedAt
) {}
