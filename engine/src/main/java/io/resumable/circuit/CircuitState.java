package io.resumable.circuit;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
