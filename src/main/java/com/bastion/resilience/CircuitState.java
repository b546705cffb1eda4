package com.bastion.resilience;

/**
 * CLOSED → OPEN when failures reach the threshold; OPEN → HALF_OPEN once the cooldown
 * elapsed; HALF_OPEN → CLOSED on a successful trial, HALF_OPEN → OPEN on a failed one.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
