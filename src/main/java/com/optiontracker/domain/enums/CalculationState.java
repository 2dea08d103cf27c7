package com.optiontracker.domain.enums;

/**
 * States of the per-(position, metric) calculation state machine.
 *
 * <pre>
 * IDLE -> REQUESTING -> SUCCEEDED
 *                    -> FALLBACK   (P&L metrics only, service not implemented/unreachable)
 *                    -> RETRYING -> REQUESTING ... -> FAILED (retries exhausted)
 * </pre>
 */
public enum CalculationState {
    IDLE(false),
    REQUESTING(false),
    RETRYING(false),
    SUCCEEDED(true),
    FALLBACK(true),
    FAILED(true);

    private final boolean terminal;

    CalculationState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
