package com.optiontracker.domain.enums;

/**
 * The per-position figures the orchestrator calculates.
 *
 * <p>Only the P&L metrics have a local approximation. Greeks are adjusted for action and
 * quantity by the pricing service, so the service is their only source.
 */
public enum CalculationMetric {
    GREEKS("Greeks", false),
    PNL("P&L", true),
    THEORETICAL_PNL("theoretical P&L", true);

    private final String displayName;
    private final boolean localFallbackAvailable;

    CalculationMetric(String displayName, boolean localFallbackAvailable) {
        this.displayName = displayName;
        this.localFallbackAvailable = localFallbackAvailable;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isLocalFallbackAvailable() {
        return localFallbackAvailable;
    }
}
