package com.optiontracker.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Side of an option position. This is the single authoritative direction of a position;
 * quantities are stored as unsigned magnitudes and only signed on demand.
 */
public enum PositionAction {
    @JsonProperty("buy")
    BUY(1),

    @JsonProperty("sell")
    SELL(-1);

    private final int sign;

    PositionAction(int sign) {
        this.sign = sign;
    }

    /** +1 for BUY, -1 for SELL. */
    public int getSign() {
        return sign;
    }
}
