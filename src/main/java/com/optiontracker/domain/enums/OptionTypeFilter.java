package com.optiontracker.domain.enums;

/** Option type restriction applied to option chain lookups. */
public enum OptionTypeFilter {
    ALL,
    CALL,
    PUT;

    /** The matching option type, or null for ALL. */
    public OptionType toOptionType() {
        return switch (this) {
            case CALL -> OptionType.CALL;
            case PUT -> OptionType.PUT;
            case ALL -> null;
        };
    }
}
