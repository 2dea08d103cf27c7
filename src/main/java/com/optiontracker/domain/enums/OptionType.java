package com.optiontracker.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Option right. Serialized in lower case ("call"/"put") to match the pricing service's wire format.
 */
public enum OptionType {
    @JsonProperty("call")
    CALL,

    @JsonProperty("put")
    PUT
}
