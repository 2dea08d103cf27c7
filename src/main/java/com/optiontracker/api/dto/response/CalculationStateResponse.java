package com.optiontracker.api.dto.response;

import com.optiontracker.domain.enums.CalculationState;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CalculationStateResponse {

    String positionId;

    /** Keyed by metric name. */
    Map<String, CalculationState> states;
}
