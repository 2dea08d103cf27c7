package com.optiontracker.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TheoreticalPnLSettingsRequest {

    @NotNull(message = "daysForward is required")
    @Min(value = 0, message = "daysForward must not be negative")
    private Integer daysForward;

    /** Underlying move in percent; negative for a drop. */
    @NotNull(message = "priceChangePercent is required")
    private BigDecimal priceChangePercent;
}
