package com.optiontracker.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarkPriceRequest {

    @NotNull(message = "Mark price is required")
    @PositiveOrZero(message = "Mark price must not be negative")
    private BigDecimal markPrice;
}
