package com.optiontracker.api.dto.request;

import com.optiontracker.domain.enums.OptionType;
import com.optiontracker.domain.enums.PositionAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for adding a position.
 *
 * <p>Quantity may be signed: a negative quantity opens a short (SELL) position of that
 * magnitude regardless of {@code action}. When {@code markPrice} is omitted it is derived
 * from {@code bid}/{@code ask} if either is given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePositionRequest {

    @NotBlank(message = "Ticker is required")
    private String ticker;

    @NotNull(message = "Expiration is required")
    private LocalDate expiration;

    @NotNull(message = "Strike is required")
    @Positive(message = "Strike must be positive")
    private BigDecimal strike;

    @NotNull(message = "Option type is required")
    private OptionType type;

    /** Defaults to BUY. */
    private PositionAction action;

    @NotNull(message = "Quantity is required")
    private Integer quantity;

    @PositiveOrZero(message = "Premium must not be negative")
    private BigDecimal premium;

    @PositiveOrZero(message = "Mark price must not be negative")
    private BigDecimal markPrice;

    private BigDecimal bid;
    private BigDecimal ask;
}
