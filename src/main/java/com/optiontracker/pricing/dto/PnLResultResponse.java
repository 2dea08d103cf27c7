package com.optiontracker.pricing.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire shape of a P&L result. {@code pnl_percent} may be absent; it maps to zero.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PnLResultResponse {

    private String positionId;
    private BigDecimal pnlAmount;
    private BigDecimal pnlPercent;
    private BigDecimal initialValue;
    private BigDecimal currentValue;
    private BigDecimal impliedVolatility;
    private BigDecimal underlyingPrice;

    /** ISO-8601, with or without offset. */
    private String calculationTimestamp;
}
