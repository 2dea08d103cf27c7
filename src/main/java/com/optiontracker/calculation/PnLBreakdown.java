package com.optiontracker.calculation;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Locally computed P&L figures for one position.
 */
@Value
public class PnLBreakdown {

    BigDecimal pnlAmount;
    BigDecimal pnlPercent;
    BigDecimal initialValue;
    BigDecimal currentValue;
}
