package com.optiontracker.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * All positions sharing an underlying, with their aggregated Greeks and P&L.
 *
 * <p>Derived on every read by PositionAggregator and never stored. Each total is null
 * unless every member carries the corresponding figure, so null means "not yet
 * computable", never zero.
 */
@Value
@Builder
public class GroupedPosition {

    String underlying;
    BigDecimal underlyingPrice;
    List<Position> positions;
    Greeks totalGreeks;
    PnLResult totalPnl;
    PnLResult totalTheoreticalPnl;
}
