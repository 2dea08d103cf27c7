package com.optiontracker.aggregation;

import com.optiontracker.domain.model.Greeks;
import com.optiontracker.domain.model.GroupedPosition;
import com.optiontracker.domain.model.PnLResult;
import com.optiontracker.domain.model.Position;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Groups positions by underlying and rolls up their Greeks and P&L.
 *
 * <p>A total is only produced when every member has the input. A group where one leg has
 * no Greeks shows no total Greeks rather than a misleading partial sum; the same holds
 * for P&L and theoretical P&L.
 *
 * <p>Percentages and implied volatility are weighted by each member's share of the
 * group's total initial value. The weights are computed against the final total (two
 * passes), so the result does not depend on member order.
 *
 * <p>Pure: the output is derived from the input on every call and nothing is cached.
 */
@Component
public class PositionAggregator {

    /**
     * Groups by ticker in first-seen order, keeping the input order inside each group.
     */
    public List<GroupedPosition> groupByUnderlying(List<Position> positions) {
        Map<String, List<Position>> byTicker = new LinkedHashMap<>();
        for (Position position : positions) {
            byTicker.computeIfAbsent(position.getTicker(), k -> new ArrayList<>()).add(position);
        }

        List<GroupedPosition> groups = new ArrayList<>(byTicker.size());
        for (Map.Entry<String, List<Position>> entry : byTicker.entrySet()) {
            groups.add(buildGroup(entry.getKey(), entry.getValue()));
        }
        return groups;
    }

    private GroupedPosition buildGroup(String underlying, List<Position> members) {
        PnLResult totalPnl = aggregate(underlying, members, Position::getPnl);
        PnLResult totalTheoreticalPnl = aggregate(underlying, members, Position::getTheoreticalPnl);

        return GroupedPosition.builder()
                .underlying(underlying)
                .underlyingPrice(firstUnderlyingPrice(members))
                .positions(List.copyOf(members))
                .totalGreeks(sumGreeks(members))
                .totalPnl(totalPnl)
                .totalTheoreticalPnl(totalTheoreticalPnl)
                .build();
    }

    /** Plain sum of already-adjusted Greeks, or null if any member has none. */
    Greeks sumGreeks(List<Position> members) {
        Greeks total = Greeks.ZERO;
        for (Position member : members) {
            if (member.getGreeks() == null) {
                return null;
            }
            total = total.plus(member.getGreeks());
        }
        return total;
    }

    /**
     * Rolls up one P&L metric, or null if any member is missing it.
     */
    PnLResult aggregate(String underlying, List<Position> members, Function<Position, PnLResult> metric) {
        List<PnLResult> results = new ArrayList<>(members.size());
        for (Position member : members) {
            PnLResult result = metric.apply(member);
            if (result == null) {
                return null;
            }
            results.add(result);
        }

        // First pass: totals.
        BigDecimal totalAmount = BigDecimal.ZERO;
        BigDecimal totalInitial = BigDecimal.ZERO;
        BigDecimal totalCurrent = BigDecimal.ZERO;
        for (PnLResult result : results) {
            totalAmount = totalAmount.add(orZero(result.getPnlAmount()));
            totalInitial = totalInitial.add(orZero(result.getInitialValue()));
            totalCurrent = totalCurrent.add(orZero(result.getCurrentValue()));
        }

        // Second pass: weights against the final total initial value. With no cost basis
        // there is nothing to weight by, so percent is 0 and IV is left undefined.
        BigDecimal weightedPercent = BigDecimal.ZERO;
        BigDecimal weightedIv = BigDecimal.ZERO;
        boolean anyIv = false;
        if (totalInitial.signum() > 0) {
            for (PnLResult result : results) {
                BigDecimal weight = orZero(result.getInitialValue()).divide(totalInitial, MathContext.DECIMAL64);
                weightedPercent = weightedPercent.add(orZero(result.getPnlPercent()).multiply(weight));
                if (result.getImpliedVolatility() != null) {
                    anyIv = true;
                    weightedIv = weightedIv.add(result.getImpliedVolatility().multiply(weight));
                }
            }
        }

        long errors = results.stream().filter(PnLResult::hasError).count();

        return PnLResult.builder()
                .positionId(underlying)
                .pnlAmount(totalAmount)
                .pnlPercent(weightedPercent.setScale(2, RoundingMode.HALF_UP))
                .initialValue(totalInitial)
                .currentValue(totalCurrent)
                .impliedVolatility(anyIv ? weightedIv.setScale(4, RoundingMode.HALF_UP) : null)
                .underlyingPrice(results.stream()
                        .map(PnLResult::getUnderlyingPrice)
                        .filter(Objects::nonNull)
                        .findFirst()
                        .orElse(null))
                .calculationTimestamp(results.stream()
                        .map(PnLResult::getCalculationTimestamp)
                        .filter(Objects::nonNull)
                        .max(LocalDateTime::compareTo)
                        .orElse(null))
                .clientCalculated(results.stream().anyMatch(PnLResult::isClientCalculated))
                .error(errors > 0 ? errors + " of " + results.size() + " positions have calculation errors" : null)
                .build();
    }

    private static BigDecimal firstUnderlyingPrice(List<Position> members) {
        for (Position member : members) {
            if (member.getPnl() != null && member.getPnl().getUnderlyingPrice() != null) {
                return member.getPnl().getUnderlyingPrice();
            }
        }
        for (Position member : members) {
            if (member.getTheoreticalPnl() != null && member.getTheoreticalPnl().getUnderlyingPrice() != null) {
                return member.getTheoreticalPnl().getUnderlyingPrice();
            }
        }
        return null;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
