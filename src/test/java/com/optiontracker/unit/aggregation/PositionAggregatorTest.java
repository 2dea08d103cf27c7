package com.optiontracker.unit.aggregation;

import static org.assertj.core.api.Assertions.assertThat;

import com.optiontracker.aggregation.PositionAggregator;
import com.optiontracker.domain.enums.OptionType;
import com.optiontracker.domain.enums.PositionAction;
import com.optiontracker.domain.model.Greeks;
import com.optiontracker.domain.model.GroupedPosition;
import com.optiontracker.domain.model.PnLResult;
import com.optiontracker.domain.model.Position;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PositionAggregatorTest {

    private final PositionAggregator aggregator = new PositionAggregator();

    @Nested
    @DisplayName("Grouping")
    class Grouping {

        @Test
        @DisplayName("Groups keep first-seen ticker order and member order")
        void order() {
            List<GroupedPosition> groups = aggregator.groupByUnderlying(List.of(
                    position("a", "AAPL"), position("b", "SPY"), position("c", "AAPL"), position("d", "QQQ")));

            assertThat(groups).extracting(GroupedPosition::getUnderlying).containsExactly("AAPL", "SPY", "QQQ");
            assertThat(groups.get(0).getPositions()).extracting(Position::getId).containsExactly("a", "c");
        }

        @Test
        void emptyInput() {
            assertThat(aggregator.groupByUnderlying(List.of())).isEmpty();
        }

        @Test
        @DisplayName("Aggregating the same input twice gives equal results")
        void idempotent() {
            List<Position> positions = List.of(
                    withPnl(position("a", "AAPL"), pnl("10", "10", "100", "0.20")),
                    withPnl(position("b", "AAPL"), pnl("60", "30", "200", "0.35")));

            assertThat(aggregator.groupByUnderlying(positions)).isEqualTo(aggregator.groupByUnderlying(positions));
        }
    }

    @Nested
    @DisplayName("Greeks")
    class GreeksTotals {

        @Test
        @DisplayName("Greeks are summed without re-scaling")
        void summed() {
            Position longCall = position("a", "AAPL").toBuilder().greeks(greeks("0.50", "0.02")).build();
            Position shortCall = position("b", "AAPL").toBuilder().greeks(greeks("-0.80", "-0.05")).build();

            Greeks total = aggregator.groupByUnderlying(List.of(longCall, shortCall)).get(0).getTotalGreeks();

            assertThat(total.getDelta()).isEqualByComparingTo("-0.30");
            assertThat(total.getGamma()).isEqualByComparingTo("-0.03");
        }

        @Test
        @DisplayName("One member without Greeks suppresses the total")
        void partialSuppressed() {
            Position withGreeks = position("a", "AAPL").toBuilder().greeks(greeks("0.50", "0.02")).build();

            GroupedPosition group = aggregator.groupByUnderlying(List.of(withGreeks, position("b", "AAPL"))).get(0);

            assertThat(group.getTotalGreeks()).isNull();
        }
    }

    @Nested
    @DisplayName("P&L")
    class PnLTotals {

        @Test
        @DisplayName("Percent and IV are weighted by initial value against the final total")
        void weighted() {
            List<Position> positions = List.of(
                    withPnl(position("a", "AAPL"), pnl("10", "10", "100", "0.20")),
                    withPnl(position("b", "AAPL"), pnl("60", "30", "200", "0.35")));

            PnLResult total = aggregator.groupByUnderlying(positions).get(0).getTotalPnl();

            assertThat(total.getPnlAmount()).isEqualByComparingTo("70");
            assertThat(total.getInitialValue()).isEqualByComparingTo("300");
            assertThat(total.getCurrentValue()).isEqualByComparingTo("370");
            assertThat(total.getPnlPercent()).isEqualByComparingTo("23.33");
            assertThat(total.getImpliedVolatility()).isEqualByComparingTo("0.3000");
            assertThat(total.getPositionId()).isEqualTo("AAPL");
        }

        @Test
        @DisplayName("Weighted percent does not depend on member order")
        void orderIndependent() {
            Position a = withPnl(position("a", "AAPL"), pnl("10", "10", "100", null));
            Position b = withPnl(position("b", "AAPL"), pnl("60", "30", "200", null));

            PnLResult forward = aggregator.groupByUnderlying(List.of(a, b)).get(0).getTotalPnl();
            PnLResult reversed = aggregator.groupByUnderlying(List.of(b, a)).get(0).getTotalPnl();

            assertThat(forward.getPnlPercent()).isEqualByComparingTo(reversed.getPnlPercent());
            assertThat(forward.getImpliedVolatility()).isNull();
        }

        @Test
        @DisplayName("One member without P&L suppresses the total")
        void partialSuppressed() {
            List<Position> positions = List.of(
                    withPnl(position("a", "AAPL"), pnl("10", "10", "100", null)), position("b", "AAPL"));

            GroupedPosition group = aggregator.groupByUnderlying(positions).get(0);

            assertThat(group.getTotalPnl()).isNull();
            assertThat(group.getTotalTheoreticalPnl()).isNull();
        }

        @Test
        @DisplayName("Zero cost basis gives 0 percent and no IV")
        void zeroBasis() {
            Position a = withPnl(position("a", "AAPL"), pnl("5", "0", "0", "0.25"));

            PnLResult total = aggregator.groupByUnderlying(List.of(a)).get(0).getTotalPnl();

            assertThat(total.getPnlPercent()).isEqualByComparingTo("0");
            assertThat(total.getImpliedVolatility()).isNull();
        }

        @Test
        @DisplayName("Any client-calculated or errored member marks the group")
        void reliabilityFlags() {
            PnLResult local = pnl("10", "10", "100", null).toBuilder().clientCalculated(true).build();
            PnLResult errored = PnLResult.failed("c", "boom", false, LocalDateTime.of(2025, 3, 10, 15, 0));
            List<Position> positions = List.of(
                    withPnl(position("a", "AAPL"), local),
                    withPnl(position("b", "AAPL"), pnl("60", "30", "200", null)),
                    withPnl(position("c", "AAPL"), errored));

            PnLResult total = aggregator.groupByUnderlying(positions).get(0).getTotalPnl();

            assertThat(total.isClientCalculated()).isTrue();
            assertThat(total.getError()).isEqualTo("1 of 3 positions have calculation errors");
        }

        @Test
        @DisplayName("Underlying price and timestamp come from members")
        void underlyingPriceAndTimestamp() {
            PnLResult first = pnl("10", "10", "100", null).toBuilder()
                    .calculationTimestamp(LocalDateTime.of(2025, 3, 10, 10, 0))
                    .build();
            PnLResult second = pnl("60", "30", "200", null).toBuilder()
                    .underlyingPrice(new BigDecimal("182.50"))
                    .calculationTimestamp(LocalDateTime.of(2025, 3, 10, 10, 5))
                    .build();

            GroupedPosition group = aggregator
                    .groupByUnderlying(List.of(withPnl(position("a", "AAPL"), first), withPnl(position("b", "AAPL"), second)))
                    .get(0);

            assertThat(group.getUnderlyingPrice()).isEqualByComparingTo("182.50");
            assertThat(group.getTotalPnl().getUnderlyingPrice()).isEqualByComparingTo("182.50");
            assertThat(group.getTotalPnl().getCalculationTimestamp()).isEqualTo(LocalDateTime.of(2025, 3, 10, 10, 5));
        }

        @Test
        @DisplayName("Theoretical P&L is aggregated independently")
        void theoreticalIndependent() {
            Position a = position("a", "AAPL").toBuilder()
                    .theoreticalPnl(pnl("20", "20", "100", null))
                    .build();

            GroupedPosition group = aggregator.groupByUnderlying(List.of(a)).get(0);

            assertThat(group.getTotalPnl()).isNull();
            assertThat(group.getTotalTheoreticalPnl().getPnlAmount()).isEqualByComparingTo("20");
        }
    }

    private static Position position(String id, String ticker) {
        return Position.builder()
                .id(id)
                .ticker(ticker)
                .expiration(LocalDate.of(2025, 6, 20))
                .strike(new BigDecimal("100"))
                .type(OptionType.CALL)
                .action(PositionAction.BUY)
                .quantity(1)
                .build();
    }

    private static Position withPnl(Position position, PnLResult pnl) {
        return position.toBuilder().pnl(pnl).build();
    }

    private static PnLResult pnl(String amount, String percent, String initial, String iv) {
        BigDecimal initialValue = new BigDecimal(initial);
        return PnLResult.builder()
                .pnlAmount(new BigDecimal(amount))
                .pnlPercent(new BigDecimal(percent))
                .initialValue(initialValue)
                .currentValue(initialValue.add(new BigDecimal(amount)))
                .impliedVolatility(iv != null ? new BigDecimal(iv) : null)
                .build();
    }

    private static Greeks greeks(String delta, String gamma) {
        return Greeks.builder().delta(new BigDecimal(delta)).gamma(new BigDecimal(gamma)).build();
    }
}
