package com.optiontracker.unit.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.optiontracker.domain.enums.OptionType;
import com.optiontracker.domain.enums.OptionTypeFilter;
import com.optiontracker.domain.enums.PositionAction;
import com.optiontracker.domain.model.Greeks;
import com.optiontracker.domain.model.OptionChainFilter;
import com.optiontracker.domain.model.OptionContract;
import com.optiontracker.domain.model.OptionExpiration;
import com.optiontracker.domain.model.PnLResult;
import com.optiontracker.domain.model.Position;
import com.optiontracker.domain.model.TheoreticalPnLSettings;
import com.optiontracker.exception.ErrorCode;
import com.optiontracker.exception.PricingServiceException;
import com.optiontracker.pricing.RestPricingServiceClient;
import com.optiontracker.pricing.mapper.PricingDtoMapper;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/**
 * Wire format and error classification of RestPricingServiceClient against a mocked server.
 */
class RestPricingServiceClientTest {

    private static final String BASE_URL = "http://pricing.test";

    private MockRestServiceServer server;
    private RestPricingServiceClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RestPricingServiceClient(builder.build(), Mappers.getMapper(PricingDtoMapper.class));
    }

    @Nested
    @DisplayName("Requests and responses")
    class WireFormat {

        @Test
        @DisplayName("Greeks request is snake_case and carries action and quantity")
        void greeks() {
            server.expect(requestTo(BASE_URL + "/greeks/calculate"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.position_id").value("p1"))
                    .andExpect(jsonPath("$.option_type").value("call"))
                    .andExpect(jsonPath("$.action").value("sell"))
                    .andExpect(jsonPath("$.quantity").value(2))
                    .andExpect(jsonPath("$.expiration").value("2025-06-20"))
                    .andRespond(withSuccess(
                            """
                            {"delta": -1.10, "gamma": 0.04, "theta": 0.12, "vega": -0.30, "rho": -0.05,
                             "implied_volatility": 0.27, "price": 3.15}
                            """,
                            MediaType.APPLICATION_JSON));

            Greeks greeks = client.getGreeks(position());

            assertThat(greeks.getDelta()).isEqualByComparingTo("-1.10");
            assertThat(greeks.getVega()).isEqualByComparingTo("-0.30");
            server.verify();
        }

        @Test
        @DisplayName("P&L response is mapped and a missing percent becomes zero")
        void pnl() {
            server.expect(requestTo(BASE_URL + "/positions/p1/pnl?recalculate=true"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess(
                            """
                            {"pnl_amount": 125.50, "initial_value": 400, "current_value": 525.50,
                             "underlying_price": 182.3, "calculation_timestamp": "2025-03-10T15:00:00"}
                            """,
                            MediaType.APPLICATION_JSON));

            PnLResult result = client.getPnL("p1", true);

            assertThat(result.getPositionId()).isEqualTo("p1");
            assertThat(result.getPnlAmount()).isEqualByComparingTo("125.50");
            assertThat(result.getPnlPercent()).isEqualByComparingTo("0");
            assertThat(result.getUnderlyingPrice()).isEqualByComparingTo("182.3");
            assertThat(result.getCalculationTimestamp()).isEqualTo(LocalDateTime.of(2025, 3, 10, 15, 0));
            assertThat(result.isClientCalculated()).isFalse();
        }

        @Test
        void theoreticalPnlSendsScenario() {
            server.expect(requestTo(BASE_URL + "/positions/p1/theoretical-pnl?recalculate=false"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.days_forward").value(5))
                    .andExpect(jsonPath("$.price_change_percent").value(-2.5))
                    .andExpect(jsonPath("$.position_ids").doesNotExist())
                    .andRespond(withSuccess(
                            "{\"position_id\": \"p1\", \"pnl_amount\": -20, \"pnl_percent\": -5,"
                                    + " \"initial_value\": 400, \"current_value\": 380}",
                            MediaType.APPLICATION_JSON));

            PnLResult result = client.getTheoreticalPnL("p1", scenario(), false);

            assertThat(result.getPnlPercent()).isEqualByComparingTo("-5");
        }

        @Test
        @DisplayName("Bulk response is keyed by position id and entries without one are skipped")
        void bulkTheoretical() {
            server.expect(requestTo(BASE_URL + "/positions/bulk-theoretical-pnl?recalculate=false"))
                    .andExpect(jsonPath("$.position_ids[0]").value("p1"))
                    .andExpect(jsonPath("$.position_ids[1]").value("p2"))
                    .andRespond(withSuccess(
                            """
                            [{"position_id": "p1", "pnl_amount": 10, "initial_value": 100, "current_value": 110},
                             {"pnl_amount": 99, "initial_value": 1, "current_value": 1}]
                            """,
                            MediaType.APPLICATION_JSON));

            Map<String, PnLResult> results = client.getBulkTheoreticalPnL(List.of("p1", "p2"), scenario(), false);

            assertThat(results).containsOnlyKeys("p1");
            assertThat(results.get("p1").getPnlAmount()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Chain filter becomes query parameters and timestamps are cut to dates")
        void optionChain() {
            OptionChainFilter filter = OptionChainFilter.builder()
                    .optionType(OptionTypeFilter.PUT)
                    .minStrike(new BigDecimal("150"))
                    .maxStrike(new BigDecimal("200.5"))
                    .build();
            server.expect(requestTo(
                            BASE_URL + "/options/chains/AAPL/2025-01-17?option_type=put&min_strike=150&max_strike=200.5"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess(
                            """
                            [{"ticker": "AAPL", "expiration": "2025-01-17T00:00:00", "strike": 160,
                              "option_type": "put", "bid": 1.2, "ask": 1.4, "last": 1.3, "volume": 10,
                              "open_interest": 250, "implied_volatility": 0.31, "in_the_money": false}]
                            """,
                            MediaType.APPLICATION_JSON));

            List<OptionContract> chain = client.getOptionChain("AAPL", LocalDate.of(2025, 1, 17), filter);

            assertThat(chain).singleElement().satisfies(contract -> {
                assertThat(contract.getExpiration()).isEqualTo(LocalDate.of(2025, 1, 17));
                assertThat(contract.getOptionType()).isEqualTo(OptionType.PUT);
                assertThat(contract.getLastPrice()).isEqualByComparingTo("1.3");
                assertThat(contract.getOpenInterest()).isEqualTo(250);
            });
            server.verify();
        }

        @Test
        void unfilteredChainHasNoQuery() {
            server.expect(requestTo(BASE_URL + "/options/chains/SPY/2025-01-17"))
                    .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

            assertThat(client.getOptionChain("SPY", LocalDate.of(2025, 1, 17), OptionChainFilter.none()))
                    .isEmpty();
        }

        @Test
        void expirations() {
            server.expect(requestTo(BASE_URL + "/options/chains/SPY/expirations"))
                    .andRespond(withSuccess(
                            "[{\"date\": \"2025-01-17\", \"days_to_expiration\": 12},"
                                    + " {\"formatted_date\": \"2025-02-21T00:00:00\", \"days_to_expiration\": 47}]",
                            MediaType.APPLICATION_JSON));

            List<OptionExpiration> expirations = client.getExpirations("SPY");

            assertThat(expirations)
                    .extracting(OptionExpiration::getDate)
                    .containsExactly(LocalDate.of(2025, 1, 17), LocalDate.of(2025, 2, 21));
            assertThat(expirations.get(1).getDaysToExpiration()).isEqualTo(47);
        }
    }

    @Nested
    @DisplayName("Error classification")
    class Errors {

        @Test
        void notFoundIsNotImplemented() {
            server.expect(requestTo(BASE_URL + "/positions/p1/pnl?recalculate=false"))
                    .andRespond(withStatus(HttpStatus.NOT_FOUND));

            assertThatThrownBy(() -> client.getPnL("p1", false))
                    .isInstanceOfSatisfying(PricingServiceException.class, e -> {
                        assertThat(e.getStatusCode()).isEqualTo(404);
                        assertThat(e.isFallbackEligible()).isTrue();
                        assertThat(e.getOperation()).isEqualTo("getPnL");
                    });
        }

        @Test
        void notImplemented() {
            server.expect(requestTo(BASE_URL + "/positions/p1/pnl?recalculate=false"))
                    .andRespond(withStatus(HttpStatus.NOT_IMPLEMENTED));

            assertThatThrownBy(() -> client.getPnL("p1", false))
                    .isInstanceOfSatisfying(PricingServiceException.class, e -> assertThat(e.isNotImplemented())
                            .isTrue());
        }

        @Test
        @DisplayName("Server errors keep their status and are not fallback-eligible")
        void serverError() {
            server.expect(requestTo(BASE_URL + "/greeks/calculate")).andRespond(withServerError());

            assertThatThrownBy(() -> client.getGreeks(position()))
                    .isInstanceOfSatisfying(PricingServiceException.class, e -> {
                        assertThat(e.getStatusCode()).isEqualTo(500);
                        assertThat(e.isFallbackEligible()).isFalse();
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PRICING_SERVICE_ERROR);
                    });
        }

        @Test
        @DisplayName("Timeouts are classified as unreachable")
        void timeout() {
            server.expect(requestTo(BASE_URL + "/positions/p1/pnl?recalculate=false"))
                    .andRespond(withException(new SocketTimeoutException("Read timed out")));

            assertThatThrownBy(() -> client.getPnL("p1", false))
                    .isInstanceOfSatisfying(PricingServiceException.class, e -> {
                        assertThat(e.getStatusCode()).isEqualTo(PricingServiceException.NETWORK_UNREACHABLE);
                        assertThat(e.isUnreachable()).isTrue();
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PRICING_SERVICE_UNAVAILABLE);
                        assertThat(e.getDetails()).containsEntry("operation", "getPnL");
                    });
        }

        @Test
        void unreadableBody() {
            server.expect(requestTo(BASE_URL + "/positions/p1/pnl?recalculate=false"))
                    .andRespond(withSuccess("not json", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.getPnL("p1", false))
                    .isInstanceOfSatisfying(PricingServiceException.class, e -> {
                        assertThat(e.getStatusCode()).isEqualTo(PricingServiceException.MALFORMED_RESPONSE);
                        assertThat(e.isFallbackEligible()).isFalse();
                        assertThat(e.isUnavailable()).isTrue();
                    });
        }

        @Test
        void invalidDateInBody() {
            server.expect(requestTo(BASE_URL + "/options/chains/SPY/expirations"))
                    .andRespond(withSuccess(
                            "[{\"date\": \"someday\", \"days_to_expiration\": 1}]", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.getExpirations("SPY"))
                    .isInstanceOfSatisfying(PricingServiceException.class, e -> assertThat(e.getStatusCode())
                            .isEqualTo(PricingServiceException.MALFORMED_RESPONSE));
        }
    }

    private static Position position() {
        return Position.builder()
                .id("p1")
                .ticker("AAPL")
                .expiration(LocalDate.of(2025, 6, 20))
                .strike(new BigDecimal("180"))
                .type(OptionType.CALL)
                .action(PositionAction.SELL)
                .quantity(2)
                .build();
    }

    private static TheoreticalPnLSettings scenario() {
        return TheoreticalPnLSettings.builder()
                .daysForward(5)
                .priceChangePercent(new BigDecimal("-2.5"))
                .build();
    }
}
