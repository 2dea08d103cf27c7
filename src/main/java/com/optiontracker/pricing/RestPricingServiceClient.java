package com.optiontracker.pricing;

import com.optiontracker.domain.enums.OptionType;
import com.optiontracker.domain.model.Greeks;
import com.optiontracker.domain.model.OptionChainFilter;
import com.optiontracker.domain.model.OptionContract;
import com.optiontracker.domain.model.OptionExpiration;
import com.optiontracker.domain.model.PnLResult;
import com.optiontracker.domain.model.Position;
import com.optiontracker.domain.model.TheoreticalPnLSettings;
import com.optiontracker.exception.PricingServiceException;
import com.optiontracker.pricing.dto.ExpirationResponse;
import com.optiontracker.pricing.dto.GreeksResponse;
import com.optiontracker.pricing.dto.OptionContractResponse;
import com.optiontracker.pricing.dto.PnLResultResponse;
import com.optiontracker.pricing.dto.TheoreticalPnLRequest;
import com.optiontracker.pricing.mapper.PricingDtoMapper;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link PricingServiceClient} over HTTP/JSON.
 *
 * <p>Every call goes through {@link #execute}, which translates Spring's client exceptions
 * into {@link PricingServiceException}:
 * <ul>
 *   <li>an error status response keeps its status code</li>
 *   <li>{@link ResourceAccessException} (connection refused, timeout) becomes status 0</li>
 *   <li>any other client failure, including an unreadable body, becomes
 *       {@link PricingServiceException#MALFORMED_RESPONSE}</li>
 * </ul>
 */
@Component
public class RestPricingServiceClient implements PricingServiceClient {

    private static final Logger log = LoggerFactory.getLogger(RestPricingServiceClient.class);

    private static final ParameterizedTypeReference<List<PnLResultResponse>> PNL_LIST = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<OptionContractResponse>> CONTRACT_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<ExpirationResponse>> EXPIRATION_LIST =
            new ParameterizedTypeReference<>() {};

    private final RestClient pricingRestClient;
    private final PricingDtoMapper pricingDtoMapper;

    public RestPricingServiceClient(RestClient pricingRestClient, PricingDtoMapper pricingDtoMapper) {
        this.pricingRestClient = pricingRestClient;
        this.pricingDtoMapper = pricingDtoMapper;
    }

    @Override
    public Greeks getGreeks(Position position) {
        return execute("getGreeks", () -> {
            GreeksResponse response = pricingRestClient
                    .post()
                    .uri("/greeks/calculate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(pricingDtoMapper.toGreeksRequest(position))
                    .retrieve()
                    .body(GreeksResponse.class);
            return pricingDtoMapper.toGreeks(requireBody("getGreeks", response));
        });
    }

    @Override
    public PnLResult getPnL(String positionId, boolean forceRecompute) {
        return execute("getPnL", () -> {
            PnLResultResponse response = pricingRestClient
                    .get()
                    .uri("/positions/{id}/pnl?recalculate={force}", positionId, forceRecompute)
                    .retrieve()
                    .body(PnLResultResponse.class);
            return toPnLResult(positionId, requireBody("getPnL", response));
        });
    }

    @Override
    public PnLResult getTheoreticalPnL(String positionId, TheoreticalPnLSettings settings, boolean forceRecompute) {
        TheoreticalPnLRequest request = TheoreticalPnLRequest.builder()
                .daysForward(settings.getDaysForward())
                .priceChangePercent(settings.getPriceChangePercent())
                .build();
        return execute("getTheoreticalPnL", () -> {
            PnLResultResponse response = pricingRestClient
                    .post()
                    .uri("/positions/{id}/theoretical-pnl?recalculate={force}", positionId, forceRecompute)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(PnLResultResponse.class);
            return toPnLResult(positionId, requireBody("getTheoreticalPnL", response));
        });
    }

    @Override
    public Map<String, PnLResult> getBulkTheoreticalPnL(
            List<String> positionIds, TheoreticalPnLSettings settings, boolean forceRecompute) {
        TheoreticalPnLRequest request = TheoreticalPnLRequest.builder()
                .positionIds(positionIds)
                .daysForward(settings.getDaysForward())
                .priceChangePercent(settings.getPriceChangePercent())
                .build();
        return execute("getBulkTheoreticalPnL", () -> {
            List<PnLResultResponse> responses = pricingRestClient
                    .post()
                    .uri("/positions/bulk-theoretical-pnl?recalculate={force}", forceRecompute)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(PNL_LIST);

            Map<String, PnLResult> results = new LinkedHashMap<>();
            for (PnLResultResponse response : requireBody("getBulkTheoreticalPnL", responses)) {
                if (response.getPositionId() == null) {
                    log.warn("Bulk theoretical P&L entry without position_id ignored");
                    continue;
                }
                results.put(response.getPositionId(), toPnLResult(response.getPositionId(), response));
            }
            return results;
        });
    }

    @Override
    public List<OptionContract> getOptionChain(String ticker, LocalDate expiration, OptionChainFilter filter) {
        OptionType optionType = filter.getOptionType().toOptionType();
        return execute("getOptionChain", () -> {
            List<OptionContractResponse> responses = pricingRestClient
                    .get()
                    .uri(builder -> {
                        builder.path("/options/chains/{ticker}/{expiration}");
                        if (optionType != null) {
                            builder.queryParam("option_type", optionType.name().toLowerCase());
                        }
                        if (filter.getMinStrike() != null) {
                            builder.queryParam("min_strike", filter.getMinStrike().toPlainString());
                        }
                        if (filter.getMaxStrike() != null) {
                            builder.queryParam("max_strike", filter.getMaxStrike().toPlainString());
                        }
                        return builder.build(ticker, expiration.toString());
                    })
                    .retrieve()
                    .body(CONTRACT_LIST);
            return pricingDtoMapper.toOptionContracts(requireBody("getOptionChain", responses));
        });
    }

    @Override
    public List<OptionExpiration> getExpirations(String ticker) {
        return execute("getExpirations", () -> {
            List<ExpirationResponse> responses = pricingRestClient
                    .get()
                    .uri("/options/chains/{ticker}/expirations", ticker)
                    .retrieve()
                    .body(EXPIRATION_LIST);
            return pricingDtoMapper.toOptionExpirations(requireBody("getExpirations", responses));
        });
    }

    private PnLResult toPnLResult(String positionId, PnLResultResponse response) {
        PnLResult result = pricingDtoMapper.toPnLResult(response);
        if (result.getPositionId() == null) {
            result.setPositionId(positionId);
        }
        return result;
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            log.debug("Pricing service {} answered {}", operation, e.getStatusCode().value());
            throw new PricingServiceException(
                    operation,
                    e.getStatusCode().value(),
                    "Pricing service " + operation + " failed with HTTP " + e.getStatusCode().value(),
                    e);
        } catch (ResourceAccessException e) {
            log.debug("Pricing service {} unreachable: {}", operation, e.getMessage());
            throw PricingServiceException.unreachable(operation, e);
        } catch (RestClientException | DateTimeException e) {
            throw new PricingServiceException(
                    operation,
                    PricingServiceException.MALFORMED_RESPONSE,
                    "Pricing service " + operation + " returned an unreadable response: " + e.getMessage(),
                    e);
        }
    }

    private static <T> T requireBody(String operation, T body) {
        if (body == null) {
            throw new PricingServiceException(
                    operation, PricingServiceException.MALFORMED_RESPONSE, "Pricing service " + operation + " returned no body");
        }
        return body;
    }
}
