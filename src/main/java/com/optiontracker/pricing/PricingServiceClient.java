package com.optiontracker.pricing;

import com.optiontracker.domain.model.Greeks;
import com.optiontracker.domain.model.OptionChainFilter;
import com.optiontracker.domain.model.OptionContract;
import com.optiontracker.domain.model.OptionExpiration;
import com.optiontracker.domain.model.PnLResult;
import com.optiontracker.domain.model.Position;
import com.optiontracker.domain.model.TheoreticalPnLSettings;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Contract of the remote pricing/market-data service.
 *
 * <p>Every method either returns a value or throws
 * {@link com.optiontracker.exception.PricingServiceException} carrying the HTTP status
 * (0 when no response was received). Retrying and falling back are the caller's job;
 * implementations make exactly one request per call.
 */
public interface PricingServiceClient {

    /** Greeks for the position, already adjusted for action and quantity. */
    Greeks getGreeks(Position position);

    /**
     * Current P&L for a stored position.
     *
     * @param forceRecompute bypass any value the service cached for this position
     */
    PnLResult getPnL(String positionId, boolean forceRecompute);

    /** P&L under the given forward scenario. */
    PnLResult getTheoreticalPnL(String positionId, TheoreticalPnLSettings settings, boolean forceRecompute);

    /** Theoretical P&L for several positions in one request, keyed by position id. */
    Map<String, PnLResult> getBulkTheoreticalPnL(
            List<String> positionIds, TheoreticalPnLSettings settings, boolean forceRecompute);

    /** Contracts for one expiration, restricted server-side by type and strike bounds. */
    List<OptionContract> getOptionChain(String ticker, LocalDate expiration, OptionChainFilter filter);

    /** Listed expirations for the ticker, nearest first. */
    List<OptionExpiration> getExpirations(String ticker);
}
