package com.optiontracker.calculation;

import com.optiontracker.domain.model.TheoreticalPnLSettings;
import com.optiontracker.exception.BusinessException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holds the scenario used by every theoretical P&L calculation. One instance per engine;
 * an update replaces the settings atomically and takes effect on the next recalculation.
 */
@Service
public class TheoreticalPnLSettingsService {

    private static final Logger log = LoggerFactory.getLogger(TheoreticalPnLSettingsService.class);

    private final AtomicReference<TheoreticalPnLSettings> settings =
            new AtomicReference<>(TheoreticalPnLSettings.defaults());

    public TheoreticalPnLSettings getSettings() {
        return settings.get();
    }

    public TheoreticalPnLSettings update(TheoreticalPnLSettings next) {
        if (next.getDaysForward() < 0) {
            throw new BusinessException("daysForward must not be negative: " + next.getDaysForward());
        }
        if (next.getPriceChangePercent() == null) {
            throw new BusinessException("priceChangePercent is required");
        }
        TheoreticalPnLSettings previous = settings.getAndSet(next);
        log.info(
                "Theoretical P&L settings changed: daysForward {} -> {}, priceChange {}% -> {}%",
                previous.getDaysForward(),
                next.getDaysForward(),
                previous.getPriceChangePercent(),
                next.getPriceChangePercent());
        return next;
    }

    public TheoreticalPnLSettings reset() {
        return update(TheoreticalPnLSettings.defaults());
    }
}
