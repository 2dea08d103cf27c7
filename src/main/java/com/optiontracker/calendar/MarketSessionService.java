package com.optiontracker.calendar;

import com.optiontracker.domain.enums.MarketSession;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.stereotype.Service;

/**
 * Classifies the current moment into a US market session and maps it to a cache TTL.
 *
 * <p>Quotes move fastest during the regular session, so chain data is cached for the
 * shortest time then and for progressively longer outside it.
 */
@Service
public class MarketSessionService {

    private final MarketHoursConfig marketHoursConfig;
    private final Clock clock;
    private final ZoneId zone;

    public MarketSessionService(MarketHoursConfig marketHoursConfig, Clock clock) {
        this.marketHoursConfig = marketHoursConfig;
        this.clock = clock;
        this.zone = ZoneId.of(marketHoursConfig.getTimezone());
    }

    public MarketSession currentSession() {
        return sessionAt(ZonedDateTime.now(clock));
    }

    /**
     * Testable version: the session at the given instant, evaluated in market time.
     */
    public MarketSession sessionAt(ZonedDateTime dateTime) {
        ZonedDateTime marketTime = dateTime.withZoneSameInstant(zone);
        if (!isTradingDay(marketTime.toLocalDate())) {
            return MarketSession.WEEKEND;
        }
        LocalTime time = marketTime.toLocalTime();
        if (isWithin(time, MarketSession.REGULAR)) {
            return MarketSession.REGULAR;
        }
        if (isWithin(time, MarketSession.EXTENDED)) {
            return MarketSession.EXTENDED;
        }
        return MarketSession.CLOSED;
    }

    /** TTL for chain data fetched now. */
    public Duration currentCacheTtl() {
        return cacheTtl(currentSession());
    }

    public Duration cacheTtl(MarketSession session) {
        switch (session) {
            case REGULAR:
                return marketHoursConfig.getRegularTtl();
            case EXTENDED:
                return marketHoursConfig.getExtendedTtl();
            case CLOSED:
                return marketHoursConfig.getClosedTtl();
            default:
                return marketHoursConfig.getWeekendTtl();
        }
    }

    /** Weekdays that are not configured holidays. */
    public boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        return !marketHoursConfig.getHolidays().contains(date);
    }

    private static boolean isWithin(LocalTime time, MarketSession session) {
        return !time.isBefore(session.getStartTime()) && time.isBefore(session.getEndTime());
    }
}
