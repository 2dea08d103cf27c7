package com.optiontracker.domain.enums;

import java.time.LocalTime;

/**
 * US equity/options market sessions (America/New_York), with their time boundaries.
 *
 * <pre>
 * 04:00-09:30  EXTENDED : Pre-market
 * 09:30-16:00  REGULAR  : Regular trading session, quotes move quickly
 * 16:00-20:00  EXTENDED : After-hours
 * 20:00-04:00  CLOSED   : Overnight
 * weekends and full holidays are WEEKEND
 * </pre>
 *
 * <p>MarketSessionService uses the session to pick the option chain cache TTL.
 */
public enum MarketSession {
    REGULAR(LocalTime.of(9, 30), LocalTime.of(16, 0)),
    EXTENDED(LocalTime.of(4, 0), LocalTime.of(20, 0)),
    CLOSED(LocalTime.of(20, 0), LocalTime.of(4, 0)),
    WEEKEND(LocalTime.MIDNIGHT, LocalTime.MIDNIGHT);

    private final LocalTime startTime;
    private final LocalTime endTime;

    MarketSession(LocalTime startTime, LocalTime endTime) {
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }
}
