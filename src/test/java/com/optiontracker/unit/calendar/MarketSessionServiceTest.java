package com.optiontracker.unit.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import com.optiontracker.calendar.MarketHoursConfig;
import com.optiontracker.calendar.MarketSessionService;
import com.optiontracker.domain.enums.MarketSession;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MarketSessionServiceTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private MarketHoursConfig config;
    private MarketSessionService service;

    @BeforeEach
    void setUp() {
        config = new MarketHoursConfig();
        config.setHolidays(List.of(LocalDate.of(2025, 7, 4)));
        // Monday 2025-03-10 10:00 New York (EDT)
        service = new MarketSessionService(config, Clock.fixed(Instant.parse("2025-03-10T14:00:00Z"), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Session classification")
    class Classification {

        @Test
        void regularSession() {
            assertThat(service.sessionAt(nyTime(2025, 3, 10, 10, 0))).isEqualTo(MarketSession.REGULAR);
        }

        @Test
        @DisplayName("Open is inclusive, close is exclusive")
        void boundaries() {
            assertThat(service.sessionAt(nyTime(2025, 3, 10, 9, 30))).isEqualTo(MarketSession.REGULAR);
            assertThat(service.sessionAt(nyTime(2025, 3, 10, 16, 0))).isEqualTo(MarketSession.EXTENDED);
            assertThat(service.sessionAt(nyTime(2025, 3, 10, 4, 0))).isEqualTo(MarketSession.EXTENDED);
            assertThat(service.sessionAt(nyTime(2025, 3, 10, 20, 0))).isEqualTo(MarketSession.CLOSED);
        }

        @Test
        void preMarketAndAfterHours() {
            assertThat(service.sessionAt(nyTime(2025, 3, 10, 8, 0))).isEqualTo(MarketSession.EXTENDED);
            assertThat(service.sessionAt(nyTime(2025, 3, 10, 17, 30))).isEqualTo(MarketSession.EXTENDED);
        }

        @Test
        void overnight() {
            assertThat(service.sessionAt(nyTime(2025, 3, 10, 23, 0))).isEqualTo(MarketSession.CLOSED);
            assertThat(service.sessionAt(nyTime(2025, 3, 11, 2, 0))).isEqualTo(MarketSession.CLOSED);
        }

        @Test
        @DisplayName("Weekends and holidays are WEEKEND at any time of day")
        void weekendAndHoliday() {
            assertThat(service.sessionAt(nyTime(2025, 3, 8, 11, 0))).isEqualTo(MarketSession.WEEKEND);
            assertThat(service.sessionAt(nyTime(2025, 7, 4, 11, 0))).isEqualTo(MarketSession.WEEKEND);
        }

        @Test
        @DisplayName("Instants in other zones are converted to market time")
        void convertsZone() {
            // 14:30 UTC on a March EDT day is 10:30 in New York
            ZonedDateTime utc = ZonedDateTime.of(LocalDateTime.of(2025, 3, 10, 14, 30), ZoneOffset.UTC);
            assertThat(service.sessionAt(utc)).isEqualTo(MarketSession.REGULAR);
        }
    }

    @Nested
    @DisplayName("Cache TTL")
    class CacheTtl {

        @Test
        @DisplayName("TTL grows as the market gets quieter")
        void ttlPerSession() {
            assertThat(service.cacheTtl(MarketSession.REGULAR)).isEqualTo(Duration.ofMinutes(1));
            assertThat(service.cacheTtl(MarketSession.EXTENDED)).isEqualTo(Duration.ofMinutes(5));
            assertThat(service.cacheTtl(MarketSession.CLOSED)).isEqualTo(Duration.ofMinutes(15));
            assertThat(service.cacheTtl(MarketSession.WEEKEND)).isEqualTo(Duration.ofMinutes(30));
        }

        @Test
        void currentTtlUsesClock() {
            assertThat(service.currentSession()).isEqualTo(MarketSession.REGULAR);
            assertThat(service.currentCacheTtl()).isEqualTo(Duration.ofMinutes(1));
        }

        @Test
        void configuredTtlIsUsed() {
            config.setClosedTtl(Duration.ofMinutes(45));

            assertThat(service.cacheTtl(MarketSession.CLOSED)).isEqualTo(Duration.ofMinutes(45));
        }
    }

    private static ZonedDateTime nyTime(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(LocalDateTime.of(year, month, day, hour, minute), NEW_YORK);
    }
}
