package com.optiontracker.calendar;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * US market calendar and the option chain cache TTL for each session, bound to
 * {@code option-tracker.market-hours.*}.
 *
 * <p>Holidays are full market closures only; half days are treated as regular days.
 */
@Component
@ConfigurationProperties(prefix = "option-tracker.market-hours")
@Getter
@Setter
public class MarketHoursConfig {

    private String timezone = "America/New_York";

    private List<LocalDate> holidays = new ArrayList<>();

    private Duration regularTtl = Duration.ofMinutes(1);

    private Duration extendedTtl = Duration.ofMinutes(5);

    private Duration closedTtl = Duration.ofMinutes(15);

    private Duration weekendTtl = Duration.ofMinutes(30);
}
