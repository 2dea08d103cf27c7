package com.optiontracker.unit.calculation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optiontracker.calculation.TheoreticalPnLSettingsService;
import com.optiontracker.domain.model.TheoreticalPnLSettings;
import com.optiontracker.exception.BusinessException;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TheoreticalPnLSettingsServiceTest {

    private TheoreticalPnLSettingsService service;

    @BeforeEach
    void setUp() {
        service = new TheoreticalPnLSettingsService();
    }

    @Test
    @DisplayName("Starts with no shift")
    void defaults() {
        assertThat(service.getSettings().getDaysForward()).isZero();
        assertThat(service.getSettings().getPriceChangePercent()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Update replaces the scenario")
    void update() {
        service.update(settings(7, "-5"));

        assertThat(service.getSettings().getDaysForward()).isEqualTo(7);
        assertThat(service.getSettings().getPriceChangePercent()).isEqualByComparingTo("-5");
    }

    @Test
    @DisplayName("Negative days forward is rejected and the previous scenario kept")
    void rejectsNegativeDays() {
        service.update(settings(3, "2"));

        assertThatThrownBy(() -> service.update(settings(-1, "2"))).isInstanceOf(BusinessException.class);
        assertThat(service.getSettings().getDaysForward()).isEqualTo(3);
    }

    @Test
    @DisplayName("Missing price change is rejected")
    void rejectsMissingPriceChange() {
        assertThatThrownBy(() -> service.update(TheoreticalPnLSettings.builder().daysForward(1).build()))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("priceChangePercent");
    }

    @Test
    @DisplayName("Reset restores the defaults")
    void reset() {
        service.update(settings(10, "15"));

        service.reset();

        assertThat(service.getSettings()).isEqualTo(TheoreticalPnLSettings.defaults());
    }

    private static TheoreticalPnLSettings settings(int days, String pct) {
        return TheoreticalPnLSettings.builder()
                .daysForward(days)
                .priceChangePercent(new BigDecimal(pct))
                .build();
    }
}
