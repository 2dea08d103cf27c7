package com.optiontracker.pricing.mapper;

import com.optiontracker.domain.model.Greeks;
import com.optiontracker.domain.model.OptionContract;
import com.optiontracker.domain.model.OptionExpiration;
import com.optiontracker.domain.model.PnLResult;
import com.optiontracker.domain.model.Position;
import com.optiontracker.pricing.dto.ExpirationResponse;
import com.optiontracker.pricing.dto.GreeksRequest;
import com.optiontracker.pricing.dto.GreeksResponse;
import com.optiontracker.pricing.dto.OptionContractResponse;
import com.optiontracker.pricing.dto.PnLResultResponse;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the pricing service wire DTOs and the domain model.
 *
 * <p>Field names line up one-to-one once Jackson has applied the snake_case naming
 * strategy, so only the type conversions below need hand-written code. The service
 * sometimes sends expirations as full timestamps ({@code 2025-01-17T00:00:00}); only the
 * date part is kept.
 */
@Mapper
public interface PricingDtoMapper {

    Greeks toGreeks(GreeksResponse response);

    @Mapping(target = "pnlPercent", defaultValue = "0")
    @Mapping(target = "error", ignore = true)
    @Mapping(target = "clientCalculated", ignore = true)
    PnLResult toPnLResult(PnLResultResponse response);

    OptionContract toOptionContract(OptionContractResponse response);

    List<OptionContract> toOptionContracts(List<OptionContractResponse> responses);

    OptionExpiration toOptionExpiration(ExpirationResponse response);

    List<OptionExpiration> toOptionExpirations(List<ExpirationResponse> responses);

    @Mapping(target = "positionId", source = "id")
    @Mapping(target = "optionType", source = "type")
    GreeksRequest toGreeksRequest(Position position);

    default LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        int timeSeparator = value.indexOf('T');
        return LocalDate.parse(timeSeparator > 0 ? value.substring(0, timeSeparator) : value.trim());
    }

    default String formatDate(LocalDate date) {
        return date != null ? date.toString() : null;
    }

    /** Accepts timestamps with or without an offset; offset timestamps are converted to the local zone. */
    default LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(value)
                    .atZoneSameInstant(ZoneId.systemDefault())
                    .toLocalDateTime();
        }
    }
}
