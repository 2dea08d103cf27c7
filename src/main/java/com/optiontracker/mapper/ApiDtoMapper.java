package com.optiontracker.mapper;

import com.optiontracker.api.dto.request.CreatePositionRequest;
import com.optiontracker.api.dto.request.TheoreticalPnLSettingsRequest;
import com.optiontracker.api.dto.response.OptionChainEntryResponse;
import com.optiontracker.domain.model.OptionContract;
import com.optiontracker.domain.model.Position;
import com.optiontracker.domain.model.TheoreticalPnLSettings;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between REST request/response DTOs and the domain model.
 *
 * <p>Calculated fields of a new position (Greeks, P&L, override flag) start empty; the
 * chain entry's mark price is filled in by the controller from the MarkPriceDeriver.
 */
@Mapper
public interface ApiDtoMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "markPriceOverride", ignore = true)
    @Mapping(target = "greeks", ignore = true)
    @Mapping(target = "greeksError", ignore = true)
    @Mapping(target = "pnl", ignore = true)
    @Mapping(target = "theoreticalPnl", ignore = true)
    @Mapping(target = "lastUpdated", ignore = true)
    Position toDomain(CreatePositionRequest request);

    TheoreticalPnLSettings toDomain(TheoreticalPnLSettingsRequest request);

    @Mapping(target = "markPrice", ignore = true)
    OptionChainEntryResponse toResponse(OptionContract contract);
}
