package com.optiontracker.api.controller;

import com.optiontracker.api.dto.request.TheoreticalPnLSettingsRequest;
import com.optiontracker.calculation.TheoreticalPnLSettingsService;
import com.optiontracker.domain.model.TheoreticalPnLSettings;
import com.optiontracker.mapper.ApiDtoMapper;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Theoretical P&L scenario. Changing it does not recalculate; the next theoretical P&L
 * recalculation uses the new values.
 */
@RestController
@RequestMapping("/api/settings/theoretical-pnl")
public class SettingsController {

    private final TheoreticalPnLSettingsService settingsService;
    private final ApiDtoMapper apiDtoMapper;

    public SettingsController(TheoreticalPnLSettingsService settingsService, ApiDtoMapper apiDtoMapper) {
        this.settingsService = settingsService;
        this.apiDtoMapper = apiDtoMapper;
    }

    @GetMapping
    public TheoreticalPnLSettings getSettings() {
        return settingsService.getSettings();
    }

    @PutMapping
    public TheoreticalPnLSettings updateSettings(@RequestBody @Valid TheoreticalPnLSettingsRequest request) {
        return settingsService.update(apiDtoMapper.toDomain(request));
    }

    @DeleteMapping
    public TheoreticalPnLSettings resetSettings() {
        return settingsService.reset();
    }
}
