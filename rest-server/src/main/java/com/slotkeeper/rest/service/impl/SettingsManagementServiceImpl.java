package com.slotkeeper.rest.service.impl;

import com.slotkeeper.configuration.properties.runtime.SlotSettingsRuntimeProperties;
import com.slotkeeper.rest.exception.InvalidRequestException;
import com.slotkeeper.rest.mapper.SettingsDtoMapper;
import com.slotkeeper.rest.model.api.settings.PatchSettingsRequestDto;
import com.slotkeeper.rest.model.api.settings.SettingsResponseDto;
import com.slotkeeper.rest.service.api.SettingsManagementService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
@ApplicationScoped
public class SettingsManagementServiceImpl implements SettingsManagementService {

    @Inject
    SlotSettingsRuntimeProperties slotSettingsRuntimeProperties;

    @Inject
    SettingsDtoMapper settingsDtoMapper;

    @Override
    public SettingsResponseDto getCurrentSettings() {
        return settingsDtoMapper.toDto(slotSettingsRuntimeProperties.getSettings());
    }

    @Override
    public SettingsResponseDto patchSettings(PatchSettingsRequestDto requestDto) {
        if (requestDto == null) {
            throw new InvalidRequestException("Request body is required");
        }

        Map<String, String> settings = settingsDtoMapper.toSettingsMap(requestDto.getSettingsToPatch());
        if (settings.isEmpty()) {
            throw new InvalidRequestException("No settings to patch were provided");
        }

        slotSettingsRuntimeProperties.applySettings(settings);
        log.info("Settings {} were changed by HTTP request.", settings.keySet());

        return getCurrentSettings();
    }
}
