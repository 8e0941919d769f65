package com.slotkeeper.rest.mapper;

import com.slotkeeper.configuration.model.SlotSetting;
import com.slotkeeper.rest.model.api.settings.SettingDescriptionDto;
import com.slotkeeper.rest.model.api.settings.SettingValueDto;
import com.slotkeeper.rest.model.api.settings.SettingsResponseDto;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.collections4.CollectionUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@ApplicationScoped
public class SettingsDtoMapper {

    public SettingsResponseDto toDto(List<SlotSetting> settings) {
        return SettingsResponseDto
                .builder()
                .currentSettings(
                        settings.stream()
                                .map(setting -> SettingDescriptionDto
                                        .builder()
                                        .name(setting.getName())
                                        .settingValue(setting.getSettingValue())
                                        .unit(setting.getUnit())
                                        .context(setting.getContext())
                                        .description(setting.getDescription())
                                        .build()
                                )
                                .collect(Collectors.toList())
                )
                .build();
    }

    /**
     * Keeps request order. If same setting is present several times, last value wins.
     */
    public Map<String, String> toSettingsMap(List<SettingValueDto> settingsToPatch) {
        Map<String, String> ret = new LinkedHashMap<>();

        if (CollectionUtils.isEmpty(settingsToPatch)) {
            return ret;
        }

        for (SettingValueDto dto : settingsToPatch) {
            ret.put(dto.getName(), dto.getSettingValue());
        }

        return ret;
    }
}
