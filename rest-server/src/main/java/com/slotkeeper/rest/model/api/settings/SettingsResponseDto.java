package com.slotkeeper.rest.model.api.settings;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingsResponseDto {
    private List<SettingDescriptionDto> currentSettings;
}
