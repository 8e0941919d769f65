package com.slotkeeper.rest.model.api.settings;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingDescriptionDto {
    private String name;
    private String settingValue;
    private String unit;
    private String context;
    private String description;
}
