package com.slotkeeper.configuration.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SlotSetting {
    private String name;
    private String settingValue;
    private String unit;
    private String context;
    private String description;
}
