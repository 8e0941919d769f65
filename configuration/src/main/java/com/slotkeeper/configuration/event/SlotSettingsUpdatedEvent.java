package com.slotkeeper.configuration.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Event which is fired when runtime slot settings were changed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlotSettingsUpdatedEvent {
    private Set<String> changedSettingNames;
}
