package com.slotkeeper.rest.service.api;

import com.slotkeeper.rest.model.api.settings.PatchSettingsRequestDto;
import com.slotkeeper.rest.model.api.settings.SettingsResponseDto;

public interface SettingsManagementService {

    SettingsResponseDto getCurrentSettings();

    SettingsResponseDto patchSettings(PatchSettingsRequestDto requestDto);
}
