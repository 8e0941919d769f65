package com.slotkeeper.rest.controller;

import com.slotkeeper.rest.constant.ApiConstants;
import com.slotkeeper.rest.model.api.settings.PatchSettingsRequestDto;
import com.slotkeeper.rest.model.api.settings.SettingsResponseDto;
import com.slotkeeper.rest.service.api.SettingsManagementService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;

@Path(ApiConstants.API_V1_PREFIX + "/settings")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SettingsController {

    @Inject
    SettingsManagementService settingsManagementService;

    @GET
    public SettingsResponseDto getSettings() {
        return settingsManagementService.getCurrentSettings();
    }

    @PATCH
    public SettingsResponseDto patchSettings(PatchSettingsRequestDto requestDto) {
        return settingsManagementService.patchSettings(requestDto);
    }
}
