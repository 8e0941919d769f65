package com.slotkeeper.rest.controller;

import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import com.slotkeeper.rest.constant.ApiConstants;
import com.slotkeeper.rest.filter.namebinding.SlotsRestored;
import com.slotkeeper.rest.filter.namebinding.StandbyOnly;
import com.slotkeeper.rest.model.api.node.NodeInfoResponseDto;
import com.slotkeeper.slotmanagement.service.api.NodePromotionService;
import com.slotkeeper.slotmanagement.service.api.SlotSyncAgent;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Path(ApiConstants.API_V1_PREFIX + "/node")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class NodeController {

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Inject
    NodePromotionService nodePromotionService;

    @Inject
    SlotSyncAgent slotSyncAgent;

    @GET
    public NodeInfoResponseDto getNodeInfo() {
        return NodeInfoResponseDto
                .builder()
                .role(nodeRuntimeProperties.getRole())
                .slotsRestored(nodeRuntimeProperties.isSlotsRestored())
                .lastSuccessfulSync(slotSyncAgent.getLastSuccessfulSync())
                .build();
    }

    @POST
    @StandbyOnly
    @SlotsRestored
    @Path("/promote")
    public NodeInfoResponseDto promote() {
        log.info("Received HTTP request to promote node.");
        nodePromotionService.promote();
        return getNodeInfo();
    }
}
