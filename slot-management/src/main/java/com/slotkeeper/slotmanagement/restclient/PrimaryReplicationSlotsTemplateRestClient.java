package com.slotkeeper.slotmanagement.restclient;

import com.slotkeeper.slotmanagement.restclient.model.RemoteReplicationSlotDto;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.io.Closeable;
import java.util.List;

@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
@Path("")
public interface PrimaryReplicationSlotsTemplateRestClient extends Closeable {

    @GET
    @Path("/api/v1/replication-slots")
    List<RemoteReplicationSlotDto> getReplicationSlots(@QueryParam("failover") Boolean failover);
}
