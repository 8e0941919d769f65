package com.slotkeeper.slotmanagement.transport.impl;

import com.slotkeeper.configuration.properties.predefined.SlotSyncProperties;
import com.slotkeeper.slotmanagement.exception.SyncTransportException;
import com.slotkeeper.slotmanagement.mapper.ReplicationSlotMapper;
import com.slotkeeper.slotmanagement.model.RemoteSlotState;
import com.slotkeeper.slotmanagement.restclient.PrimaryReplicationSlotsTemplateRestClient;
import com.slotkeeper.slotmanagement.restclient.model.RemoteReplicationSlotDto;
import com.slotkeeper.slotmanagement.transport.api.PrimarySlotSource;
import com.slotkeeper.slotmanagement.util.DynamicRestClientUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
@ApplicationScoped
public class RestPrimarySlotSource implements PrimarySlotSource {

    @Inject
    DynamicRestClientUtils dynamicRestClientUtils;

    @Inject
    SlotSyncProperties slotSyncProperties;

    @Inject
    ReplicationSlotMapper replicationSlotMapper;

    @Override
    public List<RemoteSlotState> fetchFailoverSlots() throws SyncTransportException {
        String host = slotSyncProperties.primaryHost();
        int port = slotSyncProperties.primaryPort();

        PrimaryReplicationSlotsTemplateRestClient client = null;
        try {
            client = dynamicRestClientUtils.createRestClient(
                    PrimaryReplicationSlotsTemplateRestClient.class,
                    host,
                    port,
                    slotSyncProperties.timeout().toMillis()
            );

            List<RemoteReplicationSlotDto> response = client.getReplicationSlots(true);
            if (response == null) {
                return Collections.emptyList();
            }

            List<RemoteSlotState> ret = new ArrayList<>();
            for (RemoteReplicationSlotDto dto : response) {
                ret.add(replicationSlotMapper.toRemoteState(dto));
            }

            log.debug("Fetched {} failover replication slots from primary {}:{}", ret.size(), host, port);
            return ret;
        } catch (Exception e) {
            throw new SyncTransportException("Failed to fetch replication slots from primary " + host + ":" + port, e);
        } finally {
            dynamicRestClientUtils.closeClient(client);
        }
    }
}
