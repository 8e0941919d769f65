package com.slotkeeper.rest.controller;

import com.slotkeeper.configuration.properties.runtime.WalRuntimeProperties;
import com.slotkeeper.rest.exception.InvalidRequestException;
import com.slotkeeper.rest.model.api.wal.WalPositionsDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WalControllerTest {

    private WalRuntimeProperties walRuntimeProperties;
    private WalController controller;

    @BeforeEach
    void setUp() {
        walRuntimeProperties = new WalRuntimeProperties();
        controller = new WalController();
        controller.walRuntimeProperties = walRuntimeProperties;
    }

    @Test
    void reportedPositionsAreStored() {
        WalPositionsDto response = controller.updateWalPositions(new WalPositionsDto("0/4000000", "0/2000000"));

        assertThat(walRuntimeProperties.getCurrentLsn()).isEqualTo(0x4000000L);
        assertThat(walRuntimeProperties.getOldestRetainedLsn()).isEqualTo(0x2000000L);
        assertThat(response.getCurrentLsn()).isEqualTo("0/4000000");
    }

    @Test
    void absentPositionIsLeftUnchanged() {
        walRuntimeProperties.setOldestRetainedLsn(0x1000000L);

        WalPositionsDto response = controller.updateWalPositions(new WalPositionsDto("0/4000000", null));

        assertThat(walRuntimeProperties.getOldestRetainedLsn()).isEqualTo(0x1000000L);
        assertThat(response.getOldestRetainedLsn()).isEqualTo("0/1000000");
    }

    @Test
    void invalidPositionDoesNotApplyAnyValue() {
        assertThatThrownBy(() -> controller.updateWalPositions(new WalPositionsDto("0/4000000", "garbage")))
                .isInstanceOf(InvalidRequestException.class);

        assertThat(walRuntimeProperties.getCurrentLsn()).isZero();
    }
}
