package com.slotkeeper.slotmanagement.constant;

public class ReplicationSlotConstants {
    public static final String SLOT_DOES_NOT_EXIST_MESSAGE = "replication slot \"%s\" does not exist";
    public static final String SLOT_ALREADY_EXISTS_MESSAGE = "replication slot \"%s\" already exists";
    public static final String SLOT_INVALIDATED_MESSAGE = "can no longer get changes from replication slot \"%s\"";
    public static final String SLOT_ACTIVE_MESSAGE = "replication slot \"%s\" is active for handle %s";
    public static final String SLOT_SYNCED_USAGE_MESSAGE = "cannot use replication slot \"%s\" because it is being synchronized from the primary server";
    public static final String SLOT_CANNOT_BE_ADVANCED_MESSAGE = "replication slot \"%s\" cannot be advanced. This slot has never previously reserved WAL, or it has been invalidated.";
    public static final String INVALID_TARGET_LSN_MESSAGE = "invalid target WAL LSN";
    public static final String STREAMING_SESSION_NOT_FOUND_MESSAGE = "streaming session %s does not exist";
    public static final String SYNC_NOT_ALLOWED_MESSAGE = "replication slots can only be synchronized to a standby server";
    public static final String SYNC_IN_PROGRESS_MESSAGE = "cannot synchronize replication slots concurrently";
    public static final String PROMOTE_NOT_ALLOWED_MESSAGE = "recovery is not in progress";

    private ReplicationSlotConstants() {
    }
}
