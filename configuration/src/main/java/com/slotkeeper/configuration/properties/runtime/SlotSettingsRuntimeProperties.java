package com.slotkeeper.configuration.properties.runtime;

import com.slotkeeper.configuration.event.SlotSettingsUpdatedEvent;
import com.slotkeeper.configuration.exception.ConfigurationInitializationException;
import com.slotkeeper.configuration.exception.InvalidSettingValueException;
import com.slotkeeper.configuration.exception.UnknownSettingException;
import com.slotkeeper.configuration.model.SlotSetting;
import com.slotkeeper.configuration.properties.constant.SlotSettingsConstants;
import com.slotkeeper.configuration.properties.predefined.ReplicationSlotProperties;
import com.slotkeeper.configuration.utils.PostgresSettingsUtils;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Settings which can be changed without restart. Every node reads only its own values.
 */
@Slf4j
@ApplicationScoped
public class SlotSettingsRuntimeProperties {

    @Inject
    ReplicationSlotProperties replicationSlotProperties;

    @Inject
    Event<SlotSettingsUpdatedEvent> slotSettingsUpdatedEvent;

    private final AtomicReference<Duration> inactiveTimeout = new AtomicReference<>(Duration.ZERO);

    @PostConstruct
    public void init() {
        try {
            inactiveTimeout.set(parseInactiveTimeout(replicationSlotProperties.inactiveTimeout()));
        } catch (InvalidSettingValueException e) {
            throw new ConfigurationInitializationException("Can not initialize " + SlotSettingsConstants.REPLICATION_SLOT_INACTIVE_TIMEOUT_SETTING_NAME, e);
        }
    }

    /**
     * @return current inactive timeout. {@link Duration#ZERO} means check is disabled.
     */
    public Duration getInactiveTimeout() {
        return inactiveTimeout.get();
    }

    public void setInactiveTimeout(Duration timeout) {
        inactiveTimeout.set(timeout);
    }

    public List<SlotSetting> getSettings() {
        return List.of(
                SlotSetting
                        .builder()
                        .name(SlotSettingsConstants.REPLICATION_SLOT_INACTIVE_TIMEOUT_SETTING_NAME)
                        .settingValue(PostgresSettingsUtils.convertDurationToPgTimeValue(inactiveTimeout.get()))
                        .unit(SlotSettingsConstants.SECONDS_UNIT)
                        .context(SlotSettingsConstants.RELOADABLE_SETTING_CONTEXT)
                        .description(SlotSettingsConstants.REPLICATION_SLOT_INACTIVE_TIMEOUT_DESCRIPTION)
                        .build()
        );
    }

    /**
     * Validates all provided values first and applies them only if every one of them is valid.
     */
    public void applySettings(Map<String, String> settings) throws UnknownSettingException, InvalidSettingValueException {
        Map<String, Duration> parsed = new LinkedHashMap<>();

        for (Map.Entry<String, String> setting : settings.entrySet()) {
            if (!SlotSettingsConstants.REPLICATION_SLOT_INACTIVE_TIMEOUT_SETTING_NAME.equals(setting.getKey())) {
                throw new UnknownSettingException("unrecognized configuration parameter \"" + setting.getKey() + "\"");
            }
            parsed.put(setting.getKey(), parseInactiveTimeout(setting.getValue()));
        }

        if (parsed.isEmpty()) {
            return;
        }

        Duration newTimeout = parsed.get(SlotSettingsConstants.REPLICATION_SLOT_INACTIVE_TIMEOUT_SETTING_NAME);
        Duration oldTimeout = inactiveTimeout.getAndSet(newTimeout);

        log.info("Parameter \"{}\" changed from \"{}\" to \"{}\"",
                SlotSettingsConstants.REPLICATION_SLOT_INACTIVE_TIMEOUT_SETTING_NAME,
                PostgresSettingsUtils.convertDurationToPgTimeValue(oldTimeout),
                PostgresSettingsUtils.convertDurationToPgTimeValue(newTimeout)
        );

        slotSettingsUpdatedEvent.fire(new SlotSettingsUpdatedEvent(parsed.keySet()));
    }

    public static Duration parseInactiveTimeout(String value) throws InvalidSettingValueException {
        if (StringUtils.isBlank(value)) {
            throw new InvalidSettingValueException("invalid value for parameter \"" + SlotSettingsConstants.REPLICATION_SLOT_INACTIVE_TIMEOUT_SETTING_NAME + "\": \"" + value + "\"");
        }

        Duration duration;
        try {
            duration = PostgresSettingsUtils.convertPgTimeValueToDuration(value, PostgresSettingsUtils.PgTimeUnit.SECONDS);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new InvalidSettingValueException("invalid value for parameter \"" + SlotSettingsConstants.REPLICATION_SLOT_INACTIVE_TIMEOUT_SETTING_NAME + "\": \"" + value + "\". " + e.getMessage(), e);
        }

        // unit of the setting is seconds, sub-second values are rounded to the nearest second
        duration = duration.plusMillis(500).truncatedTo(ChronoUnit.SECONDS);

        if (duration.getSeconds() > SlotSettingsConstants.MAX_INACTIVE_TIMEOUT_SECONDS) {
            throw new InvalidSettingValueException(
                    value + " is outside the valid range for parameter \"" + SlotSettingsConstants.REPLICATION_SLOT_INACTIVE_TIMEOUT_SETTING_NAME + "\" (0 .. " + SlotSettingsConstants.MAX_INACTIVE_TIMEOUT_SECONDS + ")"
            );
        }

        return duration;
    }
}
