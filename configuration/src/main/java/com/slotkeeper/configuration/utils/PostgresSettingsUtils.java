package com.slotkeeper.configuration.utils;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PostgresSettingsUtils {

    private static final Pattern TIME_VALUE_PATTERN = Pattern.compile("^(\\d+)\\s*([a-z]*)$");

    @Getter
    @RequiredArgsConstructor
    public enum PgTimeUnit {
        MICROSECONDS("us", ChronoUnit.MICROS),
        MILLISECONDS("ms", ChronoUnit.MILLIS),
        SECONDS("s", ChronoUnit.SECONDS),
        MINUTES("min", ChronoUnit.MINUTES),
        HOURS("h", ChronoUnit.HOURS),
        DAYS("d", ChronoUnit.DAYS);

        private final String textValue;
        private final ChronoUnit chronoUnit;

        public static PgTimeUnit from(String unitTextValue) throws IllegalArgumentException {
            return Arrays.stream(PgTimeUnit.values())
                    .filter(v -> v.textValue.equals(unitTextValue))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown time unit '" + unitTextValue + "'. Valid units for this parameter are \"us\", \"ms\", \"s\", \"min\", \"h\", and \"d\"."));
        }
    }

    /**
     * Parses time setting value the way postgresql.conf does. Surrounding whitespace is ignored, value without unit is interpreted in default unit.
     */
    public static Duration convertPgTimeValueToDuration(String value, PgTimeUnit defaultUnit) throws IllegalArgumentException {
        if (value == null) {
            throw new IllegalArgumentException("Time value can not be null");
        }

        String stripped = StringUtils.strip(value);
        Matcher matcher = TIME_VALUE_PATTERN.matcher(stripped);

        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid value for time setting: \"" + value + "\"");
        }

        long amount = Long.parseLong(matcher.group(1));
        String unitText = matcher.group(2);
        PgTimeUnit unit = StringUtils.isEmpty(unitText) ? defaultUnit : PgTimeUnit.from(unitText);

        return Duration.of(amount, unit.getChronoUnit());
    }

    /**
     * Converts duration to the shortest exact Postgres representation, for example 60 seconds become "1min".
     */
    public static String convertDurationToPgTimeValue(Duration duration) {
        if (duration.isZero()) {
            return "0";
        }

        List<PgTimeUnit> unitsFromLargest = Arrays.asList(
                PgTimeUnit.DAYS,
                PgTimeUnit.HOURS,
                PgTimeUnit.MINUTES,
                PgTimeUnit.SECONDS,
                PgTimeUnit.MILLISECONDS
        );

        for (PgTimeUnit unit : unitsFromLargest) {
            Duration unitDuration = unit.getChronoUnit().getDuration();
            if (duration.toNanos() % unitDuration.toNanos() == 0) {
                return duration.toNanos() / unitDuration.toNanos() + unit.getTextValue();
            }
        }

        return duration.toNanos() / 1000 + PgTimeUnit.MICROSECONDS.getTextValue();
    }

    private PostgresSettingsUtils() {
    }
}
