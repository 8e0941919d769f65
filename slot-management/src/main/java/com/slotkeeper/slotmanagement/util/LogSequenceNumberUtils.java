package com.slotkeeper.slotmanagement.util;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class LogSequenceNumberUtils {

    public static final long INVALID_LSN = 0;
    private static final Pattern LSN_PATTERN = Pattern.compile("^([0-9A-Fa-f]{1,8})/([0-9A-Fa-f]{1,8})$");

    private LogSequenceNumberUtils() {
    }

    public static String lsnToString(long lsn) {
        return String.format("%X/%X", lsn >>> 32, lsn & 0xFFFFFFFFL);
    }

    /**
     * Parses LSN in textual form, for example 16/B374D848.
     *
     * @param strValue LSN as string
     * @return LSN as 64-bit unsigned value
     * @throws IllegalArgumentException if value is not a valid LSN
     */
    public static long stringToLsn(String strValue) {
        if (StringUtils.isBlank(strValue)) {
            throw new IllegalArgumentException("invalid input syntax for type pg_lsn: \"" + strValue + "\"");
        }

        Matcher matcher = LSN_PATTERN.matcher(strValue.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("invalid input syntax for type pg_lsn: \"" + strValue + "\"");
        }

        long logicalXlog = Long.parseLong(matcher.group(1), 16);
        long segment = Long.parseLong(matcher.group(2), 16);

        return (logicalXlog << 32) | segment;
    }

    public static long stringToLsnOrInvalid(String strValue) {
        if (StringUtils.isBlank(strValue)) {
            return INVALID_LSN;
        }
        return stringToLsn(strValue);
    }

    public static String lsnToStringOrNull(long lsn) {
        return lsn == INVALID_LSN ? null : lsnToString(lsn);
    }

    public static int compareTwoLsn(long lsn1, long lsn2) {
        return Long.compareUnsigned(lsn1, lsn2);
    }

    public static long maxLsn(long lsn1, long lsn2) {
        return compareTwoLsn(lsn1, lsn2) >= 0 ? lsn1 : lsn2;
    }
}
