package com.loopguard.runtime.memory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Human-readable byte counts for log messages. */
final class Bytes {

    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private Bytes() {}

    static String format(long bytes) {
        double value = bytes;
        int unit = 0;
        while (Math.abs(value) >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString()
            + " " + UNITS[unit];
    }
}
