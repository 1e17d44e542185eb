package com.xedledom.civitai;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formats a file size given in kilobytes with the largest unit that keeps the value at
 * least 1: {@code 500 KB}, {@code 2 MB}, {@code 1.37 GB}.
 */
public final class SizeFormatter {

    private static final double KB_PER_MB = 1024d;
    private static final double KB_PER_GB = 1024d * 1024d;

    private SizeFormatter() {}

    public static String fromKilobytes(double kb) {
        if (!(kb > 0) || Double.isInfinite(kb)) {
            return "";
        }
        if (kb >= KB_PER_GB) {
            return twoDecimals(kb / KB_PER_GB) + " GB";
        }
        if (kb >= KB_PER_MB) {
            return twoDecimals(kb / KB_PER_MB) + " MB";
        }
        return (long) kb + " KB";
    }

    private static String twoDecimals(double value) {
        return BigDecimal.valueOf(value)
                .setScale(2, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }
}
