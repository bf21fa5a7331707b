package com.querysentinel.core.detection;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number formatting for finding details: at most two decimals, no trailing
 * zeros ({@code 2}, {@code 22.5}, {@code 10.47}).
 */
final class DetailFormat {

    private static final int SCALE = 2;

    private DetailFormat() {
        // utility class, not instantiable
    }

    static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value)
                .setScale(SCALE, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        // stripTrailingZeros turns 0.00 into 0 but 100 into 1E+2
        return rounded.signum() == 0 ? "0" : rounded.toPlainString();
    }
}
