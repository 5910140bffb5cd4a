package com.layoutmapper.util;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number formatting shared by the digest and report builders.
 */
@UtilityClass
public class FormatUtil {

    /**
     * Shortest plain decimal form: 50.0 -> "50", 0.50 -> "0.5", 12.25 -> "12.25".
     */
    public static String compact(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "0";
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.scale() < 0) {
            decimal = decimal.setScale(0, RoundingMode.UNNECESSARY);
        }
        String text = decimal.toPlainString();
        return "-0".equals(text) ? "0" : text;
    }

    /**
     * Rounds half-up to the given number of decimal places.
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Ratio rounded to {@code places}, or 0 when the denominator is zero.
     */
    public static double ratio(long numerator, long denominator, int places) {
        if (denominator == 0) {
            return 0.0;
        }
        return round((double) numerator / denominator, places);
    }
}
