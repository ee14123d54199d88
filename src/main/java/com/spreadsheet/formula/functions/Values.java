package com.spreadsheet.formula.functions;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Numeric coercion and rendering of cell values.
 */
public final class Values {

    // Plain decimal numbers only: no hex, no "NaN", no type suffixes like "1d"
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    // Plain notation inside [1e-7, 1e21), exponent form outside it
    private static final double PLAIN_LOWER = 1e-7;
    private static final double PLAIN_UPPER = 1e21;

    private Values() {
    }

    /**
     * True if the string is a number; surrounding whitespace is ignored, the empty string is not a number.
     */
    public static boolean isNumeric(String value) {
        return value != null && NUMBER.matcher(value.trim()).matches();
    }

    /**
     * The numeric value of a string, or 0 when it isn't a number.
     */
    public static double toNumber(String value) {
        return isNumeric(value) ? Double.parseDouble(value.trim()) : 0d;
    }

    /**
     * Renders a computed number with the shortest digits that round-trip:
     * integral values without a fraction ("4", "1000000000000000"), others as plain
     * decimals ("2.5"). Magnitudes below 1e-7 or from 1e21 up, and non-finite values,
     * use {@link Double#toString(double)}.
     */
    public static String format(double value) {
        double magnitude = Math.abs(value);
        if (Double.isNaN(value) || Double.isInfinite(value)
                || (magnitude != 0 && (magnitude < PLAIN_LOWER || magnitude >= PLAIN_UPPER))) {
            return Double.toString(value);
        }
        if (magnitude == 0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
