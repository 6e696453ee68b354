package com.github.jsonldkit.utils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats doubles the way ECMAScript's Number.prototype.toString does, as
 * required by the JSON Canonicalization Scheme (RFC 8785).
 *
 * The output is the shortest decimal that parses back to the same double;
 * fixed notation is used for magnitudes in [1e-6, 1e21), exponential notation
 * otherwise.
 */
public final class NumberFormatter {

    public static final String INVALID_NUMBER_FORMAT = "invalid number format";

    private static final int MAX_SIGNIFICANT_DIGITS = 17;

    private NumberFormatter() {
    }

    /**
     * @throws IllegalArgumentException
     *             for NaN and the infinities
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(INVALID_NUMBER_FORMAT + ": " + value);
        }
        // also catches -0.0
        if (value == 0.0) {
            return "0";
        }
        final StringBuilder sb = new StringBuilder();
        if (value < 0) {
            sb.append('-');
            value = -value;
        }

        final BigDecimal shortest = shortestRoundTrip(value);
        final String digits = shortest.unscaledValue().toString();
        final int k = digits.length();
        // value == digits * 10^(n - k)
        final int n = k - shortest.scale();

        if (k <= n && n <= 21) {
            sb.append(digits);
            for (int i = 0; i < n - k; i++) {
                sb.append('0');
            }
        } else if (0 < n && n <= 21) {
            sb.append(digits, 0, n).append('.').append(digits, n, k);
        } else if (-6 < n && n <= 0) {
            sb.append("0.");
            for (int i = 0; i < -n; i++) {
                sb.append('0');
            }
            sb.append(digits);
        } else {
            final int exponent = n - 1;
            sb.append(digits.charAt(0));
            if (k > 1) {
                sb.append('.').append(digits, 1, k);
            }
            sb.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent));
        }
        return sb.toString();
    }

    /**
     * Finds the decimal with the fewest significant digits that reads back as
     * {@code value}; among candidates of that length the one closest to
     * {@code value} wins.
     */
    private static BigDecimal shortestRoundTrip(double value) {
        final BigDecimal exact = new BigDecimal(value);
        for (int precision = 1; precision <= MAX_SIGNIFICANT_DIGITS; precision++) {
            final BigDecimal nearest = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (nearest.doubleValue() == value) {
                return nearest.stripTrailingZeros();
            }
            // the rounding interval of a power of two is asymmetric, so the
            // candidate on the far side may read back when the nearest does not
            final BigDecimal down = exact.round(new MathContext(precision, RoundingMode.DOWN));
            final BigDecimal up = exact.round(new MathContext(precision, RoundingMode.UP));
            final boolean downOk = down.doubleValue() == value;
            final boolean upOk = up.doubleValue() == value;
            if (downOk && upOk) {
                final int cmp = exact.subtract(down).compareTo(up.subtract(exact));
                return (cmp <= 0 ? down : up).stripTrailingZeros();
            } else if (downOk) {
                return down.stripTrailingZeros();
            } else if (upOk) {
                return up.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN))
                .stripTrailingZeros();
    }
}
