package jsonwriter;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats numbers as JSON number text.
 *
 * <p> Floating point values use the shortest decimal that parses back to the same value. Values whose decimal
 * point position lies in {@code (-5, 16]} are written in plain notation, others as {@code d.ddde<exp>}. A trailing
 * {@code .0} is dropped, so integral values look like integers. NaN and infinities become {@code null}.
 *
 * @since 0.1.0
 */
final class NumberFormatter {

    static final String NULL = "null";

    private NumberFormatter() {
        throw new UnsupportedOperationException();
    }

    static void writeLong(Appendable out, long value) throws IOException {
        if (out instanceof StringBuilder sb) sb.append(value);
        else out.append(Long.toString(value));
    }

    static String formatDouble(double value) {
        if (!Double.isFinite(value)) return NULL;
        if (value == 0) return zero(Double.doubleToRawLongBits(value) < 0);
        return layout(shortest(value));
    }

    /**
     * Floats are widened to {@code double} first, so {@code 0.1f} prints as {@code 0.10000000149011612}.
     */
    static String formatFloat(float value) {
        return formatDouble(value);
    }

    /**
     * Shortest decimal that parses back to {@code value}.
     *
     * <p> {@link Double#toString(double)} always round-trips and is the starting point. Fewer digits are tried until
     * none round-trips: any {@code p}-digit decimal inside the rounding interval implies a rounding of the exact
     * value towards floor or ceiling at {@code p} digits is inside it too, and a decimal with fewer digits is also a
     * {@code p}-digit decimal. At a power of two the interval is lopsided, so both directions are tried.
     */
    static BigDecimal shortest(double value) {
        var best = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        var exact = new BigDecimal(value);
        for (int p = best.precision() - 1; p >= 1; p--) {
            var floor = exact.round(new MathContext(p, RoundingMode.FLOOR));
            var ceiling = exact.round(new MathContext(p, RoundingMode.CEILING));
            boolean floorFits = floor.doubleValue() == value;
            boolean ceilingFits = ceiling.doubleValue() == value;
            if (floorFits && ceilingFits) {
                int side = exact.subtract(floor).compareTo(ceiling.subtract(exact));
                if (side < 0) best = floor;
                else if (side > 0) best = ceiling;
                else best = exact.round(new MathContext(p, RoundingMode.HALF_EVEN));
            } else if (floorFits) {
                best = floor;
            } else if (ceilingFits) {
                best = ceiling;
            } else {
                break;
            }
        }
        return best.stripTrailingZeros();
    }

    private static String zero(boolean negative) {
        return negative ? "-0" : "0";
    }

    /**
     * Lays out {@code digits * 10^k}, then strips a trailing {@code .0}.
     */
    static String layout(BigDecimal decimal) {
        var digits = decimal.unscaledValue().abs().toString();
        int length = digits.length();
        int k = -decimal.scale();
        int point = length + k;

        var sb = new StringBuilder(length + 8);
        if (decimal.signum() < 0) sb.append('-');
        if (k >= 0 && point <= 16) {
            // 1234e7 -> 12340000000.0
            sb.append(digits);
            for (int i = 0; i < k; i++) sb.append('0');
            sb.append(".0");
        } else if (point > 0 && point <= 16) {
            // 1234e-2 -> 12.34
            sb.append(digits, 0, point).append('.').append(digits, point, length);
        } else if (point > -5 && point <= 0) {
            // 1234e-6 -> 0.001234
            sb.append("0.");
            for (int i = point; i < 0; i++) sb.append('0');
            sb.append(digits);
        } else if (length == 1) {
            // 1e30
            sb.append(digits).append('e').append(point - 1);
        } else {
            // 1234e30 -> 1.234e33
            sb.append(digits.charAt(0)).append('.').append(digits, 1, length);
            sb.append('e').append(point - 1);
        }

        int end = sb.length();
        if (end >= 2 && sb.charAt(end - 2) == '.' && sb.charAt(end - 1) == '0') sb.setLength(end - 2);
        return sb.toString();
    }
}
