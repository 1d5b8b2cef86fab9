package at.sv.munsell;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

public final class FormatUtil {
    private FormatUtil() {
    }

    /**
     * Rounds half-up (ties away from zero) to the tenths place.
     */
    public static BigDecimal roundOneDecimal(BigDecimal number) {
        return number.setScale(1, RoundingMode.HALF_UP);
    }

    public static double roundOneDecimal(double number) {
        return roundOneDecimal(BigDecimal.valueOf(number)).doubleValue();
    }

    /**
     * Formats with exactly one decimal, e.g. {@code 10.0}, {@code 4.5}.
     */
    public static String formatOneDecimal(double number) {
        return String.format(Locale.ROOT, "%.1f", roundOneDecimal(BigDecimal.valueOf(number)));
    }

    /**
     * Formats without superfluous trailing zeros, e.g. {@code 9} instead of {@code 9.0}, but {@code 5.5}.
     */
    public static String formatMinimal(double number) {
        return formatMinimal(BigDecimal.valueOf(number));
    }

    public static String formatMinimal(BigDecimal number) {
        BigDecimal rounded = roundOneDecimal(number);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }
}
