package at.sv.munsell;

import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;

/**
 * Maps hue codes onto a continuous scale [0, 100) around the hue circle and back: {@code 10R} is 10,
 * {@code 10YR} is 20, ..., {@code 9.9RP} is 99.9, and {@code 10RP} closes the circle at 0.
 * <p>
 * Unlike {@link MunsellColorParser}, invalid input here is a usage error and results in an
 * {@link IllegalArgumentException}.
 */
public final class HueDegrees {

    private static final BigDecimal FAMILY_WIDTH = BigDecimal.TEN;
    private static final BigDecimal FULL_CIRCLE = BigDecimal.valueOf(100);
    private static final String CIRCLE_ORIGIN = "10" + HueFamily.RP.code();

    private HueDegrees() {
    }

    /**
     * @param hueCode chromatic hue like {@code 5YR}
     * @return degree [0, 100)
     * @throws IllegalArgumentException if the hue code is invalid or neutral
     */
    public static double degree(@Nullable String hueCode) {
        MunsellColor color;
        try {
            color = MunsellColorParser.parse(hueCode, "1", "1");
        } catch (InvalidColorSpec e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        if (!color.isChromatic()) {
            throw new IllegalArgumentException("Hue \"" + hueCode + "\" has no degree, as it is neutral.");
        }
        return degree((ChromaticColor) color);
    }

    public static double degree(ChromaticColor color) {
        if (color.hueFamily() == HueFamily.RP && color.hueStep() == ChromaticColor.MAX_HUE_STEP) {
            return 0;
        }
        return FAMILY_WIDTH.multiply(BigDecimal.valueOf(color.hueFamily().index()))
                           .add(BigDecimal.valueOf(color.hueStep()))
                           .doubleValue();
    }

    /**
     * @param degree [0, 100]
     * @return hue code like {@code 5YR}; both 0 and 100 are {@code 10RP}, other family boundaries are step 10
     * of the previous family, e.g. 10 is {@code 10R}
     * @throws IllegalArgumentException if the degree is negative, not a number, or greater than 100
     */
    public static String undegree(double degree) {
        if (!Double.isFinite(degree) || degree < 0) {
            throw new IllegalArgumentException("Argument is not a valid number: " + degree);
        }
        return undegree(BigDecimal.valueOf(degree));
    }

    public static String undegree(@Nullable String degree) {
        if (!MunsellColorParser.isDecimal(degree)) {
            throw new IllegalArgumentException("Argument is not a valid number: " + degree);
        }
        return undegree(new BigDecimal(degree));
    }

    private static String undegree(BigDecimal degree) {
        BigDecimal rounded = FormatUtil.roundOneDecimal(degree);
        if (rounded.compareTo(FULL_CIRCLE) > 0) {
            throw new IllegalArgumentException("Given number is out of range (<=100): " + rounded);
        }
        if (rounded.signum() == 0 || rounded.compareTo(FULL_CIRCLE) == 0) {
            return CIRCLE_ORIGIN;
        }
        int index = rounded.divideToIntegralValue(FAMILY_WIDTH).intValue();
        BigDecimal step = rounded.subtract(FAMILY_WIDTH.multiply(BigDecimal.valueOf(index)));
        HueFamily family = HueFamily.ofIndex(index);
        if (step.signum() == 0) {
            step = FAMILY_WIDTH;
            family = family.previous();
        }
        return FormatUtil.formatMinimal(step) + family.code();
    }
}
