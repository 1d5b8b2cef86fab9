package at.sv.munsell;

import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates and normalizes Munsell color specs.
 * <ul>
 *     <li>A hue step of 0 becomes 10 of the previous hue family, e.g. {@code 0YR} is {@code 10R}.</li>
 *     <li>A value of 0 or 10 is always black or white, i.e. neutral.</li>
 *     <li>A chroma of 0 is always neutral gray.</li>
 * </ul>
 * All numbers are rounded half-up to one decimal place.
 */
@Slf4j
public final class MunsellColorParser {

    private static final Pattern SEPARATOR = Pattern.compile("[ /]+");
    private static final Pattern DECIMAL = Pattern.compile("\\d+|\\d+\\.\\d+");
    private static final Pattern HUE = Pattern.compile("(\\d+|\\d+\\.\\d+)(" + familyAlternatives() + ")");
    private static final BigDecimal MAX_HUE_STEP = BigDecimal.TEN;
    private static final BigDecimal MAX_VALUE = BigDecimal.TEN;

    private MunsellColorParser() {
    }

    /**
     * @param spec hue, value and chroma separated by spaces and/or a slash
     * @throws InvalidColorSpec if the spec is invalid
     */
    public static MunsellColor parse(@Nullable String spec) {
        String[] parts = split(spec);
        return parse(part(parts, 0), part(parts, 1), part(parts, 2));
    }

    public static MunsellColor parse(@Nullable String hue, @Nullable String value, @Nullable String chroma) {
        try {
            return create(hue, value, chroma);
        } catch (InvalidColorSpec e) {
            log.debug("Rejected color spec [{}, {}, {}]: {}", hue, value, chroma, e.getMessage());
            throw e;
        }
    }

    public static MunsellColor parse(@Nullable String hue, double value, @Nullable Double chroma) {
        return parse(hue, toDecimalString(value), chroma == null ? null : toDecimalString(chroma));
    }

    public static ParseResult tryParse(@Nullable String spec) {
        try {
            return ParseResult.success(parse(spec));
        } catch (InvalidColorSpec e) {
            return ParseResult.failure(e);
        }
    }

    public static ParseResult tryParse(@Nullable String hue, @Nullable String value, @Nullable String chroma) {
        try {
            return ParseResult.success(parse(hue, value, chroma));
        } catch (InvalidColorSpec e) {
            return ParseResult.failure(e);
        }
    }

    /**
     * @return true for non-negative decimals like {@code 5} or {@code 5.25}
     */
    static boolean isDecimal(@Nullable String input) {
        return input != null && DECIMAL.matcher(input).matches();
    }

    private static String[] split(@Nullable String spec) {
        if (spec == null || spec.isEmpty()) {
            return new String[0];
        }
        return SEPARATOR.split(spec);
    }

    private static String part(String[] parts, int index) {
        return index < parts.length ? parts[index] : null;
    }

    private static MunsellColor create(@Nullable String hue, @Nullable String value, @Nullable String chroma) {
        if (hue == null) {
            throw new InvalidColorSpec(ValidationFailure.HUE_UNDEFINED, "Hue is undefined.");
        }
        String upperCaseHue = hue.toUpperCase(Locale.ROOT);
        boolean chromatic = !MunsellColor.NEUTRAL_HUE.equals(upperCaseHue);
        HueFamily hueFamily = null;
        BigDecimal hueStep = null;
        if (chromatic) {
            Matcher matcher = HUE.matcher(upperCaseHue);
            if (!matcher.matches()) {
                throw new InvalidColorSpec(ValidationFailure.HUE_FORMAT, "Hue, \"" + hue + "\" is not valid format.");
            }
            hueStep = FormatUtil.roundOneDecimal(new BigDecimal(matcher.group(1)));
            hueFamily = HueFamily.valueOf(matcher.group(2));
            if (hueStep.compareTo(MAX_HUE_STEP) > 0) {
                throw new InvalidColorSpec(ValidationFailure.HUE_OUT_OF_RANGE,
                        "Number of hue, \"" + hue + "\", is greater than 10.0.");
            }
            if (hueStep.signum() == 0) {
                log.debug("Hue step 0 of {}: Use 10 of {}", hueFamily, hueFamily.previous());
                hueStep = MAX_HUE_STEP;
                hueFamily = hueFamily.previous();
            }
        }

        BigDecimal lightness = assertValidValue(value);
        if (lightness.signum() == 0 || lightness.compareTo(MAX_VALUE) == 0) {
            if (chromatic) {
                log.debug("Value {} of {}: Use neutral", lightness, hue);
            }
            return new NeutralColor(lightness.doubleValue());
        }
        if (!chromatic) {
            return new NeutralColor(lightness.doubleValue());
        }

        BigDecimal saturation = assertValidChroma(chroma);
        if (saturation.signum() == 0) {
            log.debug("Chroma 0 of {}: Use neutral", hue);
            return new NeutralColor(lightness.doubleValue());
        }
        return new ChromaticColor(hueFamily, hueStep.doubleValue(), lightness.doubleValue(), saturation);
    }

    private static BigDecimal assertValidValue(@Nullable String value) {
        if (value == null) {
            throw new InvalidColorSpec(ValidationFailure.VALUE_UNDEFINED, "Value is undefined.");
        }
        if (!isDecimal(value)) {
            throw new InvalidColorSpec(ValidationFailure.VALUE_FORMAT, "Value, \"" + value + "\" is not a valid number.");
        }
        BigDecimal rounded = FormatUtil.roundOneDecimal(new BigDecimal(value));
        if (rounded.compareTo(MAX_VALUE) > 0) {
            throw new InvalidColorSpec(ValidationFailure.VALUE_OUT_OF_RANGE, "Value (" + rounded + ") is out of range.");
        }
        return rounded;
    }

    private static BigDecimal assertValidChroma(@Nullable String chroma) {
        if (chroma == null) {
            throw new InvalidColorSpec(ValidationFailure.CHROMA_UNDEFINED, "Chroma is undefined.");
        }
        if (!isDecimal(chroma)) {
            throw new InvalidColorSpec(ValidationFailure.CHROMA_FORMAT, "Chroma, \"" + chroma + "\" is not a valid number.");
        }
        return FormatUtil.roundOneDecimal(new BigDecimal(chroma));
    }

    /**
     * Non-finite and negative numbers yield strings that fail {@link #isDecimal(String)}.
     */
    static String toDecimalString(double number) {
        if (!Double.isFinite(number)) {
            return String.valueOf(number);
        }
        return BigDecimal.valueOf(number).toPlainString();
    }

    private static String familyAlternatives() {
        return Arrays.stream(HueFamily.values())
                     .map(HueFamily::code)
                     .sorted(Comparator.comparingInt(String::length).reversed())
                     .collect(Collectors.joining("|"));
    }
}
