package at.sv.munsell;

import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * A color in the Munsell notation. Either a {@link NeutralColor} (gray, only a value) or a {@link ChromaticColor}
 * (hue, value and chroma).
 * <p>
 * Examples: {@code MunsellColor.parse("9R 5.5/14")}, {@code MunsellColor.of("7PB", 4, 10.0)},
 * {@code MunsellColor.parse("N 4.5")}.
 */
public sealed interface MunsellColor permits NeutralColor, ChromaticColor {

    String NEUTRAL_HUE = "N";
    double MAX_VALUE = 10.0;
    double NEAR_BLACK_VALUE = 1.0;
    double NEAR_WHITE_VALUE = 9.5;

    /**
     * @return lightness [0.0, 10.0], rounded to one decimal
     */
    double value();

    default double lightness() {
        return value();
    }

    /**
     * @return the hue part of the code, e.g. {@code 5.5R}, or {@code N} for neutral colors
     */
    String hue();

    boolean isChromatic();

    default boolean isNeutral() {
        return !isChromatic();
    }

    /**
     * Regardless of chroma.
     */
    default boolean isNearBlack() {
        return value() <= NEAR_BLACK_VALUE;
    }

    /**
     * Regardless of chroma.
     */
    default boolean isNearWhite() {
        return value() >= NEAR_WHITE_VALUE;
    }

    /**
     * @return the canonical Munsell code, e.g. {@code 9R 5.5/14} or {@code N 4.5}
     */
    String code();

    Optional<HueFamily> hueFamilyIfChromatic();

    Optional<Double> hueStepIfChromatic();

    Optional<BigDecimal> chromaIfChromatic();

    /**
     * Parses a combined spec like {@code 9R 5.5/14}, {@code 7PB 4 10} or {@code N 4.5}.
     *
     * @throws InvalidColorSpec if the spec is invalid
     */
    static MunsellColor parse(String spec) {
        return MunsellColorParser.parse(spec);
    }

    static ParseResult tryParse(String spec) {
        return MunsellColorParser.tryParse(spec);
    }

    /**
     * @param chroma ignored for neutral colors
     * @throws InvalidColorSpec if one of the parts is invalid
     */
    static MunsellColor of(String hue, String value, @Nullable String chroma) {
        return MunsellColorParser.parse(hue, value, chroma);
    }

    static MunsellColor of(String hue, double value, @Nullable Double chroma) {
        return MunsellColorParser.parse(hue, value, chroma);
    }

    static MunsellColor of(String hue, double value) {
        return MunsellColorParser.parse(hue, value, null);
    }

    static ParseResult tryParse(String hue, String value, @Nullable String chroma) {
        return MunsellColorParser.tryParse(hue, value, chroma);
    }

    static MunsellColor pureWhite() {
        return parse("N 10.0");
    }

    static MunsellColor pureBlack() {
        return parse("N 0.0");
    }

    /**
     * @return the lightest gray still considered near-white, {@code N 9.5}
     */
    static MunsellColor realWhite() {
        return parse("N 9.5");
    }

    /**
     * @return the darkest gray still considered near-black, {@code N 1.0}
     */
    static MunsellColor realBlack() {
        return parse("N 1.0");
    }
}
