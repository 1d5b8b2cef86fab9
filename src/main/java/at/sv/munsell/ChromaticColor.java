package at.sv.munsell;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A color with a hue. Values of exactly 0 or 10 and a chroma of 0 are never chromatic, see {@link NeutralColor}.
 *
 * @param hueStep position within the hue family (0.0, 10.0]
 * @param value   lightness (0.0, 10.0)
 * @param chroma  saturation &gt; 0.0, unbounded, with scale 1
 */
public record ChromaticColor(HueFamily hueFamily, double hueStep, double value, BigDecimal chroma) implements MunsellColor {

    public static final double MAX_HUE_STEP = 10.0;

    public ChromaticColor {
        Objects.requireNonNull(hueFamily, "hueFamily");
        Objects.requireNonNull(chroma, "chroma");
        hueStep = FormatUtil.roundOneDecimal(hueStep);
        value = FormatUtil.roundOneDecimal(value);
        chroma = FormatUtil.roundOneDecimal(chroma);
        if (hueStep <= 0 || hueStep > MAX_HUE_STEP) {
            throw new IllegalArgumentException("Hue step must be greater than 0 and at most 10. Provided value: " + hueStep);
        }
        if (value <= 0 || value >= MAX_VALUE) {
            throw new IllegalArgumentException("Value of a chromatic color must be between 0 and 10 (exclusive). Provided value: " + value);
        }
        if (chroma.signum() <= 0) {
            throw new IllegalArgumentException("Chroma of a chromatic color must be greater than 0. Provided value: " + chroma);
        }
    }

    public ChromaticColor(HueFamily hueFamily, double hueStep, double value, double chroma) {
        this(hueFamily, hueStep, value, BigDecimal.valueOf(chroma));
    }

    public BigDecimal saturation() {
        return chroma;
    }

    @Override
    public String hue() {
        return FormatUtil.formatMinimal(hueStep) + hueFamily.code();
    }

    @Override
    public boolean isChromatic() {
        return true;
    }

    @Override
    public String code() {
        return hue() + " " + FormatUtil.formatMinimal(value) + "/" + FormatUtil.formatMinimal(chroma);
    }

    /**
     * @see HueDegrees#degree(ChromaticColor)
     */
    public double degree() {
        return HueDegrees.degree(this);
    }

    @Override
    public Optional<HueFamily> hueFamilyIfChromatic() {
        return Optional.of(hueFamily);
    }

    @Override
    public Optional<Double> hueStepIfChromatic() {
        return Optional.of(hueStep);
    }

    @Override
    public Optional<BigDecimal> chromaIfChromatic() {
        return Optional.of(chroma);
    }

    @Override
    public String toString() {
        return code();
    }
}
