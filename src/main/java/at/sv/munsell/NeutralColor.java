package at.sv.munsell;

import java.math.BigDecimal;
import java.util.Optional;

public record NeutralColor(double value) implements MunsellColor {

    public NeutralColor {
        value = FormatUtil.roundOneDecimal(value);
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("Value must be between 0 and 10. Provided value: " + value);
        }
    }

    @Override
    public String hue() {
        return NEUTRAL_HUE;
    }

    @Override
    public boolean isChromatic() {
        return false;
    }

    @Override
    public String code() {
        return NEUTRAL_HUE + " " + FormatUtil.formatOneDecimal(value);
    }

    @Override
    public Optional<HueFamily> hueFamilyIfChromatic() {
        return Optional.empty();
    }

    @Override
    public Optional<Double> hueStepIfChromatic() {
        return Optional.empty();
    }

    @Override
    public Optional<BigDecimal> chromaIfChromatic() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code();
    }
}
