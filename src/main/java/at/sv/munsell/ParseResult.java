package at.sv.munsell;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing a color spec: either a color, or the failure with a human-readable message.
 */
public record ParseResult(@Nullable MunsellColor color, @Nullable ValidationFailure failure, @Nullable String message) {

    public ParseResult {
        if ((color == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of color and failure must be set");
        }
    }

    public static ParseResult success(MunsellColor color) {
        return new ParseResult(Objects.requireNonNull(color, "color"), null, null);
    }

    public static ParseResult failure(InvalidColorSpec e) {
        return new ParseResult(null, e.getFailure(), e.getMessage());
    }

    public boolean isValid() {
        return color != null;
    }

    public Optional<MunsellColor> getColor() {
        return Optional.ofNullable(color);
    }

    public MunsellColor orElseThrow() {
        if (color == null) {
            throw new InvalidColorSpec(failure, message);
        }
        return color;
    }

    @Override
    public String toString() {
        return isValid() ? "{" + color + "}" : "{" + failure + ": " + message + "}";
    }
}
