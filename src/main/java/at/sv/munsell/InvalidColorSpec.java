package at.sv.munsell;

import lombok.Getter;

/**
 * Exception to signal that a Munsell color spec could not be parsed. The {@link #getFailure() failure} tells which
 * part of the spec was rejected.
 */
@Getter
public final class InvalidColorSpec extends RuntimeException {

    private final ValidationFailure failure;

    public InvalidColorSpec(ValidationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }
}
