package at.sv.munsell;

/**
 * Reasons why a color spec was rejected.
 */
public enum ValidationFailure {
    HUE_UNDEFINED,
    HUE_FORMAT,
    HUE_OUT_OF_RANGE,
    VALUE_UNDEFINED,
    VALUE_FORMAT,
    VALUE_OUT_OF_RANGE,
    CHROMA_UNDEFINED,
    CHROMA_FORMAT
}
