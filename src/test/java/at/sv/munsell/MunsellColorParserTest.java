package at.sv.munsell;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MunsellColorParserTest {

    private static void assertCode(String spec, String expectedCode) {
        assertThat(MunsellColorParser.parse(spec).code()).as("code of '%s'", spec).isEqualTo(expectedCode);
    }

    private static void assertFailure(String spec, ValidationFailure expectedFailure) {
        assertThatThrownBy(() -> MunsellColorParser.parse(spec))
                .as("failure of '%s'", spec)
                .isInstanceOf(InvalidColorSpec.class)
                .extracting(e -> ((InvalidColorSpec) e).getFailure())
                .isEqualTo(expectedFailure);
    }

    @Test
    void parse_chromatic_combinedSpec() {
        MunsellColor color = MunsellColorParser.parse("9R 5.5/14");

        assertThat(color).isInstanceOf(ChromaticColor.class);
        ChromaticColor chromatic = (ChromaticColor) color;
        assertThat(chromatic.hueFamily()).isEqualTo(HueFamily.R);
        assertThat(chromatic.hueStep()).isEqualTo(9.0);
        assertThat(chromatic.value()).isEqualTo(5.5);
        assertThat(chromatic.chroma()).isEqualByComparingTo("14");
        assertThat(chromatic.code()).isEqualTo("9R 5.5/14");
    }

    @Test
    void parse_neutral_combinedSpec() {
        MunsellColor color = MunsellColorParser.parse("N 4.5");

        assertThat(color).isEqualTo(new NeutralColor(4.5));
        assertThat(color.code()).isEqualTo("N 4.5");
    }

    @Test
    void parse_separators_spacesAndSlashesInAnyCombination() {
        assertCode("7PB 4 10", "7PB 4/10");
        assertCode("7PB 4/10", "7PB 4/10");
        assertCode("7PB/4/10", "7PB 4/10");
        assertCode("7PB  4 / 10", "7PB 4/10");
        assertCode("N 9", "N 9.0");
        assertCode("N/9", "N 9.0");
    }

    @Test
    void parse_caseInsensitiveHue() {
        assertCode("5yr 5/5", "5YR 5/5");
        assertCode("2.5bg 3/2", "2.5BG 3/2");
        assertCode("n 3", "N 3.0");
    }

    @Test
    void parse_discreteParts() {
        assertThat(MunsellColorParser.parse("7PB", "4", "10").code()).isEqualTo("7PB 4/10");
        assertThat(MunsellColorParser.parse("7PB", 4, 10.0).code()).isEqualTo("7PB 4/10");
        assertThat(MunsellColorParser.parse("N", "9", null).code()).isEqualTo("N 9.0");
        assertThat(MunsellColorParser.parse("N", 9, null).code()).isEqualTo("N 9.0");
    }

    @Test
    void parse_neutral_ignoresChroma() {
        assertCode("N 5/abc", "N 5.0");
        assertThat(MunsellColorParser.parse("N", "5", "7")).isEqualTo(new NeutralColor(5.0));
    }

    @Test
    void parse_hueStepZero_rollsBackToPreviousFamily() {
        assertCode("0YR 5/5", "10R 5/5");
        assertCode("0R 5/5", "10RP 5/5");
        assertCode("0.0PB 5/5", "10B 5/5");
        assertCode("0.04G 5/5", "10GY 5/5");
    }

    @Test
    void parse_hueStep_roundedToOneDecimal() {
        assertCode("2.54R 5/5", "2.5R 5/5");
        assertCode("2.55R 5/5", "2.6R 5/5");
        assertCode("10.04R 5/5", "10R 5/5");
        assertCode("10.0R 5/5", "10R 5/5");
    }

    @Test
    void parse_blackOrWhiteValue_alwaysNeutral() {
        assertCode("5R 0/4", "N 0.0");
        assertCode("5R 10/4", "N 10.0");
        assertCode("5R 9.96/4", "N 10.0");
        assertCode("5R 0.04/4", "N 0.0");
        assertThat(MunsellColorParser.parse("5R 10/4").isNeutral()).isTrue();
    }

    @Test
    void parse_blackOrWhiteValue_chromaNotValidated() {
        assertCode("5R 10/abc", "N 10.0");
        assertCode("5R 0", "N 0.0");
    }

    @Test
    void parse_zeroChroma_neutral() {
        assertCode("5R 5/0", "N 5.0");
        assertCode("5R 5/0.04", "N 5.0");
        assertThat(MunsellColorParser.parse("5R 5/0")).isEqualTo(new NeutralColor(5.0));
    }

    @Test
    void parse_numbers_roundedHalfUp() {
        assertThat(MunsellColorParser.parse("5R", "4.46", "3").value()).isEqualTo(4.5);
        assertThat(MunsellColorParser.parse("5R", "4.45", "3").value()).isEqualTo(4.5);
        assertThat(MunsellColorParser.parse("5R", "4.44", "3").value()).isEqualTo(4.4);
        assertThat(MunsellColorParser.parse("5R", 4.45, 3.0).value()).isEqualTo(4.5);
        assertThat(((ChromaticColor) MunsellColorParser.parse("5R 5/12.25")).chroma()).isEqualByComparingTo("12.3");
    }

    @Test
    void parse_chroma_hasNoUpperBound() {
        assertCode("5R 5/30", "5R 5/30");
    }

    @Test
    void parse_largeChroma_keepsOneDecimal() {
        assertCode("5R 5/12345678901234567.8", "5R 5/12345678901234567.8");
        assertCode("5R 5/12345678901234567.85", "5R 5/12345678901234567.9");
        assertThat(((ChromaticColor) MunsellColorParser.parse("5R 5/12345678901234567.8")).chroma())
                .isEqualTo(new BigDecimal("12345678901234567.8"));
    }

    @Test
    void tryParse_chromaBeyondDoubleRange_valid() {
        String hugeChroma = "1" + "0".repeat(400);

        ParseResult result = MunsellColorParser.tryParse("5R 5/" + hugeChroma);

        assertThat(result.isValid()).isTrue();
        assertThat(result.orElseThrow().code()).isEqualTo("5R 5/" + hugeChroma);
    }

    @Test
    void parse_invalidHue() {
        assertFailure("BooR 1/1", ValidationFailure.HUE_FORMAT);
        assertFailure("5Z 1/1", ValidationFailure.HUE_FORMAT);
        assertFailure("R 1/1", ValidationFailure.HUE_FORMAT);
        assertFailure("-5R 1/1", ValidationFailure.HUE_FORMAT);
        assertFailure("5.R 1/1", ValidationFailure.HUE_FORMAT);
        assertFailure("5RX 1/1", ValidationFailure.HUE_FORMAT);
        assertFailure(" 5R 1/1", ValidationFailure.HUE_FORMAT);
    }

    @Test
    void parse_hueStepGreaterThanTen() {
        assertFailure("11.0R 1/1", ValidationFailure.HUE_OUT_OF_RANGE);
        assertFailure("10.05R 1/1", ValidationFailure.HUE_OUT_OF_RANGE);
    }

    @Test
    void parse_missingParts() {
        assertFailure(null, ValidationFailure.HUE_UNDEFINED);
        assertFailure("", ValidationFailure.HUE_UNDEFINED);
        assertFailure(" / ", ValidationFailure.HUE_UNDEFINED);
        assertFailure("5R", ValidationFailure.VALUE_UNDEFINED);
        assertFailure("N", ValidationFailure.VALUE_UNDEFINED);
        assertFailure("5R 5", ValidationFailure.CHROMA_UNDEFINED);
    }

    @Test
    void parse_invalidValue() {
        assertFailure("5R a/1", ValidationFailure.VALUE_FORMAT);
        assertFailure("5R -1/1", ValidationFailure.VALUE_FORMAT);
        assertFailure("5R 12/1", ValidationFailure.VALUE_OUT_OF_RANGE);
        assertFailure("5R 10.05/1", ValidationFailure.VALUE_OUT_OF_RANGE);
        assertFailure("N 11", ValidationFailure.VALUE_OUT_OF_RANGE);
    }

    @Test
    void parse_invalidChroma() {
        assertFailure("5R 1/a", ValidationFailure.CHROMA_FORMAT);
        assertFailure("5R 1/-2", ValidationFailure.CHROMA_FORMAT);
    }

    @Test
    void parse_nonFiniteOrNegativeNumbers_formatFailure() {
        assertThatThrownBy(() -> MunsellColorParser.parse("5R", Double.NaN, 2.0))
                .isInstanceOf(InvalidColorSpec.class)
                .hasMessageContaining("Value");
        assertThatThrownBy(() -> MunsellColorParser.parse("5R", -1.0, 2.0))
                .isInstanceOf(InvalidColorSpec.class)
                .extracting(e -> ((InvalidColorSpec) e).getFailure())
                .isEqualTo(ValidationFailure.VALUE_FORMAT);
        assertThatThrownBy(() -> MunsellColorParser.parse("5R", 5.0, Double.POSITIVE_INFINITY))
                .isInstanceOf(InvalidColorSpec.class)
                .extracting(e -> ((InvalidColorSpec) e).getFailure())
                .isEqualTo(ValidationFailure.CHROMA_FORMAT);
    }

    @Test
    void parse_failureMessages_nameOffendingPart() {
        assertThatThrownBy(() -> MunsellColorParser.parse("BooR 1/1")).hasMessage("Hue, \"BooR\" is not valid format.");
        assertThatThrownBy(() -> MunsellColorParser.parse("11R 1/1")).hasMessageContaining("11R");
        assertThatThrownBy(() -> MunsellColorParser.parse("5R 12/1")).hasMessage("Value (12.0) is out of range.");
        assertThatThrownBy(() -> MunsellColorParser.parse("5R a/1")).hasMessageContaining("\"a\"");
        assertThatThrownBy(() -> MunsellColorParser.parse("5R 5")).hasMessage("Chroma is undefined.");
        assertThatThrownBy(() -> MunsellColorParser.parse((String) null)).hasMessage("Hue is undefined.");
    }

    @Test
    void tryParse_valid_returnsColor() {
        ParseResult result = MunsellColorParser.tryParse("9R 5.5/14");

        assertThat(result.isValid()).isTrue();
        assertThat(result.getColor()).contains(MunsellColorParser.parse("9R 5.5/14"));
        assertThat(result.failure()).isNull();
        assertThat(result.message()).isNull();
    }

    @Test
    void tryParse_invalid_returnsFailureAndMessage() {
        ParseResult result = MunsellColorParser.tryParse("5R 12/1");

        assertThat(result.isValid()).isFalse();
        assertThat(result.getColor()).isEmpty();
        assertThat(result.failure()).isEqualTo(ValidationFailure.VALUE_OUT_OF_RANGE);
        assertThat(result.message()).isEqualTo("Value (12.0) is out of range.");
        assertThatThrownBy(result::orElseThrow).isInstanceOf(InvalidColorSpec.class)
                                               .hasMessage("Value (12.0) is out of range.");
    }

    @Test
    void tryParse_discreteParts() {
        assertThat(MunsellColorParser.tryParse("5R", "5", null).failure()).isEqualTo(ValidationFailure.CHROMA_UNDEFINED);
        assertThat(MunsellColorParser.tryParse("5R", "5", "2").orElseThrow().code()).isEqualTo("5R 5/2");
    }
}
