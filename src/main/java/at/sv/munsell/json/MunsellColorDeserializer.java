package at.sv.munsell.json;

import at.sv.munsell.MunsellColor;
import at.sv.munsell.ParseResult;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;

/**
 * Reads colors from their Munsell code, e.g. {@code "N 4.5"}. Invalid codes, or codes of the other variant when
 * reading a {@link at.sv.munsell.NeutralColor} or {@link at.sv.munsell.ChromaticColor}, result in an
 * {@link InvalidFormatException}.
 */
public final class MunsellColorDeserializer<T extends MunsellColor> extends JsonDeserializer<T> {

    private final Class<T> type;

    public MunsellColorDeserializer(Class<T> type) {
        this.type = type;
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.hasToken(JsonToken.VALUE_STRING)) {
            return type.cast(ctxt.handleUnexpectedToken(type, p));
        }
        String code = p.getText();
        ParseResult result = MunsellColor.tryParse(code);
        if (!result.isValid()) {
            throw InvalidFormatException.from(p, "Invalid Munsell color: " + result.message(), code, type);
        }
        MunsellColor color = result.color();
        if (!type.isInstance(color)) {
            throw InvalidFormatException.from(p, "Munsell color \"" + color + "\" is not a " + type.getSimpleName(),
                    code, type);
        }
        return type.cast(color);
    }

    @Override
    public Class<T> handledType() {
        return type;
    }
}
