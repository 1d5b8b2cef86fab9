package at.sv.munsell.json;

import at.sv.munsell.MunsellColor;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes colors as their Munsell code, e.g. {@code "9R 5.5/14"}.
 */
public final class MunsellColorSerializer extends JsonSerializer<MunsellColor> {

    @Override
    public void serialize(MunsellColor color, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeString(color.code());
    }

    @Override
    public Class<MunsellColor> handledType() {
        return MunsellColor.class;
    }
}
