package at.sv.munsell.json;

import at.sv.munsell.ChromaticColor;
import at.sv.munsell.MunsellColor;
import at.sv.munsell.NeutralColor;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Binds {@link MunsellColor} properties to their code strings:
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new MunsellJacksonModule());
 * }</pre>
 */
public final class MunsellJacksonModule extends SimpleModule {

    public MunsellJacksonModule() {
        super("MunsellJacksonModule");
        addSerializer(MunsellColor.class, new MunsellColorSerializer());
        addDeserializer(MunsellColor.class, new MunsellColorDeserializer<>(MunsellColor.class));
        addDeserializer(NeutralColor.class, new MunsellColorDeserializer<>(NeutralColor.class));
        addDeserializer(ChromaticColor.class, new MunsellColorDeserializer<>(ChromaticColor.class));
    }
}
