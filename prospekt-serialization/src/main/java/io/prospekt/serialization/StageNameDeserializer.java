package io.prospekt.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.prospekt.core.stage.StageName;
import java.io.IOException;
import java.io.Serial;

/// Reads a {@link StageName} from its id or enum constant name.
///
/// @implNote Package-private. Registered by {@link ProspektJacksonModule}.
/// @see StageNameSerializer for the inverse operation
class StageNameDeserializer extends StdDeserializer<StageName> {

    @Serial private static final long serialVersionUID = 2961547040858217823L;

    StageNameDeserializer() {
        super(StageName.class);
    }

    /// @throws IOException if the value names no stage
    @Override
    public StageName deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        return resolve(p.getValueAsString(), ctx);
    }

    private static StageName resolve(String value, DeserializationContext ctx)
            throws IOException {
        if (value == null) {
            throw ctx.weirdStringException("null", StageName.class, "stage name expected");
        }
        try {
            return StageName.fromId(value);
        } catch (IllegalArgumentException e) {
            throw ctx.weirdStringException(value, StageName.class, e.getMessage());
        }
    }

    /// Map key variant.
    static final class Key extends KeyDeserializer {

        @Override
        public Object deserializeKey(String key, DeserializationContext ctx) throws IOException {
            return resolve(key, ctx);
        }
    }
}
