package io.prospekt.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.prospekt.core.stage.StageName;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link StageName} as its lowercase id.
///
/// @implNote Package-private. Registered by {@link ProspektJacksonModule}.
/// @see StageNameDeserializer for the inverse operation
class StageNameSerializer extends StdSerializer<StageName> {

    @Serial private static final long serialVersionUID = 6049114957276381550L;

    StageNameSerializer() {
        super(StageName.class);
    }

    @Override
    public void serialize(StageName stage, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(stage.id());
    }

    /// Map key variant, used for `Report.outputs` and `Report.stageDurations`.
    static final class Key extends StdSerializer<StageName> {

        @Serial private static final long serialVersionUID = -1384771125467090245L;

        Key() {
            super(StageName.class);
        }

        @Override
        public void serialize(StageName stage, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            gen.writeFieldName(stage.id());
        }
    }
}
