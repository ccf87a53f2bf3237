package io.stagecraft.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stagecraft.core.resource.OpaquePayload;
import java.io.IOException;
import java.io.Serial;

/// Writes an {@link OpaquePayload} verbatim as a raw JSON value.
///
/// @implNote Package-private. Registered by {@link StagecraftJacksonModule}.
/// @see OpaquePayloadDeserializer for the inverse operation
class OpaquePayloadSerializer extends StdSerializer<OpaquePayload> {

    @Serial private static final long serialVersionUID = 3016597542178807163L;

    OpaquePayloadSerializer() {
        super(OpaquePayload.class);
    }

    @Override
    public void serialize(OpaquePayload payload, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeRawValue(payload.json());
    }
}
