package io.stagecraft.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stagecraft.core.util.WireEnum;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link WireEnum} constant as its wire spelling.
///
/// @param <E> enum type
/// @implNote Package-private. Registered by {@link StagecraftJacksonModule}.
class WireEnumSerializer<E extends Enum<E> & WireEnum> extends StdSerializer<E> {

    @Serial private static final long serialVersionUID = 6630741207753194120L;

    WireEnumSerializer(Class<E> type) {
        super(type);
    }

    @Override
    public void serialize(E value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(value.wireValue());
    }
}
