package io.stagecraft.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stagecraft.core.util.WireEnum;
import java.io.IOException;
import java.io.Serial;
import java.util.Arrays;

/// Resolves a wire spelling to its {@link WireEnum} constant.
///
/// Only JSON strings are accepted, and only exact wire spellings: constant names and
/// ordinals are rejected.
///
/// @param <E> enum type
/// @implNote Package-private. Registered by {@link StagecraftJacksonModule}.
class WireEnumDeserializer<E extends Enum<E> & WireEnum> extends StdDeserializer<E> {

    @Serial private static final long serialVersionUID = -1964383071209913417L;

    private final Class<E> type;

    WireEnumDeserializer(Class<E> type) {
        super(type);
        this.type = type;
    }

    @Override
    public E deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return type.cast(ctx.handleUnexpectedToken(type, p));
        }
        String text = p.getText();
        return WireEnum.fromWire(type, text)
                .orElseThrow(
                        () ->
                                ctx.weirdStringException(
                                        text,
                                        type,
                                        "expected one of "
                                                + Arrays.stream(type.getEnumConstants())
                                                        .map(WireEnum::wireValue)
                                                        .toList()));
    }
}
