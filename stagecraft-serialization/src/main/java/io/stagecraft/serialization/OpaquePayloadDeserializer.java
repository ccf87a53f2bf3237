package io.stagecraft.serialization;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stagecraft.core.resource.OpaquePayload;
import java.io.IOException;
import java.io.Serial;
import java.io.StringWriter;

/// Captures any JSON value as an {@link OpaquePayload} without interpreting it.
///
/// The value is streamed token by token into compact JSON text. Numbers are copied
/// using their source text, so precision and magnitude survive a decode/encode cycle.
/// Field names inside the payload are not checked against any schema; the payload
/// belongs to its provider. A JSON `null` or a missing field yields
/// {@link OpaquePayload#NULL}.
///
/// @implNote Package-private. Registered by {@link StagecraftJacksonModule}.
class OpaquePayloadDeserializer extends StdDeserializer<OpaquePayload> {

    @Serial private static final long serialVersionUID = -4475327906125546390L;

    private static final JsonFactory FACTORY = new JsonFactory();

    OpaquePayloadDeserializer() {
        super(OpaquePayload.class);
    }

    @Override
    public OpaquePayload deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_NULL) {
            return OpaquePayload.NULL;
        }
        StringWriter out = new StringWriter();
        try (JsonGenerator gen = FACTORY.createGenerator(out)) {
            copyValue(p, gen);
        }
        return new OpaquePayload(out.toString());
    }

    @Override
    public OpaquePayload getNullValue(DeserializationContext ctx) {
        return OpaquePayload.NULL;
    }

    /// Copies the value starting at the current token, leaving the parser on its last token.
    private static void copyValue(JsonParser p, JsonGenerator gen) throws IOException {
        int depth = 0;
        do {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
                gen.writeNumber(p.getText());
            } else {
                gen.copyCurrentEvent(p);
            }
            if (token.isStructStart()) {
                depth++;
            } else if (token.isStructEnd()) {
                depth--;
            }
        } while (depth > 0 && p.nextToken() != null);
    }
}
