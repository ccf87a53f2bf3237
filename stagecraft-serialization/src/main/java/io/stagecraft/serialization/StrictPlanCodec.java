package io.stagecraft.serialization;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.type.LogicalType;
import io.stagecraft.core.plan.HostPlan;
import io.stagecraft.core.plan.Plan;
import io.stagecraft.core.report.ExecutionReport;
import io.stagecraft.serialization.PlanDecodeException.Reason;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/// Strict JSON codec for plans, host plans, execution reports and typed step inputs.
///
/// ### Decoding rules
/// - Any field name unknown to the target type is rejected, at any depth
///   (opaque `inputs`/`data` payloads and string maps excepted)
/// - Exactly one JSON value is accepted; anything but whitespace after it is rejected
/// - Type mismatches, scalar coercions (`"1"` for a number, `1` for a string),
///   fractional numbers for integers, unknown enum spellings and duplicate keys are
///   rejected
/// - Plans and host plans must carry `"version": "v1"`
///
/// ### Encoding rules
/// Fields are written in wire order, map entries sorted by key and optional fields
/// omitted when empty, so equal values always encode to identical bytes.
///
/// ### Usage
/// {@snippet :
/// StrictPlanCodec codec = new StrictPlanCodec();
/// Plan plan = codec.decodePlan(Files.readAllBytes(path));
/// byte[] json = codec.encodePretty(new PlanSlicer().slice(plan));
/// }
///
/// @implNote Thread-safe. The mapper is configured once and never mutated afterwards.
/// @see StagecraftJacksonModule for the registered wire format
public final class StrictPlanCodec {

    private static final String TRAILING = "trailing tokens after JSON object";
    private static final ObjectMapper LENIENT = new ObjectMapper();

    private final ObjectMapper mapper;
    private final ObjectWriter prettyWriter;

    public StrictPlanCodec() {
        this(createMapper());
    }

    /// Creates a codec over a caller-configured mapper.
    ///
    /// @param mapper mapper with {@link StagecraftJacksonModule} registered, not null
    public StrictPlanCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.prettyWriter = mapper.writerWithDefaultPrettyPrinter();
    }

    /// Creates an ObjectMapper configured for the strict Stagecraft wire format.
    ///
    /// @return configured mapper, never null
    public static ObjectMapper createMapper() {
        JsonFactory factory =
                JsonFactory.builder().enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION).build();
        ObjectMapper mapper =
                new ObjectMapper(factory)
                        .registerModule(new StagecraftJacksonModule())
                        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                        .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY)
                        .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
        return mapper;
    }

    /// Returns the underlying mapper; callers must not reconfigure it.
    ///
    /// @return the mapper, never null
    public ObjectMapper mapper() {
        return mapper;
    }

    /// Strictly decodes a plan.
    ///
    /// @param data UTF-8 JSON, not null
    /// @return the plan, never null
    /// @throws PlanDecodeException if the document is not a strict, current-version plan
    public Plan decodePlan(byte[] data) throws PlanDecodeException {
        String label = "strict decode plan";
        Plan plan = read(data, Plan.class, label);
        requireVersion(label, plan.version(), Plan.SCHEMA_VERSION);
        return plan;
    }

    /// Strictly decodes a host plan.
    ///
    /// @param data          UTF-8 JSON, not null
    /// @param planIdContext plan id used only to enrich error messages, may be null or empty
    /// @return the host plan, never null
    /// @throws PlanDecodeException if the document is not a strict, current-version host plan
    public HostPlan decodeHostPlan(byte[] data, String planIdContext) throws PlanDecodeException {
        String label = "strict decode host plan";
        if (planIdContext != null && !planIdContext.isEmpty()) {
            label += " (planId: \"" + planIdContext + "\")";
        }
        HostPlan hostPlan = read(data, HostPlan.class, label);
        requireVersion(label, hostPlan.version(), HostPlan.SCHEMA_VERSION);
        return hostPlan;
    }

    /// Strictly decodes an execution report. Reports carry no version.
    ///
    /// @param data UTF-8 JSON, not null
    /// @return the report, never null
    /// @throws PlanDecodeException if the document is not a strict report
    public ExecutionReport decodeExecutionReport(byte[] data) throws PlanDecodeException {
        return read(data, ExecutionReport.class, "strict decode execution report");
    }

    /// Strictly decodes any type bound by this codec's mapper.
    ///
    /// @param data UTF-8 JSON, not null
    /// @param type target type, not null
    /// @param <T>  target type
    /// @return decoded value, never null
    /// @throws PlanDecodeException if the document is not a strict instance of `type`
    public <T> T decodeStrict(byte[] data, Class<T> type) throws PlanDecodeException {
        Objects.requireNonNull(type, "type must not be null");
        return read(data, type, "strict decode " + type.getSimpleName());
    }

    /// Best-effort lenient read of a document's top-level `planId`.
    ///
    /// Never fails: malformed input simply yields no id.
    ///
    /// @param data JSON bytes, may be null
    /// @return the plan id when present as a non-empty string
    public Optional<String> peekPlanId(byte[] data) {
        if (data == null || data.length == 0) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = LENIENT.readTree(data);
        } catch (IOException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode planId = root.get("planId");
        if (planId == null || !planId.isTextual() || planId.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(planId.asText());
    }

    /// Encodes a value as compact JSON.
    ///
    /// @param value value to encode, not null
    /// @return UTF-8 JSON, never null
    /// @throws IllegalArgumentException if the value cannot be serialized
    public byte[] encode(Object value) {
        Objects.requireNonNull(value, "value must not be null");
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + typeName(value) + ": " + e.getOriginalMessage(), e);
        }
    }

    /// Encodes a value as indented JSON.
    ///
    /// @param value value to encode, not null
    /// @return UTF-8 JSON, never null
    /// @throws IllegalArgumentException if the value cannot be serialized
    public byte[] encodePretty(Object value) {
        Objects.requireNonNull(value, "value must not be null");
        try {
            return prettyWriter.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + typeName(value) + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(byte[] data, Class<T> type, String label) throws PlanDecodeException {
        Objects.requireNonNull(data, "data must not be null");
        try (JsonParser parser = mapper.createParser(data)) {
            T value = mapper.readValue(parser, type);
            if (value == null) {
                throw new PlanDecodeException(Reason.MALFORMED, label + ": document is null");
            }
            if (hasTrailingContent(parser)) {
                throw new PlanDecodeException(Reason.TRAILING_CONTENT, label + ": " + TRAILING);
            }
            return value;
        } catch (UnrecognizedPropertyException e) {
            throw new PlanDecodeException(
                    Reason.UNKNOWN_FIELD,
                    label + ": unknown field \"" + e.getPropertyName() + "\"",
                    e.getPropertyName(),
                    e);
        } catch (JsonProcessingException e) {
            throw new PlanDecodeException(Reason.MALFORMED, label + ": " + e.getOriginalMessage(), "", e);
        } catch (IOException e) {
            throw new PlanDecodeException(Reason.MALFORMED, label + ": " + e.getMessage(), "", e);
        }
    }

    private static boolean hasTrailingContent(JsonParser parser) throws IOException {
        try {
            return parser.nextToken() != null;
        } catch (JsonProcessingException e) {
            // Garbage after the value is trailing content, not a malformed document.
            return true;
        }
    }

    private static void requireVersion(String label, String actual, String expected)
            throws PlanDecodeException {
        if (!expected.equals(actual)) {
            throw new PlanDecodeException(
                    Reason.VERSION_MISMATCH,
                    label + ": unsupported version \"" + actual + "\" (expected \"" + expected + "\")",
                    "version",
                    null);
        }
    }

    private static String typeName(Object value) {
        return value.getClass().getSimpleName();
    }
}
