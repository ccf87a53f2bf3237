package io.stagecraft.serialization.inputs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.stagecraft.core.util.Immutables;
import java.util.ArrayList;
import java.util.List;

/// One HTTP endpoint probed by a `health_check` step.
///
/// @param name           unique endpoint name, the sort key
/// @param url            URL to probe
/// @param expectedStatus expected HTTP status, positive
/// @param method         HTTP method, required (no implicit GET)
/// @param headers        request headers, sorted by key
@JsonPropertyOrder({"name", "url", "expected_status", "method", "headers"})
public record HealthEndpoint(
        String name,
        String url,
        @JsonProperty("expected_status") int expectedStatus,
        String method,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<KeyValue> headers) {

    public HealthEndpoint {
        name = Immutables.orEmpty(name);
        url = Immutables.orEmpty(url);
        method = Immutables.orEmpty(method);
        headers = Immutables.copyOf(headers);
    }

    HealthEndpoint normalized() {
        List<KeyValue> trimmedHeaders = new ArrayList<>(headers.size());
        for (KeyValue header : headers) {
            trimmedHeaders.add(header.trimmed());
        }
        return new HealthEndpoint(
                InputsNormalizer.trim(name),
                InputsNormalizer.trim(url),
                expectedStatus,
                InputsNormalizer.trim(method),
                InputsNormalizer.sortByKey(trimmedHeaders, KeyValue::key));
    }
}
