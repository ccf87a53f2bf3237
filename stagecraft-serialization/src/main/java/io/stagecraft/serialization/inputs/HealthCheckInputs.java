package io.stagecraft.serialization.inputs;

import static io.stagecraft.serialization.inputs.InputsNormalizer.requireNonEmpty;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.stagecraft.core.util.Immutables;
import java.util.ArrayList;
import java.util.List;

/// Inputs of a `health_check` step: exactly one of {@code endpoints} or {@code services}.
@JsonPropertyOrder({
    "environment", "endpoints", "services", "timeout_seconds", "interval_seconds", "retries"
})
public record HealthCheckInputs(
        String environment,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<HealthEndpoint> endpoints,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> services,
        @JsonProperty("timeout_seconds") @JsonInclude(JsonInclude.Include.NON_NULL)
                Integer timeoutSeconds,
        @JsonProperty("interval_seconds") @JsonInclude(JsonInclude.Include.NON_NULL)
                Integer intervalSeconds,
        @JsonInclude(JsonInclude.Include.NON_NULL) Integer retries)
        implements StepInputs<HealthCheckInputs> {

    public HealthCheckInputs {
        environment = Immutables.orEmpty(environment);
        endpoints = Immutables.copyOf(endpoints);
        services = Immutables.copyOf(services);
    }

    @Override
    public HealthCheckInputs normalize() {
        List<HealthEndpoint> normalizedEndpoints = new ArrayList<>(endpoints.size());
        for (HealthEndpoint endpoint : endpoints) {
            normalizedEndpoints.add(endpoint.normalized());
        }
        return new HealthCheckInputs(
                InputsNormalizer.trim(environment),
                InputsNormalizer.sortByKey(normalizedEndpoints, HealthEndpoint::name),
                InputsNormalizer.trimAndSort(services),
                timeoutSeconds,
                intervalSeconds,
                retries);
    }

    @Override
    public void validate() throws InputsValidationException {
        requireNonEmpty(environment, "environment is required");
        if (endpoints.isEmpty() == services.isEmpty()) {
            throw new InputsValidationException(
                    "exactly one of endpoints or services must be provided");
        }
        InputsNormalizer.requirePositiveIfPresent(timeoutSeconds, "timeout_seconds");
        InputsNormalizer.requirePositiveIfPresent(intervalSeconds, "interval_seconds");
        if (retries != null && retries < 0) {
            throw new InputsValidationException("retries must be >= 0 if present");
        }
        InputsNormalizer.requireNoBlankEntries(services, "services");
        for (HealthEndpoint endpoint : endpoints) {
            requireNonEmpty(endpoint.name(), "endpoints.name is required");
            requireNonEmpty(endpoint.url(), "endpoints.url is required");
            if (endpoint.expectedStatus() <= 0) {
                throw new InputsValidationException(
                        "endpoints.expected_status must be a valid HTTP status");
            }
            requireNonEmpty(
                    endpoint.method(), "endpoints.method is required (producer must set explicitly)");
            for (KeyValue header : endpoint.headers()) {
                requireNonEmpty(header.key(), "endpoints.headers.key is required");
            }
        }
    }
}
