package fr.lapetina.congress.gateway.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A resolved, validated request for one upstream resource.
 * Immutable and thread-safe.
 *
 * <p>{@code params} holds the normalized field values in identifier order
 * ({@code Integer} numbers, enum codes such as {@link BillType} or {@link Chamber},
 * upper-cased state codes, {@link java.time.LocalDate} for record dates).
 */
public record ResourceRequest(
        String identifier,
        ResourceCollection collection,
        Map<String, Object> params,
        String subResource,
        String endpoint,
        Map<String, String> query
) {
    public ResourceRequest {
        Objects.requireNonNull(identifier, "Identifier is required");
        Objects.requireNonNull(collection, "Collection is required");
        Objects.requireNonNull(endpoint, "Endpoint is required");
        if (!endpoint.startsWith("/")) {
            throw new IllegalArgumentException("Endpoint must start with '/': " + endpoint);
        }
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
        query = query != null ? Collections.unmodifiableMap(new LinkedHashMap<>(query)) : Map.of();
    }

    public Optional<String> subResourceName() {
        return Optional.ofNullable(subResource);
    }

    public Object param(String name) {
        return params.get(name);
    }

    public <T> T param(String name, Class<T> type) {
        Object value = params.get(name);
        if (value == null) {
            return null;
        }
        return type.cast(value);
    }

    public Integer intParam(String name) {
        return param(name, Integer.class);
    }

    public String stringParam(String name) {
        Object value = params.get(name);
        return value != null ? value.toString() : null;
    }
}
