package fr.lapetina.congress.gateway.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw, unvalidated decomposition of a {@code congress-gov://} identifier.
 * Immutable and thread-safe.
 *
 * @param identifier the original identifier string
 * @param collection first path segment, lower-cased
 * @param segments   remaining path segments in order, as supplied
 * @param query      query parameters after {@code ?}, insertion-ordered
 */
public record IdentifierDescriptor(
        String identifier,
        String collection,
        List<String> segments,
        Map<String, String> query
) {
    public IdentifierDescriptor {
        Objects.requireNonNull(identifier, "Identifier is required");
        Objects.requireNonNull(collection, "Collection is required");
        segments = segments != null ? List.copyOf(segments) : List.of();
        query = query != null ? Collections.unmodifiableMap(new LinkedHashMap<>(query)) : Map.of();
    }

    /**
     * Collection plus segments, slash separated, without scheme or query.
     */
    public String path() {
        if (segments.isEmpty()) {
            return collection;
        }
        return collection + "/" + String.join("/", segments);
    }

    public int segmentCount() {
        return segments.size();
    }
}
