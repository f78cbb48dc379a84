package fr.lapetina.congress.gateway.domain.identifier;

import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.model.IdentifierDescriptor;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits {@code congress-gov://collection/seg1/.../[?query]} into an {@link IdentifierDescriptor}.
 *
 * Only the shape is checked here:
 * - scheme must be {@code congress-gov}
 * - collection must be present
 * - no empty path segments (so {@code a//b} and a trailing {@code /} are rejected)
 *
 * Which segments are meaningful is decided by {@link ResourceRouteTable}.
 */
public final class IdentifierParser {

    public static final String SCHEME = "congress-gov";
    public static final String SCHEME_PREFIX = SCHEME + "://";

    public IdentifierDescriptor parse(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw CongressApiException.invalidIdentifier("Resource identifier is required");
        }

        String trimmed = identifier.trim();
        if (!trimmed.regionMatches(true, 0, SCHEME_PREFIX, 0, SCHEME_PREFIX.length())) {
            throw CongressApiException.invalidIdentifier(
                    "Invalid resource URI: " + identifier + ". Must start with '" + SCHEME_PREFIX + "'");
        }

        String rest = trimmed.substring(SCHEME_PREFIX.length());
        String rawQuery = null;
        int queryStart = rest.indexOf('?');
        if (queryStart >= 0) {
            rawQuery = rest.substring(queryStart + 1);
            rest = rest.substring(0, queryStart);
        }

        if (rest.isEmpty()) {
            throw CongressApiException.invalidIdentifier(
                    "Missing collection in resource URI: " + identifier);
        }

        String[] parts = rest.split("/", -1);
        for (String part : parts) {
            if (part.isEmpty()) {
                throw CongressApiException.invalidIdentifier(
                        "Invalid resource URI format (empty path segment): " + identifier);
            }
        }

        String collection = parts[0].toLowerCase(Locale.ROOT);
        List<String> segments = new ArrayList<>(parts.length - 1);
        for (int i = 1; i < parts.length; i++) {
            segments.add(parts[i]);
        }

        return new IdentifierDescriptor(identifier, collection, segments, parseQuery(rawQuery, identifier));
    }

    private static Map<String, String> parseQuery(String rawQuery, String identifier) {
        Map<String, String> query = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return query;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            try {
                key = URLDecoder.decode(key, StandardCharsets.UTF_8);
                value = URLDecoder.decode(value, StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                throw CongressApiException.invalidIdentifier(
                        "Malformed query string in resource URI: " + identifier);
            }
            if (key.isEmpty()) {
                throw CongressApiException.invalidIdentifier(
                        "Malformed query string in resource URI: " + identifier);
            }
            query.put(key, value);
        }
        return query;
    }
}
