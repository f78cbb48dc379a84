package fr.lapetina.congress.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.identifier.IdentifierParser;
import fr.lapetina.congress.gateway.domain.model.SearchRequest;
import fr.lapetina.congress.gateway.domain.validation.ParameterValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Keyword search and filtered listing over one upstream collection.
 *
 * <p>The upstream list endpoints only honour a date range and a type filter. A {@code congress}
 * filter is refused outright rather than silently ignored; congress-scoped lists are reached
 * through identifiers such as {@code congress-gov://law/118}.
 */
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    public static final List<String> SEARCHABLE_COLLECTIONS = List.of(
            "bill", "amendment", "committee-report", "committee", "committee-print",
            "congressional-record", "daily-congressional-record", "bound-congressional-record",
            "house-communication", "senate-communication", "nomination", "treaty", "member");

    public static final Set<String> SORT_OPTIONS = Set.of("updateDate+asc", "updateDate+desc");

    static final String FILTER_TYPE = "type";
    static final String FILTER_FROM = "fromDateTime";
    static final String FILTER_TO = "toDateTime";
    private static final Set<String> SUPPORTED_FILTERS = Set.of(FILTER_TYPE, FILTER_FROM, FILTER_TO);

    private final RequestExecutor executor;
    private final ParameterValidator validator;

    public SearchService(RequestExecutor executor, ParameterValidator validator) {
        this.executor = executor;
        this.validator = validator;
    }

    /**
     * Validates then executes. Validation failures are thrown before any budget is used.
     */
    public CompletableFuture<JsonNode> search(SearchRequest request) {
        String collection = validateCollection(request.collection());
        Map<String, String> params = toQueryParams(collection, request);
        log.info("Search: collection={}, params={}", collection, params.keySet());
        return executor.execute("/" + collection, params);
    }

    /**
     * Identifier reported in the envelope of a search result.
     */
    public static String envelopeUri(String collection) {
        return IdentifierParser.SCHEME_PREFIX + "search/" + collection;
    }

    Map<String, String> toQueryParams(String collection, SearchRequest request) {
        Map<String, String> params = new LinkedHashMap<>();

        if (request.query() != null) {
            if (request.query().isBlank()) {
                throw CongressApiException.invalidParameter("Search query must not be blank");
            }
            params.put("q", request.query().trim());
        }

        request.filters().forEach((key, value) -> {
            if ("congress".equals(key)) {
                throw CongressApiException.invalidParameter(
                        "Filter 'congress' is not supported for collection '" + collection + "'. "
                                + "Use a congress-specific resource URI (e.g., congress-gov://bill/118/hr/1) instead.");
            }
            if (!SUPPORTED_FILTERS.contains(key)) {
                throw CongressApiException.invalidParameter(
                        "Filter '" + key + "' is not supported for collection '" + collection + "'");
            }
            params.put(key, validateFilter(key, value));
        });

        if (request.sort() != null) {
            if (!SORT_OPTIONS.contains(request.sort())) {
                throw CongressApiException.invalidParameter(
                        "Invalid sort '" + request.sort() + "'. Must be one of: updateDate+asc, updateDate+desc");
            }
            params.put("sort", request.sort());
        }

        Integer limit = validator.pageLimit(request.limit());
        if (limit != null) {
            params.put("limit", limit.toString());
        }
        Integer offset = validator.pageOffset(request.offset());
        if (offset != null) {
            params.put("offset", offset.toString());
        }
        return params;
    }

    private static String validateCollection(String raw) {
        if (raw == null || raw.isBlank()) {
            throw CongressApiException.invalidParameter("Search collection is required");
        }
        String collection = raw.trim().toLowerCase(Locale.ROOT);
        if (!SEARCHABLE_COLLECTIONS.contains(collection)) {
            throw CongressApiException.invalidParameter(
                    "Invalid search collection '" + raw + "'. Must be one of: "
                            + String.join(", ", SEARCHABLE_COLLECTIONS));
        }
        return collection;
    }

    private static String validateFilter(String key, String value) {
        if (value == null || value.isBlank()) {
            throw CongressApiException.invalidParameter("Filter '" + key + "' must not be blank");
        }
        if (FILTER_TYPE.equals(key)) {
            return value.trim();
        }
        try {
            // Normalized so the upstream always sees second precision with a Z suffix
            return Instant.parse(value.trim()).toString();
        } catch (DateTimeParseException e) {
            throw CongressApiException.invalidParameter(
                    "Invalid " + key + " '" + value + "'. Must be an ISO-8601 date-time (e.g., 2023-01-01T00:00:00Z)");
        }
    }
}
