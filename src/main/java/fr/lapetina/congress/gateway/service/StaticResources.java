package fr.lapetina.congress.gateway.service;

import fr.lapetina.congress.gateway.domain.identifier.IdentifierParser;
import fr.lapetina.congress.gateway.domain.model.BillType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resources answered locally. They never reach the upstream and never consume admission budget.
 */
public class StaticResources {

    public static final String OVERVIEW = IdentifierParser.SCHEME_PREFIX + "info/overview";
    public static final String CURRENT_CONGRESS = IdentifierParser.SCHEME_PREFIX + "info/current-congress";
    public static final String BILL_TYPES = IdentifierParser.SCHEME_PREFIX + "bill-types";

    static final int CURRENT_CONGRESS_NUMBER = 118;
    static final String CURRENT_CONGRESS_START = "2023-01-03";
    static final String CURRENT_CONGRESS_END = "2025-01-03";

    private final Map<String, Map<String, Object>> resources = new LinkedHashMap<>();

    public StaticResources() {
        resources.put(OVERVIEW, Collections.unmodifiableMap(overview()));
        resources.put(CURRENT_CONGRESS, Collections.unmodifiableMap(currentCongress()));
        resources.put(BILL_TYPES, Collections.unmodifiableMap(billTypes()));
    }

    /**
     * Payload for {@code identifier}, or empty when it is not a static resource.
     * Matching ignores case, surrounding whitespace and any query string.
     */
    public Optional<Map<String, Object>> lookup(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        String key = identifier.trim();
        int query = key.indexOf('?');
        if (query >= 0) {
            key = key.substring(0, query);
        }
        return Optional.ofNullable(resources.get(key.toLowerCase(Locale.ROOT)));
    }

    public boolean isStatic(String identifier) {
        return lookup(identifier).isPresent();
    }

    public List<String> identifiers() {
        return List.copyOf(resources.keySet());
    }

    private static Map<String, Object> overview() {
        Map<String, Object> overview = new LinkedHashMap<>();
        overview.put("message", "Congress.gov API provides access to legislative data.");
        overview.put("version", "v3");
        overview.put("documentation", "https://api.congress.gov/");
        return overview;
    }

    private static Map<String, Object> currentCongress() {
        Map<String, Object> congress = new LinkedHashMap<>();
        congress.put("number", CURRENT_CONGRESS_NUMBER);
        congress.put("startDate", CURRENT_CONGRESS_START);
        congress.put("endDate", CURRENT_CONGRESS_END);
        return congress;
    }

    private static Map<String, Object> billTypes() {
        List<Map<String, Object>> types = new ArrayList<>();
        for (BillType type : BillType.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("code", type.getCode());
            entry.put("name", type.getDisplayName());
            entry.put("chamber", type.getChamber().getCode());
            entry.put("description", type.getDescription());
            entry.put("example", type.getExample());
            types.add(entry);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("billTypes", List.copyOf(types));
        payload.put("count", types.size());
        return payload;
    }
}
