package fr.lapetina.congress.gateway.domain.validation;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * The 56 two-letter codes the upstream member endpoints accept:
 * 50 states, the District of Columbia and five territories.
 */
public final class StateCodes {

    private static final Set<String> STATES = Set.of(
            "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA",
            "HI", "ID", "IL", "IN", "IA", "KS", "KY", "LA", "ME", "MD",
            "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ",
            "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC",
            "SD", "TN", "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY"
    );

    private static final Set<String> DISTRICT_AND_TERRITORIES = Set.of(
            "DC", "PR", "VI", "GU", "AS", "MP"
    );

    private static final Set<String> ALL = union(STATES, DISTRICT_AND_TERRITORIES);

    private StateCodes() {
    }

    public static Set<String> all() {
        return ALL;
    }

    public static boolean isValid(String code) {
        return code != null && ALL.contains(code.toUpperCase(Locale.ROOT));
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> merged = new HashSet<>(a);
        merged.addAll(b);
        return Set.copyOf(merged);
    }
}
