package fr.lapetina.congress.gateway.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Chamber of Congress.
 */
public enum Chamber {
    HOUSE("house"),
    SENATE("senate");

    private final String code;

    Chamber(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<Chamber> fromCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "house" -> Optional.of(HOUSE);
            case "senate" -> Optional.of(SENATE);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return code;
    }
}
