package fr.lapetina.congress.gateway.domain.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Amendment types, with the longhand spellings callers tend to use.
 */
public enum AmendmentType {
    HAMDT("hamdt", Set.of("house-amendment", "houseamendment", "h.amdt", "h-amdt")),
    SAMDT("samdt", Set.of("senate-amendment", "senateamendment", "s.amdt", "s-amdt"));

    private final String code;
    private final Set<String> aliases;

    AmendmentType(String code, Set<String> aliases) {
        this.code = code;
        this.aliases = aliases;
    }

    public String getCode() {
        return code;
    }

    public static Optional<AmendmentType> fromCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AmendmentType type : values()) {
            if (type.code.equals(normalized) || type.aliases.contains(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
