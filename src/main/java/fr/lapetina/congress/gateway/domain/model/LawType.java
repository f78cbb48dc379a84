package fr.lapetina.congress.gateway.domain.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Public or private law. The upstream path uses the short code ({@code pub} / {@code priv}).
 */
public enum LawType {
    PUBLIC("pub", Set.of("public", "pub", "pl", "publaw", "public-law")),
    PRIVATE("priv", Set.of("private", "priv", "pvt", "pvtl", "private-law"));

    private final String apiCode;
    private final Set<String> aliases;

    LawType(String apiCode, Set<String> aliases) {
        this.apiCode = apiCode;
        this.aliases = aliases;
    }

    public String getApiCode() {
        return apiCode;
    }

    public static Optional<LawType> fromCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (LawType type : values()) {
            if (type.aliases.contains(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return apiCode;
    }
}
