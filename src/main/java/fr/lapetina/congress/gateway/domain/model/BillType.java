package fr.lapetina.congress.gateway.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The eight legislation types accepted by the upstream bill endpoints.
 */
public enum BillType {
    HR("hr", "House Bill", Chamber.HOUSE,
            "Regular legislation originating in the House", "H.R. 1"),
    S("s", "Senate Bill", Chamber.SENATE,
            "Regular legislation originating in the Senate", "S. 25"),
    HJRES("hjres", "House Joint Resolution", Chamber.HOUSE,
            "Constitutional amendments, continuing appropriations and emergency declarations", "H.J.Res. 1"),
    SJRES("sjres", "Senate Joint Resolution", Chamber.SENATE,
            "Constitutional amendments, continuing appropriations and emergency declarations", "S.J.Res. 5"),
    HCONRES("hconres", "House Concurrent Resolution", Chamber.HOUSE,
            "Budget resolutions and procedural matters affecting both chambers", "H.Con.Res. 10"),
    SCONRES("sconres", "Senate Concurrent Resolution", Chamber.SENATE,
            "Budget resolutions and procedural matters affecting both chambers", "S.Con.Res. 3"),
    HRES("hres", "House Simple Resolution", Chamber.HOUSE,
            "House rules and commemorative resolutions", "H.Res. 100"),
    SRES("sres", "Senate Simple Resolution", Chamber.SENATE,
            "Senate rules and commemorative resolutions", "S.Res. 50");

    private final String code;
    private final String displayName;
    private final Chamber chamber;
    private final String description;
    private final String example;

    BillType(String code, String displayName, Chamber chamber, String description, String example) {
        this.code = code;
        this.displayName = displayName;
        this.chamber = chamber;
        this.description = description;
        this.example = example;
    }

    public String getCode() { return code; }
    public String getDisplayName() { return displayName; }
    public Chamber getChamber() { return chamber; }
    public String getDescription() { return description; }
    public String getExample() { return example; }

    public static Optional<BillType> fromCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.code.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return code;
    }
}
