package fr.lapetina.congress.gateway.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entity categories addressable through {@code congress-gov://} identifiers.
 * The tag is the first identifier segment.
 */
public enum ResourceCollection {
    BILL("bill"),
    BILL_TYPES("bill-types"),
    MEMBER("member"),
    CONGRESS("congress"),
    COMMITTEE("committee"),
    AMENDMENT("amendment"),
    LAW("law"),
    COMMITTEE_REPORT("committee-report"),
    COMMITTEE_PRINT("committee-print"),
    COMMITTEE_MEETING("committee-meeting"),
    HEARING("hearing"),
    NOMINATION("nomination"),
    CONGRESSIONAL_RECORD("congressional-record"),
    DAILY_CONGRESSIONAL_RECORD("daily-congressional-record"),
    BOUND_CONGRESSIONAL_RECORD("bound-congressional-record"),
    HOUSE_COMMUNICATION("house-communication"),
    SENATE_COMMUNICATION("senate-communication"),
    HOUSE_REQUIREMENT("house-requirement"),
    TREATY("treaty"),
    CRS_REPORT("crsreport"),
    SUMMARIES("summaries"),
    HOUSE_VOTE("house-vote"),
    INFO("info");

    private static final Map<String, ResourceCollection> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ResourceCollection::getTag, Function.identity()));

    private final String tag;

    ResourceCollection(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static Optional<ResourceCollection> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(tag.toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return tag;
    }
}
