package fr.lapetina.congress.gateway.domain.identifier;

import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.model.Chamber;
import fr.lapetina.congress.gateway.domain.model.ResourceCollection;
import fr.lapetina.congress.gateway.domain.validation.ParameterValidator;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ordered identifier grammar. Routes for a collection are tried most-specific first and the
 * first match wins.
 *
 * <p>Adding an upstream endpoint means adding one row here; there is no per-endpoint handler.
 */
public final class ResourceRouteTable {

    public static final List<String> BILL_SUB_RESOURCES = List.of(
            "actions", "amendments", "committees", "cosponsors", "relatedbills",
            "subjects", "summaries", "text", "titles");
    public static final List<String> MEMBER_SUB_RESOURCES = List.of(
            "sponsored-legislation", "cosponsored-legislation");
    public static final List<String> COMMITTEE_SUB_RESOURCES = List.of(
            "bills", "reports", "nominations", "house-communication", "senate-communication");
    public static final List<String> AMENDMENT_SUB_RESOURCES = List.of(
            "actions", "amendments", "cosponsors", "text");
    public static final List<String> NOMINATION_SUB_RESOURCES = List.of(
            "actions", "committees", "hearings");
    public static final List<String> TREATY_SUB_RESOURCES = List.of(
            "actions", "committees");

    private final List<ResourceRoute> routes;
    private final Map<ResourceCollection, List<ResourceRoute>> byCollection;

    public ResourceRouteTable(List<ResourceRoute> routes) {
        this.routes = List.copyOf(routes);
        Map<ResourceCollection, List<ResourceRoute>> grouped = new EnumMap<>(ResourceCollection.class);
        for (ResourceRoute route : this.routes) {
            grouped.computeIfAbsent(route.getCollection(), c -> new ArrayList<>()).add(route);
        }
        grouped.replaceAll((c, list) -> List.copyOf(list));
        this.byCollection = Collections.unmodifiableMap(grouped);
    }

    public List<ResourceRoute> all() {
        return routes;
    }

    /**
     * Routes for one collection, in match order. Empty when the collection has no upstream routes.
     */
    public List<ResourceRoute> routesFor(ResourceCollection collection) {
        return byCollection.getOrDefault(collection, List.of());
    }

    /**
     * Sub-resource whitelist of the collection's base entity route, or empty if it has none.
     */
    public List<String> subResourcesFor(ResourceCollection collection) {
        return routesFor(collection).stream()
                .filter(ResourceRoute::acceptsSubResources)
                .findFirst()
                .map(ResourceRoute::getSubResources)
                .orElse(List.of());
    }

    /**
     * The full Congress.gov v3 grammar.
     */
    public static ResourceRouteTable standard(ParameterValidator v) {
        List<ResourceRoute> routes = new ArrayList<>();

        // ==================== BILLS ====================

        routes.add(ResourceRoute.builder(ResourceCollection.BILL, "bill/{congress}/{billType}/{billNumber}")
                .numeric("congress", v::congress)
                .text("billType", v::billType)
                .numeric("billNumber", raw -> v.positiveNumber("bill number", raw))
                .subResources(BILL_SUB_RESOURCES.toArray(String[]::new))
                .endpoint("/bill/{congress}/{billType}/{billNumber}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.SUMMARIES, "summaries/{congress}/{billType}")
                .numeric("congress", v::congress)
                .text("billType", v::billType)
                .endpoint("/summaries/{congress}/{billType}")
                .build());

        // ==================== MEMBERS ====================

        routes.add(ResourceRoute.builder(ResourceCollection.MEMBER,
                        "member/congress/{congress}/state/{stateCode}/district/{district}")
                .numeric("congress", v::congress)
                .text("stateCode", v::stateCode)
                .text("district", v::district)
                .endpoint("/member/congress/{congress}/{stateCode}/{district}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.MEMBER, "member/state/{stateCode}/district/{district}")
                .text("stateCode", v::stateCode)
                .text("district", v::district)
                .endpoint("/member/{stateCode}/{district}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.MEMBER, "member/state/{stateCode}")
                .text("stateCode", v::stateCode)
                .endpoint("/member/{stateCode}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.MEMBER, "member/{bioguideId}")
                .text("bioguideId", raw -> v.bioguideId(raw.toUpperCase(Locale.ROOT)))
                .subResources(MEMBER_SUB_RESOURCES.toArray(String[]::new))
                .endpoint("/member/{bioguideId}")
                .build());

        // ==================== CONGRESS ====================

        routes.add(ResourceRoute.builder(ResourceCollection.CONGRESS, "congress/{congress}")
                .numeric("congress", v::anyCongress)
                .endpoint("/congress/{congress}")
                .build());

        // ==================== COMMITTEES ====================

        routes.add(ResourceRoute.builder(ResourceCollection.COMMITTEE, "committee/{chamber}/{committeeCode}")
                .text("chamber", v::chamber)
                .text("committeeCode", v::committeeCode)
                .subResources(COMMITTEE_SUB_RESOURCES.toArray(String[]::new))
                .check(ResourceRouteTable::communicationMatchesChamber)
                .endpoint("/committee/{chamber}/{committeeCode}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.COMMITTEE_REPORT,
                        "committee-report/{congress}/{reportType}/{reportNumber}")
                .numeric("congress", v::congress)
                .text("reportType", v::reportType)
                .numeric("reportNumber", raw -> v.positiveNumber("report number", raw))
                .subResources("text")
                .endpoint("/committee-report/{congress}/{reportType}/{reportNumber}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.COMMITTEE_PRINT,
                        "committee-print/{congress}/{chamber}/{jacketNumber}")
                .numeric("congress", v::congress)
                .text("chamber", v::chamber)
                .numeric("jacketNumber", raw -> v.positiveNumber("jacket number", raw))
                .subResources("text")
                .endpoint("/committee-print/{congress}/{chamber}/{jacketNumber}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.COMMITTEE_MEETING,
                        "committee-meeting/{congress}/{chamber}/{eventId}")
                .numeric("congress", v::congress)
                .text("chamber", v::chamber)
                .numeric("eventId", raw -> v.positiveNumber("event ID", raw))
                .endpoint("/committee-meeting/{congress}/{chamber}/{eventId}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.HEARING, "hearing/{congress}/{chamber}/{jacketNumber}")
                .numeric("congress", v::congress)
                .text("chamber", v::chamber)
                .numeric("jacketNumber", raw -> v.positiveNumber("jacket number", raw))
                .endpoint("/hearing/{congress}/{chamber}/{jacketNumber}")
                .build());

        // ==================== AMENDMENTS AND LAWS ====================

        routes.add(ResourceRoute.builder(ResourceCollection.AMENDMENT,
                        "amendment/{congress}/{amendmentType}/{amendmentNumber}")
                .numeric("congress", v::congress)
                .text("amendmentType", v::amendmentType)
                .numeric("amendmentNumber", raw -> v.positiveNumber("amendment number", raw))
                .subResources(AMENDMENT_SUB_RESOURCES.toArray(String[]::new))
                .endpoint("/amendment/{congress}/{amendmentType}/{amendmentNumber}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.LAW, "law/{congress}/{lawType}/{lawNumber}")
                .numeric("congress", v::congress)
                .text("lawType", v::lawType)
                .numeric("lawNumber", raw -> v.positiveNumber("law number", raw))
                .endpoint("/law/{congress}/{lawType}/{lawNumber}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.LAW, "law/{congress}/{lawType}")
                .numeric("congress", v::congress)
                .text("lawType", v::lawType)
                .endpoint("/law/{congress}/{lawType}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.LAW, "law/{congress}")
                .numeric("congress", v::congress)
                .endpoint("/law/{congress}")
                .build());

        // ==================== NOMINATIONS AND TREATIES ====================

        routes.add(ResourceRoute.builder(ResourceCollection.NOMINATION,
                        "nomination/{congress}/{nominationNumber}/nominee/{ordinal}")
                .numeric("congress", v::congress)
                .numeric("nominationNumber", raw -> v.positiveNumber("nomination number", raw))
                .numeric("ordinal", raw -> v.positiveNumber("ordinal number", raw))
                .impliedSubResource("nominee")
                .endpoint("/nomination/{congress}/{nominationNumber}/{ordinal}")
                .endpointIncludesSubResource()
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.NOMINATION, "nomination/{congress}/{nominationNumber}")
                .numeric("congress", v::congress)
                .numeric("nominationNumber", raw -> v.positiveNumber("nomination number", raw))
                .subResources(NOMINATION_SUB_RESOURCES.toArray(String[]::new))
                .endpoint("/nomination/{congress}/{nominationNumber}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.TREATY,
                        "treaty/{congress}/{treatyNumber}/suffix/{treatySuffix}")
                .numeric("congress", v::congress)
                .numeric("treatyNumber", raw -> v.positiveNumber("treaty number", raw))
                .text("treatySuffix", v::treatySuffix)
                .impliedSubResource("suffix")
                .endpoint("/treaty/{congress}/{treatyNumber}/{treatySuffix}")
                .endpointIncludesSubResource()
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.TREATY, "treaty/{congress}/{treatyNumber}")
                .numeric("congress", v::congress)
                .numeric("treatyNumber", raw -> v.positiveNumber("treaty number", raw))
                .subResources(TREATY_SUB_RESOURCES.toArray(String[]::new))
                .endpoint("/treaty/{congress}/{treatyNumber}")
                .build());

        // ==================== CONGRESSIONAL RECORD ====================

        routes.add(ResourceRoute.builder(ResourceCollection.CONGRESSIONAL_RECORD, "congressional-record")
                .endpoint("/congressional-record")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.DAILY_CONGRESSIONAL_RECORD,
                        "daily-congressional-record/{volumeNumber}/{issueNumber}")
                .numeric("volumeNumber", raw -> v.positiveNumber("volume number", raw))
                .numeric("issueNumber", raw -> v.positiveNumber("issue number", raw))
                .subResources("articles")
                .endpoint("/daily-congressional-record/{volumeNumber}/{issueNumber}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.BOUND_CONGRESSIONAL_RECORD,
                        "bound-congressional-record/{year}/{month}/{day}")
                .numeric("year", raw -> raw)
                .numeric("month", raw -> raw)
                .numeric("day", raw -> raw)
                .check((params, sub) -> {
                    LocalDate date = v.calendarDate(
                            (String) params.get("year"), (String) params.get("month"), (String) params.get("day"));
                    // Upstream paths use two-digit month and day
                    params.put("year", date.getYear());
                    params.put("month", String.format("%02d", date.getMonthValue()));
                    params.put("day", String.format("%02d", date.getDayOfMonth()));
                    params.put("date", date);
                })
                .endpoint("/bound-congressional-record/{year}/{month}/{day}")
                .build());

        // ==================== COMMUNICATIONS ====================

        routes.add(ResourceRoute.builder(ResourceCollection.HOUSE_COMMUNICATION,
                        "house-communication/{congress}/{communicationType}/{communicationNumber}")
                .numeric("congress", v::congress)
                .text("communicationType", v::communicationType)
                .numeric("communicationNumber", raw -> v.positiveNumber("communication number", raw))
                .endpoint("/house-communication/{congress}/{communicationType}/{communicationNumber}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.SENATE_COMMUNICATION,
                        "senate-communication/{congress}/{communicationType}/{communicationNumber}")
                .numeric("congress", v::congress)
                .text("communicationType", v::communicationType)
                .numeric("communicationNumber", raw -> v.positiveNumber("communication number", raw))
                .endpoint("/senate-communication/{congress}/{communicationType}/{communicationNumber}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.HOUSE_REQUIREMENT, "house-requirement/{requirementNumber}")
                .numeric("requirementNumber", raw -> v.positiveNumber("requirement number", raw))
                .subResources("matching-communications")
                .endpoint("/house-requirement/{requirementNumber}")
                .build());

        // ==================== REPORTS AND VOTES ====================

        routes.add(ResourceRoute.builder(ResourceCollection.CRS_REPORT, "crsreport/{reportNumber}")
                .text("reportNumber", v::crsReportNumber)
                .endpoint("/crsreport/{reportNumber}")
                .build());

        routes.add(ResourceRoute.builder(ResourceCollection.HOUSE_VOTE, "house-vote/{congress}/{session}/{voteNumber}")
                .numeric("congress", v::congress)
                .numeric("session", v::session)
                .numeric("voteNumber", raw -> v.positiveNumber("vote number", raw))
                .subResources("members")
                .endpoint("/house-vote/{congress}/{session}/{voteNumber}")
                .build());

        return new ResourceRouteTable(routes);
    }

    private static void communicationMatchesChamber(Map<String, Object> params, String subResource) {
        Chamber chamber = (Chamber) params.get("chamber");
        if ("house-communication".equals(subResource) && chamber != Chamber.HOUSE) {
            throw CongressApiException.invalidParameter(
                    "Sub-resource 'house-communication' is only available for house committees, not " + chamber);
        }
        if ("senate-communication".equals(subResource) && chamber != Chamber.SENATE) {
            throw CongressApiException.invalidParameter(
                    "Sub-resource 'senate-communication' is only available for senate committees, not " + chamber);
        }
    }
}
