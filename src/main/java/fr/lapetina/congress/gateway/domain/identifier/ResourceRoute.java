package fr.lapetina.congress.gateway.domain.identifier;

import fr.lapetina.congress.gateway.domain.model.IdentifierDescriptor;
import fr.lapetina.congress.gateway.domain.model.ResourceCollection;
import fr.lapetina.congress.gateway.domain.model.ResourceRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One row of the identifier grammar: an explicit segment pattern, the validator bound to each
 * placeholder, an optional sub-resource whitelist and the upstream endpoint template.
 *
 * <p>Patterns are written with the collection first, e.g.
 * {@code bill/{congress}/{billType}/{billNumber}}. A numeric placeholder only matches digits,
 * so {@code nomination/118/abc} is a shape mismatch rather than a validation failure.
 * When a whitelist is declared the route accepts exactly one optional trailing segment, which
 * must be one of the listed names; anything else is a mismatch.
 */
public final class ResourceRoute {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z][A-Za-z0-9]*)}");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final ResourceCollection collection;
    private final String pattern;
    private final List<Segment> segments;
    private final Map<String, FieldBinding> bindings;
    private final List<String> subResources;
    private final String impliedSubResource;
    private final String endpointTemplate;
    private final boolean appendSubResource;
    private final List<RouteCheck> checks;

    private ResourceRoute(Builder builder) {
        this.collection = builder.collection;
        this.pattern = builder.pattern;
        this.segments = List.copyOf(builder.segments);
        this.bindings = Map.copyOf(builder.bindings);
        this.subResources = List.copyOf(builder.subResources);
        this.impliedSubResource = builder.impliedSubResource;
        this.endpointTemplate = builder.endpointTemplate;
        this.appendSubResource = builder.appendSubResource;
        this.checks = List.copyOf(builder.checks);
    }

    public static Builder builder(ResourceCollection collection, String pattern) {
        return new Builder(collection, pattern);
    }

    public ResourceCollection getCollection() {
        return collection;
    }

    public List<String> getSubResources() {
        return subResources;
    }

    /**
     * True when the route takes an optional trailing sub-resource segment.
     */
    public boolean acceptsSubResources() {
        return !subResources.isEmpty();
    }

    /**
     * Matches the descriptor's segments against this route's shape. No validator runs here.
     */
    public Optional<Match> match(IdentifierDescriptor descriptor) {
        if (!collection.getTag().equals(descriptor.collection())) {
            return Optional.empty();
        }

        List<String> actual = descriptor.segments();
        int fixed = segments.size();
        boolean withSub = acceptsSubResources() && actual.size() == fixed + 1;
        if (actual.size() != fixed && !withSub) {
            return Optional.empty();
        }

        Map<String, String> captures = new LinkedHashMap<>();
        for (int i = 0; i < fixed; i++) {
            Segment expected = segments.get(i);
            String value = actual.get(i);
            if (expected.isLiteral()) {
                if (!expected.literal().equalsIgnoreCase(value)) {
                    return Optional.empty();
                }
            } else {
                FieldBinding binding = bindings.get(expected.placeholder());
                if (binding.numeric() && !DIGITS.matcher(value).matches()) {
                    return Optional.empty();
                }
                captures.put(expected.placeholder(), value);
            }
        }

        String subResource = impliedSubResource;
        if (withSub) {
            String candidate = actual.get(fixed).toLowerCase(Locale.ROOT);
            if (!subResources.contains(candidate)) {
                return Optional.empty();
            }
            subResource = candidate;
        }

        return Optional.of(new Match(this, captures, subResource));
    }

    /**
     * Runs each placeholder validator in pattern order, then the cross-field checks,
     * and renders the upstream endpoint.
     */
    ResourceRequest bind(IdentifierDescriptor descriptor, Match match, Map<String, String> forwardedQuery) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (Segment segment : segments) {
            if (segment.isLiteral()) {
                continue;
            }
            FieldBinding binding = bindings.get(segment.placeholder());
            params.put(binding.name(), binding.validator().apply(match.captures().get(binding.name())));
        }

        for (RouteCheck check : checks) {
            check.apply(params, match.subResource());
        }

        String endpoint = render(endpointTemplate, params);
        if (appendSubResource && match.subResource() != null) {
            endpoint = endpoint + "/" + match.subResource();
        }

        return new ResourceRequest(
                descriptor.identifier(),
                collection,
                params,
                match.subResource(),
                endpoint,
                forwardedQuery
        );
    }

    private String render(String template, Map<String, Object> params) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            Object value = params.get(name);
            if (value == null) {
                throw new IllegalStateException(
                        "Endpoint template " + template + " references unbound field: " + name);
            }
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value.toString()));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    @Override
    public String toString() {
        return acceptsSubResources()
                ? pattern + "[/" + String.join("|", subResources) + "]"
                : pattern;
    }

    // ==================== NESTED TYPES ====================

    /**
     * Result of a successful shape match.
     */
    public record Match(ResourceRoute route, Map<String, String> captures, String subResource) {
        public Match {
            captures = Map.copyOf(captures);
        }
    }

    /**
     * Cross-field rule run after every placeholder has been validated. May add derived values
     * to {@code params}.
     */
    @FunctionalInterface
    public interface RouteCheck {
        void apply(Map<String, Object> params, String subResource);
    }

    private record Segment(String literal, String placeholder) {
        boolean isLiteral() {
            return literal != null;
        }
    }

    private record FieldBinding(String name, boolean numeric, Function<String, Object> validator) {
    }

    public static final class Builder {
        private final ResourceCollection collection;
        private final String pattern;
        private final List<Segment> segments = new ArrayList<>();
        private final Map<String, FieldBinding> bindings = new LinkedHashMap<>();
        private final List<String> subResources = new ArrayList<>();
        private final List<RouteCheck> checks = new ArrayList<>();
        private String impliedSubResource;
        private String endpointTemplate;
        private boolean appendSubResource = true;

        private Builder(ResourceCollection collection, String pattern) {
            this.collection = Objects.requireNonNull(collection, "Collection is required");
            this.pattern = Objects.requireNonNull(pattern, "Pattern is required");

            String[] parts = pattern.split("/");
            if (!parts[0].equals(collection.getTag())) {
                throw new IllegalArgumentException(
                        "Pattern " + pattern + " must start with collection " + collection.getTag());
            }
            for (int i = 1; i < parts.length; i++) {
                Matcher m = PLACEHOLDER.matcher(parts[i]);
                if (m.matches()) {
                    segments.add(new Segment(null, m.group(1)));
                } else {
                    segments.add(new Segment(parts[i], null));
                }
            }
        }

        /**
         * Binds a placeholder that only matches digits.
         */
        public Builder numeric(String name, Function<String, ?> validator) {
            return bind(name, true, validator);
        }

        /**
         * Binds a placeholder that matches any single segment.
         */
        public Builder text(String name, Function<String, ?> validator) {
            return bind(name, false, validator);
        }

        public Builder subResources(String... names) {
            for (String name : names) {
                subResources.add(name.toLowerCase(Locale.ROOT));
            }
            return this;
        }

        /**
         * Names the sub-resource a fixed-shape route stands for, e.g. {@code nominee}.
         */
        public Builder impliedSubResource(String name) {
            this.impliedSubResource = name;
            return this;
        }

        public Builder endpoint(String template) {
            this.endpointTemplate = template;
            return this;
        }

        /**
         * Endpoint already encodes the sub-resource; do not append it.
         */
        public Builder endpointIncludesSubResource() {
            this.appendSubResource = false;
            return this;
        }

        public Builder check(RouteCheck check) {
            checks.add(check);
            return this;
        }

        public ResourceRoute build() {
            if (endpointTemplate == null || !endpointTemplate.startsWith("/")) {
                throw new IllegalStateException("Route " + pattern + " needs an endpoint starting with '/'");
            }
            for (Segment segment : segments) {
                if (!segment.isLiteral() && !bindings.containsKey(segment.placeholder())) {
                    throw new IllegalStateException(
                            "Route " + pattern + " has no validator for {" + segment.placeholder() + "}");
                }
            }
            if (!subResources.isEmpty() && impliedSubResource != null) {
                throw new IllegalStateException(
                        "Route " + pattern + " cannot have both a whitelist and an implied sub-resource");
            }
            return new ResourceRoute(this);
        }

        @SuppressWarnings("unchecked")
        private Builder bind(String name, boolean numeric, Function<String, ?> validator) {
            bindings.put(name, new FieldBinding(name, numeric, (Function<String, Object>) validator));
            return this;
        }
    }
}
