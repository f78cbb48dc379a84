package fr.lapetina.congress.gateway.domain.identifier;

import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.model.IdentifierDescriptor;
import fr.lapetina.congress.gateway.domain.model.ResourceCollection;
import fr.lapetina.congress.gateway.domain.model.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves an identifier to a validated {@link ResourceRequest}.
 *
 * <p>Parsing, route selection and field validation all happen here, before any budget is
 * consumed or any network call is made. Shape mismatches are {@code INVALID_IDENTIFIER};
 * a matched shape with a bad field value is {@code INVALID_PARAMETER}.
 *
 * <p>Query parameters on the identifier are forwarded upstream, except the reserved
 * credential and format parameters which the HTTP client always sets itself.
 */
public class IdentifierDispatcher {

    private static final Logger log = LoggerFactory.getLogger(IdentifierDispatcher.class);

    static final Set<String> RESERVED_QUERY_PARAMS = Set.of("api_key", "format");

    private final IdentifierParser parser;
    private final ResourceRouteTable routes;

    public IdentifierDispatcher(ResourceRouteTable routes) {
        this(new IdentifierParser(), routes);
    }

    public IdentifierDispatcher(IdentifierParser parser, ResourceRouteTable routes) {
        this.parser = parser;
        this.routes = routes;
    }

    public ResourceRequest resolve(String identifier) {
        IdentifierDescriptor descriptor = parser.parse(identifier);

        ResourceCollection collection = ResourceCollection.fromTag(descriptor.collection())
                .orElseThrow(() -> CongressApiException.invalidIdentifier(
                        "Unknown resource collection '" + descriptor.collection() + "' in URI: " + identifier));

        List<ResourceRoute> candidates = routes.routesFor(collection);
        for (ResourceRoute route : candidates) {
            Optional<ResourceRoute.Match> match = route.match(descriptor);
            if (match.isPresent()) {
                ResourceRequest request = route.bind(descriptor, match.get(), forwardedQuery(descriptor));
                log.debug("Resolved {} via {} -> {}", identifier, route, request.endpoint());
                return request;
            }
        }

        throw CongressApiException.invalidIdentifier(
                "Invalid " + collection.getTag() + " resource URI format: " + identifier);
    }

    public ResourceRouteTable getRoutes() {
        return routes;
    }

    private static Map<String, String> forwardedQuery(IdentifierDescriptor descriptor) {
        Map<String, String> forwarded = new LinkedHashMap<>();
        descriptor.query().forEach((key, value) -> {
            if (RESERVED_QUERY_PARAMS.contains(key)) {
                log.debug("Dropping reserved query parameter '{}' from {}", key, descriptor.path());
            } else {
                forwarded.put(key, value);
            }
        });
        return forwarded;
    }
}
