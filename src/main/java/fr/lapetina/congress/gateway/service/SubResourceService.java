package fr.lapetina.congress.gateway.service;

import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.identifier.IdentifierDispatcher;
import fr.lapetina.congress.gateway.domain.model.ErrorKind;
import fr.lapetina.congress.gateway.domain.model.ResourceCollection;
import fr.lapetina.congress.gateway.domain.model.ResourceRequest;
import fr.lapetina.congress.gateway.domain.model.SubResourceRequest;
import fr.lapetina.congress.gateway.domain.validation.ParameterValidator;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns {@code (parentUri, subResource)} into a resolved request for {@code parentUri/subResource}.
 * The parent must be a base entity identifier; the sub-resource must be in that entity's whitelist.
 */
public class SubResourceService {

    static final Set<ResourceCollection> PARENT_COLLECTIONS = EnumSet.of(
            ResourceCollection.BILL,
            ResourceCollection.MEMBER,
            ResourceCollection.COMMITTEE,
            ResourceCollection.AMENDMENT,
            ResourceCollection.NOMINATION,
            ResourceCollection.TREATY);

    private final IdentifierDispatcher dispatcher;
    private final ParameterValidator validator;

    public SubResourceService(IdentifierDispatcher dispatcher, ParameterValidator validator) {
        this.dispatcher = dispatcher;
        this.validator = validator;
    }

    public ResourceRequest resolve(SubResourceRequest request) {
        if (request.subResource() == null || request.subResource().isBlank()) {
            throw CongressApiException.invalidParameter("subResource is required");
        }
        ResourceRequest parent = resolveParent(request.parentUri());

        List<String> allowed = dispatcher.getRoutes().subResourcesFor(parent.collection());
        String subResource = request.subResource().trim().toLowerCase(Locale.ROOT);
        if (!allowed.contains(subResource)) {
            throw CongressApiException.invalidParameter(
                    "Invalid subResource '" + request.subResource() + "' for parent type '"
                            + parent.collection().getTag() + "'. Valid options: " + String.join(", ", allowed));
        }

        Integer limit = validator.pageLimit(request.limit());
        Integer offset = validator.pageOffset(request.offset());

        ResourceRequest resolved;
        try {
            resolved = dispatcher.resolve(childUri(request.parentUri().trim(), subResource));
        } catch (CongressApiException e) {
            // Listing shapes such as member/state/CA resolve as parents but take no sub-resource
            if (e.getKind() == ErrorKind.INVALID_IDENTIFIER) {
                throw CongressApiException.invalidParameter(
                        "Invalid parentUri format or structure: " + request.parentUri()
                                + ". It does not accept sub-resources");
            }
            throw e;
        }
        if (limit == null && offset == null) {
            return resolved;
        }

        Map<String, String> query = new LinkedHashMap<>(resolved.query());
        if (limit != null) {
            query.put("limit", limit.toString());
        }
        if (offset != null) {
            query.put("offset", offset.toString());
        }
        return new ResourceRequest(resolved.identifier(), resolved.collection(), resolved.params(),
                resolved.subResource(), resolved.endpoint(), query);
    }

    private ResourceRequest resolveParent(String parentUri) {
        if (parentUri == null || parentUri.isBlank()) {
            throw CongressApiException.invalidParameter("parentUri is required");
        }
        ResourceRequest parent;
        try {
            parent = dispatcher.resolve(parentUri);
        } catch (CongressApiException e) {
            throw CongressApiException.invalidParameter(
                    "Invalid parentUri format or structure: " + parentUri + ". " + e.getMessage());
        }
        if (!PARENT_COLLECTIONS.contains(parent.collection()) || parent.subResource() != null) {
            throw CongressApiException.invalidParameter(
                    "Invalid parentUri format or structure: " + parentUri
                            + ". Expected a bill, member, committee, amendment, nomination or treaty identifier");
        }
        return parent;
    }

    /**
     * Inserts the sub-resource before any query string.
     */
    private static String childUri(String parentUri, String subResource) {
        int query = parentUri.indexOf('?');
        if (query < 0) {
            return parentUri + "/" + subResource;
        }
        return parentUri.substring(0, query) + "/" + subResource + parentUri.substring(query);
    }
}
