package fr.lapetina.congress.gateway.domain.model;

/**
 * Request for a named sub-resource of a parent entity identifier.
 */
public record SubResourceRequest(String parentUri, String subResource, Integer limit, Integer offset) {

    public static SubResourceRequest of(String parentUri, String subResource) {
        return new SubResourceRequest(parentUri, subResource, null, null);
    }
}
