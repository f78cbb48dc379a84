package fr.lapetina.congress.gateway.domain.model;

/**
 * Closed error taxonomy for gateway requests.
 * Every failure surfaced by the gateway carries exactly one of these kinds.
 */
public enum ErrorKind {
    /** No identifier pattern matched the supplied string */
    INVALID_IDENTIFIER(400, "INVALID_IDENTIFIER"),

    /** Identifier shape recognized but a field is out of range or malformed */
    INVALID_PARAMETER(400, "VALIDATION_ERROR"),

    /** Upstream reported the resource as absent (404, or 500 with "not found") */
    NOT_FOUND(404, "NOT_FOUND"),

    /** Local admission window is full, or upstream answered 429 */
    RATE_LIMIT_EXCEEDED(429, "RATE_LIMIT_EXCEEDED"),

    /** Any other non-2xx upstream status, or no response at all */
    UPSTREAM_API_ERROR(502, "API_ERROR"),

    /** Anything not anticipated above */
    INTERNAL_UNEXPECTED(500, "INTERNAL_ERROR");

    private final int httpStatus;
    private final String code;

    ErrorKind(int httpStatus, String code) {
        this.httpStatus = httpStatus;
        this.code = code;
    }

    /**
     * Default HTTP status for this kind. Upstream errors may override it with the upstream status.
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * Stable wire code used in API error bodies.
     */
    public String getCode() {
        return code;
    }

    public boolean isClientError() {
        return this == INVALID_IDENTIFIER || this == INVALID_PARAMETER;
    }
}
