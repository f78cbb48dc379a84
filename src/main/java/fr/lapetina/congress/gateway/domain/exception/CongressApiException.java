package fr.lapetina.congress.gateway.domain.exception;

import fr.lapetina.congress.gateway.domain.model.ErrorKind;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Single error type raised anywhere in the gateway.
 *
 * The {@link ErrorKind} discriminates the failure; callers switch on {@link #getKind()}
 * rather than on exception subclasses.
 */
public final class CongressApiException extends RuntimeException {

    private static final String REDACTED = "[REDACTED]";

    private final ErrorKind kind;
    private final Integer upstreamStatus;
    private final transient Object details;

    public CongressApiException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public CongressApiException(ErrorKind kind, String message, Integer upstreamStatus, Object details, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind is required");
        this.upstreamStatus = upstreamStatus;
        this.details = details;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Upstream HTTP status, 0 when no response was received, null when the error is local.
     */
    public Integer getUpstreamStatus() {
        return upstreamStatus;
    }

    public Object getDetails() {
        return details;
    }

    /**
     * HTTP status to surface at the transport boundary.
     */
    public int httpStatus() {
        if (kind == ErrorKind.UPSTREAM_API_ERROR && upstreamStatus != null
                && upstreamStatus >= 400 && upstreamStatus < 600) {
            return upstreamStatus;
        }
        return kind.getHttpStatus();
    }

    // ==================== FACTORIES ====================

    public static CongressApiException invalidIdentifier(String message) {
        return new CongressApiException(ErrorKind.INVALID_IDENTIFIER, message);
    }

    public static CongressApiException invalidParameter(String message) {
        return new CongressApiException(ErrorKind.INVALID_PARAMETER, message);
    }

    public static CongressApiException invalidParameter(String message, Object details) {
        return new CongressApiException(ErrorKind.INVALID_PARAMETER, message, null, details, null);
    }

    public static CongressApiException notFound(String message) {
        return new CongressApiException(ErrorKind.NOT_FOUND, message);
    }

    public static CongressApiException rateLimitExceeded(String message) {
        return new CongressApiException(ErrorKind.RATE_LIMIT_EXCEEDED, message);
    }

    public static CongressApiException rateLimitExceeded(String message, int upstreamStatus) {
        return new CongressApiException(ErrorKind.RATE_LIMIT_EXCEEDED, message, upstreamStatus, null, null);
    }

    public static CongressApiException upstream(String message, int upstreamStatus, Object details) {
        return new CongressApiException(ErrorKind.UPSTREAM_API_ERROR, message, upstreamStatus, details, null);
    }

    public static CongressApiException noResponse(String message, Throwable cause) {
        return new CongressApiException(ErrorKind.UPSTREAM_API_ERROR, message, 0, null, cause);
    }

    public static CongressApiException internal(String message, Throwable cause) {
        return new CongressApiException(ErrorKind.INTERNAL_UNEXPECTED, message, null, null, cause);
    }

    // ==================== HELPERS ====================

    /**
     * Unwraps async wrappers and coerces anything that is not already a gateway error
     * into {@link ErrorKind#INTERNAL_UNEXPECTED}.
     */
    public static CongressApiException from(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof CongressApiException gatewayError) {
            return gatewayError;
        }
        String message = current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
        return internal("Unexpected error: " + message, current);
    }

    /**
     * Replaces every occurrence of the credential in {@code text}.
     */
    public static String redact(String text, String credential) {
        if (text == null || credential == null || credential.isEmpty()) {
            return text;
        }
        return text.replace(credential, REDACTED);
    }
}
