package fr.lapetina.congress.gateway.infrastructure.http;

/**
 * Status and raw body of one upstream exchange.
 */
public record UpstreamResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
