package fr.lapetina.congress.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Snapshot of the admission window.
 *
 * @param resetTime when the oldest recorded call leaves the window; null when nothing is recorded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RateLimitStatus(int remaining, int maxRequests, int windowHours, int used, Instant resetTime) {
}
