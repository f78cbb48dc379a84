package fr.lapetina.congress.gateway.infrastructure.ratelimit;

import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Rolling-window admission control for upstream calls.
 *
 * Holds the timestamps of admitted calls in the last {@code windowHours}. A call is admitted
 * only while fewer than {@code maxRequests} timestamps remain after pruning. Prune, check and
 * reserve happen under one lock, so no window ever holds more than {@code maxRequests} entries
 * regardless of how many threads call {@link #acquire()}.
 *
 * A reservation that is not followed by a successful call must be handed back with
 * {@link #cancel(Reservation)}.
 */
public final class AdmissionWindow {

    private static final Logger log = LoggerFactory.getLogger(AdmissionWindow.class);

    // Threshold for warning about approaching the budget (fraction used)
    private static final double BUDGET_WARNING_THRESHOLD = 0.9;

    private final Clock clock;
    private final Deque<Instant> timestamps = new ArrayDeque<>();

    private int maxRequests;
    private Duration window;
    private boolean budgetWarningLogged;

    public AdmissionWindow(int maxRequests, int windowHours) {
        this(maxRequests, windowHours, Clock.systemUTC());
    }

    public AdmissionWindow(int maxRequests, int windowHours, Clock clock) {
        checkLimits(maxRequests, windowHours);
        this.maxRequests = maxRequests;
        this.window = Duration.ofHours(windowHours);
        this.clock = clock;
        log.info("AdmissionWindow initialized: maxRequests={}, windowHours={}", maxRequests, windowHours);
    }

    /**
     * Reserves a slot for one upstream call.
     *
     * @throws CongressApiException of kind {@code RATE_LIMIT_EXCEEDED} when the window is full
     */
    public synchronized Reservation acquire() {
        Instant now = clock.instant();
        prune(now);
        if (timestamps.size() >= maxRequests) {
            log.warn("Admission rejected: recorded={}, maxRequests={}, resetTime={}",
                    timestamps.size(), maxRequests, timestamps.peekFirst().plus(window));
            throw CongressApiException.rateLimitExceeded("Congress.gov API rate limit exceeded (pre-check)");
        }
        timestamps.addLast(now);
        checkBudgetThreshold();
        return new Reservation(now);
    }

    /**
     * Returns a slot whose call did not succeed. A reservation already pruned is ignored.
     */
    public synchronized void cancel(Reservation reservation) {
        if (reservation != null && timestamps.removeLastOccurrence(reservation.admittedAt())) {
            log.debug("Reservation cancelled: admittedAt={}, recorded={}", reservation.admittedAt(), timestamps.size());
        }
    }

    /**
     * Pure check, records nothing.
     */
    public synchronized boolean canAdmit() {
        prune(clock.instant());
        return timestamps.size() < maxRequests;
    }

    /**
     * Records one call without checking the budget.
     */
    public synchronized void record() {
        timestamps.addLast(clock.instant());
    }

    public synchronized int remaining() {
        prune(clock.instant());
        return Math.max(0, maxRequests - timestamps.size());
    }

    /**
     * When the oldest recorded call leaves the window, or empty if nothing is recorded.
     */
    public synchronized Optional<Instant> resetTime() {
        prune(clock.instant());
        Instant oldest = timestamps.peekFirst();
        return oldest == null ? Optional.empty() : Optional.of(oldest.plus(window));
    }

    public synchronized int recordedCount() {
        prune(clock.instant());
        return timestamps.size();
    }

    public synchronized int getMaxRequests() {
        return maxRequests;
    }

    public synchronized int getWindowHours() {
        return (int) window.toHours();
    }

    /**
     * Applies new limits. Already recorded calls are kept and count against the new limit.
     */
    public synchronized void updateLimits(int maxRequests, int windowHours) {
        checkLimits(maxRequests, windowHours);
        if (maxRequests != this.maxRequests || windowHours != getWindowHours()) {
            log.info("AdmissionWindow limits updated: maxRequests={} -> {}, windowHours={} -> {}",
                    this.maxRequests, maxRequests, getWindowHours(), windowHours);
        }
        this.maxRequests = maxRequests;
        this.window = Duration.ofHours(windowHours);
        this.budgetWarningLogged = false;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }

    private void checkBudgetThreshold() {
        double utilization = (double) timestamps.size() / maxRequests;
        if (utilization >= BUDGET_WARNING_THRESHOLD && !budgetWarningLogged) {
            log.warn("Approaching upstream request budget: recorded={}/{} ({}%)",
                    timestamps.size(), maxRequests, (int) (utilization * 100));
            budgetWarningLogged = true;
        } else if (utilization < BUDGET_WARNING_THRESHOLD * 0.9) {
            budgetWarningLogged = false;
        }
    }

    private static void checkLimits(int maxRequests, int windowHours) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0: " + maxRequests);
        }
        if (windowHours <= 0) {
            throw new IllegalArgumentException("windowHours must be > 0: " + windowHours);
        }
    }

    /**
     * Token for one admitted call.
     */
    public record Reservation(Instant admittedAt) {
    }
}
