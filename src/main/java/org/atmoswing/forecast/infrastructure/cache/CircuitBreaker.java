package org.atmoswing.forecast.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker guarding the external cache service.
 * <p>
 * CLOSED: the cache is used. After {@code failureThreshold} consecutive failures the breaker
 * opens until {@code now + cooldown}. While OPEN every caller bypasses the cache. Once the
 * cooldown has elapsed the first caller gets {@link Decision#PROBE} and must report the outcome
 * of a ping; callers arriving while the probe is in flight still bypass.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED, OPEN
    }

    public enum Decision {
        USE_CACHE, PROBE, BYPASS
    }

    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private Instant retryAt;
    private boolean probing;

    public CircuitBreaker(int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1");
        }
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public synchronized Decision acquire() {
        if (state == State.CLOSED) {
            return Decision.USE_CACHE;
        }
        if (probing || clock.instant().isBefore(retryAt)) {
            return Decision.BYPASS;
        }
        probing = true;
        return Decision.PROBE;
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
    }

    public synchronized void recordFailure() {
        if (state == State.OPEN) {
            return;
        }
        consecutiveFailures++;
        if (consecutiveFailures >= failureThreshold) {
            open();
        }
    }

    public synchronized void probeSucceeded() {
        probing = false;
        consecutiveFailures = 0;
        state = State.CLOSED;
        retryAt = null;
        log.info("[Cache] Breaker closed, cache service is back");
    }

    public synchronized void probeFailed() {
        probing = false;
        open();
    }

    public synchronized State state() {
        return state;
    }

    private void open() {
        state = State.OPEN;
        retryAt = clock.instant().plus(cooldown);
        log.warn("[Cache] Breaker open, bypassing cache until {}", retryAt);
    }
}
