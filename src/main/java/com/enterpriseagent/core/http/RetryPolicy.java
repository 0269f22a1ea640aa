package com.enterpriseagent.core.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Bounded retry with multiplicative backoff for calls to external services.
 * <p>
 * The delay before retry {@code n} (zero-based) is {@code initialDelay * multiplier^n}.
 * When every attempt fails the call degrades to {@link Optional#empty()} so the
 * caller can fall back to a safe default.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;

    public RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay == null ? Duration.ZERO : initialDelay;
        this.multiplier = multiplier;
    }

    public static RetryPolicy standard() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 1.5);
    }

    public <T> Optional<T> execute(String operation, Callable<T> call) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return Optional.ofNullable(call.call());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted on attempt {}", operation, attempt + 1);
                return Optional.empty();
            } catch (Exception e) {
                if (attempt + 1 >= maxAttempts) {
                    log.warn("{} failed after {} attempt(s): {}", operation, maxAttempts, rootMessage(e));
                    return Optional.empty();
                }
                long backoff = delayMillis(attempt);
                log.warn("{} failed on attempt {}, retrying in {} ms: {}",
                        operation, attempt + 1, backoff, rootMessage(e));
                if (!sleep(backoff)) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    long delayMillis(int attempt) {
        return (long) (initialDelay.toMillis() * Math.pow(multiplier, attempt));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
