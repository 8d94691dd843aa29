package com.example.orderdesk.infrastructure.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mints human-readable order references.
 * Query codes are {@code QUERY_} plus 8 random characters. Work codes are
 * {@code WORK_} plus a base-36 monotonic millisecond stamp plus 6 random characters.
 * Both may collide, so callers rely on the unique constraint and retry.
 */
@Component
public class ReferenceCodeGenerator {

    static final String QUERY_PREFIX = "QUERY_";
    static final String WORK_PREFIX = "WORK_";

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final AtomicLong lastMillis = new AtomicLong();

    public ReferenceCodeGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextQueryCode() {
        return QUERY_PREFIX + randomChars(8);
    }

    public String nextWorkCode() {
        long stamp = lastMillis.updateAndGet(previous -> Math.max(previous, clock.millis()));
        return WORK_PREFIX + Long.toString(stamp, 36).toUpperCase() + "_" + randomChars(6);
    }

    private String randomChars(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
