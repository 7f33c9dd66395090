// file: core/src/main/java/io/tagvault/core/MutationClock.java
package io.tagvault.core;

import java.time.Clock;
import java.util.Objects;

/**
 * Source of mutation timestamps (epoch millis).
 * <p>
 * Guarantees that successive calls never go backwards, even if the
 * underlying wall clock is adjusted, and that a rewrite of an entity is
 * never stamped earlier than the version it replaces.
 */
public final class MutationClock {
    private final Clock clock;
    private long last = Long.MIN_VALUE;

    public MutationClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static MutationClock system() {
        return new MutationClock(Clock.systemUTC());
    }

    public synchronized long now() {
        last = Math.max(last, clock.millis());
        return last;
    }

    /** Timestamp for a write that replaces a version stamped {@code previous}. */
    public long nextAfter(long previous) {
        return Math.max(now(), previous);
    }
}
