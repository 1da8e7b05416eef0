package com.artistreach.enrichment.http;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget for one entity run. Blocking calls consult it so a hung downstream service
 * cannot hold the batch past the deadline.
 */
public class RunDeadline {
    private final Clock clock;
    private final Instant deadline;
    private final String label;

    public RunDeadline(Clock clock, Duration budget, String label) {
        this.clock = clock;
        this.deadline = clock.instant().plus(budget);
        this.label = label;
    }

    public static RunDeadline after(Duration budget, String label) {
        return new RunDeadline(Clock.systemUTC(), budget, label);
    }

    public Instant deadline() {
        return deadline;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public void checkDeadline() {
        if (isExpired()) {
            throw new RunDeadlineExceededException("deadline_exceeded for " + label);
        }
    }

    /**
     * Shrinks {@code requested} so a single call never outlives the run.
     */
    public Duration cap(Duration requested) {
        Duration remaining = remaining();
        if (remaining.compareTo(requested) < 0) {
            return remaining.isZero() ? Duration.ofMillis(1) : remaining;
        }
        return requested;
    }
}
