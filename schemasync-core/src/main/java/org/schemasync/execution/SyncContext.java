package org.schemasync.execution;

import org.schemasync.error.ErrorType;
import org.schemasync.error.SchemaSyncException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation token with an optional deadline, owned by whoever starts a run. The pipeline observes it at every
 * suspension point; it never terminates the process on its own.
 */
public final class SyncContext {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Instant deadline;
    private final Clock clock;

    private SyncContext(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /** No deadline; only explicit {@link #cancel()} stops it. */
    public static SyncContext background() {
        return new SyncContext(null, Clock.systemUTC());
    }

    public static SyncContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static SyncContext withTimeout(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            return new SyncContext(null, clock);
        }
        return new SyncContext(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left before the deadline, empty when there is none. Never negative.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * @throws SchemaSyncException INTERRUPTION when cancelled, TIMEOUT when the deadline has passed
     */
    public void checkActive() {
        if (isCancelled()) {
            throw canceled(null);
        }
        if (isExpired()) {
            throw timedOut();
        }
    }

    /**
     * Blocks for {@code delay}, returning early with an error if the context is cancelled, the deadline passes,
     * or the thread is interrupted.
     */
    public void await(Duration delay) {
        checkActive();
        long waitNanos = Math.max(0, delay.toNanos());
        boolean deadlineFirst = false;
        Optional<Duration> left = remaining();
        if (left.isPresent() && left.get().toNanos() < waitNanos) {
            waitNanos = left.get().toNanos();
            deadlineFirst = true;
        }
        try {
            if (cancelled.await(waitNanos, TimeUnit.NANOSECONDS)) {
                throw canceled(null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw canceled(e);
        }
        if (deadlineFirst) {
            throw timedOut();
        }
    }

    private static SchemaSyncException canceled(Throwable cause) {
        return new SchemaSyncException(ErrorType.INTERRUPTION, "Operation canceled", cause);
    }

    private static SchemaSyncException timedOut() {
        return new SchemaSyncException(ErrorType.TIMEOUT, "Operation timed out");
    }
}
