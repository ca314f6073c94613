package io.ragent.core.agent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-scoped cancellation flag with an optional deadline. Observed before every gateway and
 * tool invocation and while waiting on them.
 */
public final class CancellationSignal {
    private static final long POLL_MILLIS = 25;

    private final Clock clock;
    private final Instant deadline;
    private final AtomicReference<String> reason = new AtomicReference<>();

    private CancellationSignal(Clock clock, Instant deadline) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.deadline = deadline;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(Clock.systemUTC(), null);
    }

    public static CancellationSignal withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static CancellationSignal withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return new CancellationSignal(clock, null);
        }
        return new CancellationSignal(clock, clock.instant().plus(timeout));
    }

    public void cancel(String why) {
        reason.compareAndSet(null, why == null || why.isBlank() ? "cancelled" : why);
    }

    public boolean isCancelled() {
        if (reason.get() != null) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            reason.compareAndSet(null, "run deadline exceeded");
            return true;
        }
        return false;
    }

    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException(reason());
        }
    }

    /**
     * Waits for {@code future}, abandoning it (best-effort interrupt) once the signal fires.
     * Failures of the task itself surface as {@link ExecutionException}.
     */
    public <T> T await(Future<T> future) throws ExecutionException {
        while (true) {
            if (isCancelled()) {
                future.cancel(true);
                throw new RunCancelledException(reason());
            }
            try {
                return future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException ignored) {
                // poll again
            } catch (CancellationException e) {
                throw new RunCancelledException("task was cancelled");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                cancel("interrupted");
                throw new RunCancelledException(reason());
            }
        }
    }
}
