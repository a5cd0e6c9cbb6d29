package de.entwicklertraining.http.pipeline.cancellation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * The cancellation signal of a single request.
 * <p>
 * Every blocking point of the pipeline (admission gates, the backoff wait between
 * retry attempts, the transport call) observes the context of the request it is
 * working on and stops as soon as the context fires. A context fires at most once;
 * the first of {@link #cancel()} and deadline expiry decides the {@link RequestCancelledException.Reason}.
 * <p>
 * Example usage:
 * <pre>
 * CancellationContext context = CancellationContext.withTimeout(Duration.ofSeconds(5));
 * Request request = Request.newRequest("GET", "https://example.com/");
 * request.setContext(context);
 * </pre>
 */
public final class CancellationContext {

    private static final CancellationContext BACKGROUND = new CancellationContext(false);

    private static final ScheduledExecutorService DEADLINE_SCHEDULER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "http-pipeline-deadline");
        thread.setDaemon(true);
        return thread;
    });

    private final boolean cancellable;
    private final CountDownLatch done = new CountDownLatch(1);
    private final AtomicReference<RequestCancelledException.Reason> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile ScheduledFuture<?> deadlineTask;

    private CancellationContext(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Returns the context that never fires. Requests use it unless another context is set.
     *
     * @return the shared background context
     */
    public static CancellationContext background() {
        return BACKGROUND;
    }

    /**
     * Creates a context that fires only when {@link #cancel()} is called.
     *
     * @return a new cancellable context
     */
    public static CancellationContext cancellable() {
        return new CancellationContext(true);
    }

    /**
     * Creates a context that fires once the given timeout has elapsed, or earlier on {@link #cancel()}.
     *
     * @param timeout time until the deadline
     * @return a new context with a deadline
     * @throws IllegalArgumentException if timeout is null or negative
     */
    public static CancellationContext withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be a non-negative duration");
        }
        CancellationContext context = new CancellationContext(true);
        context.deadlineTask = DEADLINE_SCHEDULER.schedule(
                () -> context.fire(RequestCancelledException.Reason.DEADLINE_EXCEEDED),
                timeout.toNanos(), TimeUnit.NANOSECONDS);
        return context;
    }

    /**
     * Creates a context that fires at the given instant, or earlier on {@link #cancel()}.
     *
     * @param deadline the point in time at which the context fires
     * @return a new context with a deadline
     */
    public static CancellationContext withDeadline(Instant deadline) {
        Duration remaining = Duration.between(Instant.now(), deadline);
        return withTimeout(remaining.isNegative() ? Duration.ZERO : remaining);
    }

    /**
     * Cancels this context. Has no effect on the background context or on a context
     * that already fired.
     */
    public void cancel() {
        if (cancellable) {
            fire(RequestCancelledException.Reason.CANCELED);
        }
    }

    private void fire(RequestCancelledException.Reason cause) {
        if (!reason.compareAndSet(null, cause)) {
            return;
        }
        ScheduledFuture<?> task = deadlineTask;
        if (task != null) {
            task.cancel(false);
        }
        done.countDown();
        // remove() decides between this loop and a concurrent onCancel() who runs a listener
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
    }

    /**
     * Checks if this context has fired.
     *
     * @return true once the context was cancelled or its deadline passed
     */
    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * Gets the reason this context fired.
     *
     * @return the reason, or empty while the context is still live
     */
    public Optional<RequestCancelledException.Reason> getReason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * Creates the exception describing why this context fired.
     *
     * @return the cancellation exception
     * @throws IllegalStateException if the context has not fired
     */
    public RequestCancelledException toException() {
        RequestCancelledException.Reason cause = reason.get();
        if (cause == null) {
            throw new IllegalStateException("Context has not been cancelled");
        }
        return new RequestCancelledException(cause);
    }

    /**
     * Throws the cancellation exception if this context has fired.
     *
     * @throws RequestCancelledException if the context was cancelled or its deadline passed
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw toException();
        }
    }

    /**
     * Blocks until this context fires or the given duration elapses, whichever comes first.
     *
     * @param duration the maximum time to wait
     * @return true if the context fired, false if the duration elapsed first
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean await(Duration duration) throws InterruptedException {
        if (isCancelled()) {
            return true;
        }
        if (duration.isZero() || duration.isNegative()) {
            return false;
        }
        return done.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Registers a listener that runs once when this context fires. If the context has
     * already fired the listener runs immediately on the calling thread.
     *
     * @param listener the action to run on cancellation
     * @return a registration that removes the listener when closed
     */
    public Registration onCancel(Runnable listener) {
        if (!cancellable) {
            return () -> { };
        }
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Gets a supplier reporting whether this context has fired.
     *
     * @return a supplier returning true once the context fired
     */
    public Supplier<Boolean> asSupplier() {
        return this::isCancelled;
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        /**
         * Removes the listener. Safe to call more than once.
         */
        @Override
        void close();
    }
}
