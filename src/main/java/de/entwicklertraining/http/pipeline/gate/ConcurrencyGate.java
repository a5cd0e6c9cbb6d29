package de.entwicklertraining.http.pipeline.gate;

import de.entwicklertraining.http.pipeline.ExchangeCallback;
import de.entwicklertraining.http.pipeline.HttpPipelineClient;
import de.entwicklertraining.http.pipeline.Request;
import de.entwicklertraining.http.pipeline.Response;
import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds the number of requests in flight on one client.
 * <p>
 * {@link #enter(Request)} blocks until a slot is free or the request's context fires,
 * whichever happens first. Both outcomes are decided under one lock, so a request never
 * holds a slot after it was told it was cancelled. Every successful {@code enter} must be
 * paired with exactly one {@link #exit(Response, Throwable)}; the executor guarantees this.
 */
public final class ConcurrencyGate implements ExchangeCallback {
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();
    private int inFlight;

    /**
     * Creates a gate with the given number of slots.
     *
     * @param capacity the maximum number of concurrent requests (must be &gt;= 1)
     */
    public ConcurrencyGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    @Override
    public void enter(Request request) {
        CancellationContext context = request.getContext();
        // wakes waiters so they can observe the cancellation
        try (CancellationContext.Registration ignored = context.onCancel(this::signalAll)) {
            lock.lockInterruptibly();
            try {
                while (true) {
                    if (context.isCancelled()) {
                        // pass on a wake-up this waiter may have consumed
                        if (inFlight < capacity) {
                            slotFreed.signal();
                        }
                        throw context.toException();
                    }
                    if (inFlight < capacity) {
                        inFlight++;
                        return;
                    }
                    slotFreed.await();
                }
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpPipelineClient.HttpPipelineException("Interrupted while waiting for a request slot", e);
        }
    }

    @Override
    public void exit(Response response, Throwable error) {
        lock.lock();
        try {
            if (inFlight > 0) {
                inFlight--;
            }
            slotFreed.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the number of requests currently holding a slot.
     *
     * @return the in-flight count
     */
    public int inFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    private void signalAll() {
        lock.lock();
        try {
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
