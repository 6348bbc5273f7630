package com.ryuqq.resilience.testkit.support;

import com.ryuqq.resilience.core.time.AsyncSleeper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Cooperative sleeper whose delays only elapse when the test says so.
 *
 * <p>Each {@link #sleep(long)} returns a pending future. {@link #advance(long)} completes
 * every future whose deadline has been reached; {@link #fireAll()} completes all of them.
 * Futures are completed on the calling test thread, outside of the internal lock.</p>
 *
 * <p>Sleeps cancelled by their caller are dropped and never counted as pending or fired.</p>
 *
 * <p>Useful for async pool timeouts: a waiter can be left queued, inspected, and then
 * timed out at an exact moment.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ManualAsyncSleeper implements AsyncSleeper {

    private record Pending(long dueMillis, long requestedMillis, CompletableFuture<Void> future) {
    }

    private final List<Pending> pending = new ArrayList<>();
    private long nowMillis;

    @Override
    public synchronized CompletableFuture<Void> sleep(long millis) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        pending.add(new Pending(nowMillis + Math.max(0, millis), millis, future));
        return future;
    }

    /**
     * Advances the manual clock and fires every sleep that became due.
     *
     * @param millis milliseconds to advance
     * @return number of sleeps fired
     */
    public int advance(long millis) {
        List<CompletableFuture<Void>> due = new ArrayList<>();
        synchronized (this) {
            nowMillis += millis;
            Iterator<Pending> iterator = pending.iterator();
            while (iterator.hasNext()) {
                Pending next = iterator.next();
                if (next.future().isDone()) {
                    iterator.remove();
                } else if (next.dueMillis() <= nowMillis) {
                    due.add(next.future());
                    iterator.remove();
                }
            }
        }
        due.forEach(future -> future.complete(null));
        return due.size();
    }

    /**
     * Fires every pending sleep regardless of its deadline.
     *
     * @return number of sleeps fired
     */
    public int fireAll() {
        List<CompletableFuture<Void>> due = new ArrayList<>();
        synchronized (this) {
            for (Pending next : pending) {
                if (!next.future().isDone()) {
                    due.add(next.future());
                }
            }
            pending.clear();
        }
        due.forEach(future -> future.complete(null));
        return due.size();
    }

    /**
     * Returns the number of sleeps that have not fired yet.
     *
     * @return pending sleep count
     */
    public synchronized int pendingCount() {
        pending.removeIf(next -> next.future().isDone());
        return pending.size();
    }

    /**
     * Returns the requested durations of the sleeps that have not fired yet.
     *
     * @return pending delays in milliseconds, in request order
     */
    public synchronized List<Long> pendingDelays() {
        pending.removeIf(next -> next.future().isDone());
        List<Long> delays = new ArrayList<>();
        for (Pending next : pending) {
            delays.add(next.requestedMillis());
        }
        return delays;
    }
}
