package com.unhuman.nordnetportfolio.core;

import okhttp3.Call;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation signal for one login attempt. Cancelling wakes any {@link #await(long)} at once
 * and cancels HTTP calls that are in flight, which releases their connections.
 */
public class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Set<Call> activeCalls = ConcurrentHashMap.newKeySet();

    public void cancel() {
        cancelled.countDown();
        for (Call call : activeCalls) {
            call.cancel();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw AuthFlowException.cancelled();
        }
    }

    /**
     * Waits up to {@code millis} for cancellation.
     *
     * @return true if the token was cancelled before the time ran out
     */
    public boolean await(long millis) throws InterruptedException {
        return cancelled.await(millis, TimeUnit.MILLISECONDS);
    }

    void register(Call call) {
        activeCalls.add(call);
        if (isCancelled()) {
            call.cancel();
        }
    }

    void unregister(Call call) {
        activeCalls.remove(call);
    }

    int activeCallCount() {
        return activeCalls.size();
    }
}
