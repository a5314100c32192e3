package io.rockmap.core.keyspace;

import io.rockmap.core.metrics.StorageMetrics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Per-key wait/notify registry. A registered future completes the first time
 * its exact key is written after registration; cancelling it unregisters it.
 *
 * Writers wake waiters after the write is applied, so a waiter registered in
 * that gap is woken by a write that was already visible when it registered.
 * Treat a wake-up as "the key may have changed" and re-read it.
 */
public final class Watch {

    private final Map<Key, List<CompletableFuture<Void>>> waiters = new HashMap<>();

    public CompletableFuture<Void> register(byte[] key) {
        Key k = new Key(key.clone());
        CompletableFuture<Void> waiter = new CompletableFuture<>();
        synchronized (this) {
            waiters.computeIfAbsent(k, unused -> new ArrayList<>()).add(waiter);
        }
        waiter.whenComplete((v, err) -> {
            if (waiter.isCancelled()) {
                unregister(k, waiter);
            }
        });
        return waiter;
    }

    /** Completes and removes every waiter on {@code key}. Returns how many were woken. */
    public int wake(byte[] key) {
        List<CompletableFuture<Void>> woken;
        synchronized (this) {
            woken = waiters.remove(new Key(key));
        }
        if (woken == null) {
            return 0;
        }
        // completed outside the lock; dependants may run inline
        for (CompletableFuture<Void> waiter : woken) {
            waiter.complete(null);
        }
        StorageMetrics.recordNotifications(woken.size());
        return woken.size();
    }

    public synchronized int pending() {
        int n = 0;
        for (List<CompletableFuture<Void>> list : waiters.values()) {
            n += list.size();
        }
        return n;
    }

    private synchronized void unregister(Key key, CompletableFuture<Void> waiter) {
        List<CompletableFuture<Void>> list = waiters.get(key);
        if (list == null) {
            return;
        }
        list.remove(waiter);
        if (list.isEmpty()) {
            waiters.remove(key);
        }
    }

    private record Key(byte[] bytes) {
        @Override
        public boolean equals(Object o) {
            return o instanceof Key other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }
    }
}
