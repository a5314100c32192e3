package io.rockmap.core.pool;

import io.micrometer.core.instrument.Timer;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.rockmap.core.error.PoolPanicException;
import io.rockmap.core.error.StorageException;
import io.rockmap.core.metrics.StorageMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed set of worker threads that run blocking engine calls.
 *
 * Each dispatch is handed back as a CompletableFuture. The queue is bounded:
 * when it is full the submitting thread waits for room instead of the queue
 * growing. Cancelling a returned future removes the dispatch if it has not
 * started; a running dispatch finishes and its result is dropped.
 */
public final class Pool implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Pool.class.getName());

    public static final int MAX_WORKERS = 1024;
    public static final int MAX_QUEUE = 65_536;
    private static final long SHUTDOWN_WAIT_MS = 10_000L;

    private final String name;
    private final int workers;
    private final BlockingQueue<Runnable> queue;
    private final ThreadPoolExecutor executor;
    private volatile boolean closed;

    public Pool(String name, int workers, int queueMultiplier) {
        this.name = name;
        this.workers = Math.max(1, Math.min(workers, MAX_WORKERS));
        int capacity = (int) Math.max(1L, Math.min((long) this.workers * Math.max(1, queueMultiplier), MAX_QUEUE));
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.executor = new ThreadPoolExecutor(
                this.workers,
                this.workers,
                0L,
                TimeUnit.MILLISECONDS,
                queue,
                new DefaultThreadFactory(name, true),
                new WaitForRoom()
        );
        StorageMetrics.bindQueue(name, queue);
        LOG.fine("Pool " + name + " started with " + this.workers + " workers, queue capacity " + capacity);
    }

    /**
     * Runs {@code task} on a worker. StorageExceptions thrown by the task fail the
     * future as-is; anything else escaping the task becomes a PoolPanicException.
     * The calling thread blocks until the queue has room; never call this from a
     * worker of the same pool.
     */
    public <T> CompletableFuture<T> execute(String what, Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (closed) {
            result.completeExceptionally(new PoolPanicException("pool " + name + " is shut down"));
            return result;
        }
        Dispatch<T> dispatch = new Dispatch<>(what, task, result);
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                executor.remove(dispatch);
            }
        });
        StorageMetrics.recordDispatch();
        try {
            executor.execute(dispatch);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new PoolPanicException("pool " + name + " rejected " + what, e));
        }
        return result;
    }

    public String name() { return name; }

    public int workers() { return workers; }

    /** Dispatches waiting for a worker. */
    public int queued() { return queue.size(); }

    public boolean isClosed() { return closed; }

    /** Stops accepting work and waits for running dispatches to finish. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                LOG.warning("Pool " + name + " workers still busy after " + SHUTDOWN_WAIT_MS + "ms; abandoning them");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        List<Runnable> stranded = new ArrayList<>();
        queue.drainTo(stranded);
        for (Runnable r : stranded) {
            if (r instanceof Dispatch<?> d) {
                d.abandon();
            }
        }
        LOG.fine("Pool " + name + " stopped");
    }

    private final class Dispatch<T> implements Runnable {
        private final String what;
        private final Supplier<T> task;
        private final CompletableFuture<T> result;

        Dispatch(String what, Supplier<T> task, CompletableFuture<T> result) {
            this.what = what;
            this.task = task;
            this.result = result;
        }

        @Override
        public void run() {
            if (result.isDone()) {
                return; // cancelled while queued
            }
            Timer.Sample sample = StorageMetrics.startExecution();
            try {
                result.complete(task.get());
            } catch (StorageException e) {
                result.completeExceptionally(e);
            } catch (RuntimeException | Error e) {
                StorageMetrics.recordPanic();
                LOG.log(Level.WARNING, "Dispatch " + what + " on pool " + name + " panicked", e);
                result.completeExceptionally(new PoolPanicException(what + " panicked", e));
            } finally {
                StorageMetrics.stopExecution(sample);
            }
        }

        void abandon() {
            result.completeExceptionally(new PoolPanicException("pool " + name + " shut down before " + what + " ran"));
        }
    }

    private static final class WaitForRoom implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("pool is shut down");
            }
            try {
                executor.getQueue().put(r);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RejectedExecutionException("interrupted while waiting for queue space", e);
            }
        }
    }
}
