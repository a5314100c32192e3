package io.rockmap.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.BlockingQueue;

public final class StorageMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter dispatches = registry.counter("db.pool.dispatches");
    private static final Counter panics = registry.counter("db.pool.panics");
    private static final Timer execution = Timer.builder("db.pool.execution")
            .description("Time spent running blocking engine calls on pool workers")
            .register(registry);
    private static final Counter notifications = registry.counter("db.watch.notifications");
    private static final Counter corkCommits = registry.counter("db.cork.commits");
    private static final DistributionSummary corkSize = DistributionSummary.builder("db.cork.operations")
            .baseUnit("operations")
            .description("Operations applied per committed cork")
            .register(registry);

    private StorageMetrics() {}

    public static void recordDispatch() {
        dispatches.increment();
    }

    public static void recordPanic() {
        panics.increment();
    }

    public static Timer.Sample startExecution() {
        return Timer.start(registry);
    }

    public static void stopExecution(Timer.Sample sample) {
        sample.stop(execution);
    }

    public static void recordNotifications(int woken) {
        if (woken > 0) {
            notifications.increment(woken);
        }
    }

    public static void recordCorkCommit(int operations) {
        corkCommits.increment();
        corkSize.record(operations);
    }

    /** Publishes the pool's current queue depth, replacing the gauge of an earlier pool of the same name. */
    public static void bindQueue(String poolName, BlockingQueue<?> queue) {
        Gauge previous = registry.find("db.pool.queue.depth").tag("pool", poolName).gauge();
        if (previous != null) {
            registry.remove(previous);
        }
        Gauge.builder("db.pool.queue.depth", queue, BlockingQueue::size)
                .tag("pool", poolName)
                .description("Dispatches waiting for a pool worker")
                .register(registry);
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
