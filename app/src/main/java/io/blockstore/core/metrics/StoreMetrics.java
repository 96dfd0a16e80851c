package io.blockstore.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class StoreMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksAdded = registry.counter("blocks.added");
    private static final Counter blocksDuplicate = registry.counter("blocks.duplicate");
    private static final Counter forksDetected = registry.counter("forks.detected");
    private static final Counter transactionsAdded = registry.counter("transactions.added");
    private static final Counter transactionsDuplicate = registry.counter("transactions.duplicate");
    private static final Counter conflicts = registry.counter("store.conflicts");
    private static final Timer ancestryTime = registry.timer("ancestry.walk.time");
    private static final DistributionSummary ancestryLength = registry.summary("ancestry.walk.blocks");

    public static <T> T recordAncestry(Supplier<T> walk) {
        return ancestryTime.record(walk);
    }

    public static void ancestryReturned(int blocks) {
        ancestryLength.record(blocks);
    }

    public static void blockAdded(boolean duplicate, boolean forked) {
        if (duplicate) {
            blocksDuplicate.increment();
            return;
        }
        blocksAdded.increment();
        if (forked) {
            forksDetected.increment();
        }
    }

    public static void transactionAdded(boolean duplicate) {
        (duplicate ? transactionsDuplicate : transactionsAdded).increment();
    }

    public static void conflict() {
        conflicts.increment();
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
