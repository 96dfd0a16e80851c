package io.blockstore.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Request timers shared by the transports. HTTP exchanges are tagged by
 * method/path/status; decoded block store requests by transport, variant and
 * outcome (an error code's wire name, or "ok").
 */
public final class RequestMetrics {
    private static final MeterRegistry REGISTRY = StoreMetrics.registry();

    private RequestMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    public static void stopHttp(Timer.Sample sample, String method, String path, int status) {
        sample.stop(Timer.builder("http.server.requests")
                .description("HTTP exchange duration")
                .tags("method", method, "path", path, "status", Integer.toString(status))
                .register(REGISTRY));
    }

    public static void stopRequest(Timer.Sample sample, String transport, String variant, String outcome) {
        sample.stop(Timer.builder("blockstore.requests")
                .description("Block store request duration")
                .tags("transport", transport, "type", variant, "outcome", outcome)
                .register(REGISTRY));
    }
}
