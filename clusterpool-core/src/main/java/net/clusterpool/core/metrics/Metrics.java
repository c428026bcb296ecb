package net.clusterpool.core.metrics;

import net.clusterpool.core.spi.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Best-effort emission: a failing sink is logged and ignored. */
public final class Metrics {
    private static final Logger log = LoggerFactory.getLogger(Metrics.class);

    private Metrics() {}

    public static void recordQuietly(MetricsSink sink, MetricEvent event) {
        if (sink == null) return;
        try {
            sink.recordCount(event.name(), event.tags());
        } catch (RuntimeException e) {
            log.info("Unable to post {} metric with tags {} - msg: {}", event.name(), event.tags(), e.getMessage());
        }
    }
}
