package net.clusterpool.core.metrics;

import net.clusterpool.core.spi.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/** Sink used when no metrics registry is wired: counters go to the log. */
public final class LoggingMetricsSink implements MetricsSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingMetricsSink.class);

    @Override
    public void recordCount(String name, Map<String, String> tags) {
        log.info("metric {} +1 {}", name, tags);
    }
}
