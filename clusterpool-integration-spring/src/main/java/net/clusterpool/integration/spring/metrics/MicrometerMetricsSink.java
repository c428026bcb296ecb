package net.clusterpool.integration.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import net.clusterpool.core.spi.MetricsSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** One Micrometer counter per metric name and tag set. */
public final class MicrometerMetricsSink implements MetricsSink {
    private final MeterRegistry registry;

    public MicrometerMetricsSink(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordCount(String name, Map<String, String> tags) {
        List<Tag> t = new ArrayList<>(tags.size());
        tags.forEach((k, v) -> t.add(Tag.of(k, v)));
        Counter.builder(name).tags(t).register(registry).increment();
    }
}
