package net.clusterpool.core.spi;

import java.util.Map;

public interface MetricsSink {
    void recordCount(String name, Map<String, String> tags);
}
