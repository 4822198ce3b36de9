package io.marcfilter.metrics;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String INPUT_RATE = "pipeline.input.rate";
    public static final String MATCH_RATE = "pipeline.match.rate";
    public static final String OUTPUT_RATE = "pipeline.output.rate";
    public static final String ERROR_RATE = "pipeline.error.rate";
    public static final String SOURCE_TIME = "pipeline.source.time";
    public static final String FILTER_TIME = "pipeline.filter.time";
    public static final String TRANSFORM_TIME = "pipeline.transform.time";
    public static final String SINK_TIME = "pipeline.sink.time";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
}
