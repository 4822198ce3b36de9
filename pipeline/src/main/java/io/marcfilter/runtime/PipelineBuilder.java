package io.marcfilter.runtime;

import com.codahale.metrics.MetricRegistry;
import io.marcfilter.config.PipelineConfig;
import io.marcfilter.core.RecordFilter;
import io.marcfilter.core.Sink;
import io.marcfilter.core.Source;
import io.marcfilter.core.Transform;
import io.marcfilter.error.ErrorSink;
import io.marcfilter.metrics.Metrics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class PipelineBuilder<I, O> {
    public static final String DEFAULT_OUTPUT = "default";

    private Source<I> source;
    private final List<Branch<I, O>> branches = new ArrayList<>();
    private RecordFilter<I> filter = RecordFilter.acceptAll();
    private Transform<I, O> transform;
    private Sink<O> sink;
    private long limit = 0;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private ErrorSink errorSink = ErrorSink.NOOP;
    private PipelineConfig config = PipelineConfig.DEFAULTS;

    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> filter(RecordFilter<I> f) { this.filter = f; return this; }
    public PipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public PipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> limit(long n) { this.limit = n; return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public PipelineBuilder<I, O> errorSink(ErrorSink e) { this.errorSink = e; return this; }
    public PipelineBuilder<I, O> config(PipelineConfig c) { this.config = c; return this; }

    /** Adds a named output next to (or instead of) the single output set via filter/transform/sink. */
    public PipelineBuilder<I, O> branch(Branch<I, O> b) { this.branches.add(b); return this; }

    public PipelineBuilder<I, O> branch(String name, RecordFilter<I> f, Transform<I, O> t, Sink<O> s, long max) {
        return branch(new Branch<>(name, f, t, s, max));
    }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        List<Branch<I, O>> all = new ArrayList<>();
        if (sink != null) {
            Objects.requireNonNull(transform, "transform");
            all.add(new Branch<>(DEFAULT_OUTPUT, filter, transform, sink, limit));
        }
        all.addAll(branches);
        if (all.isEmpty()) throw new IllegalStateException("No output configured");
        Set<String> names = new HashSet<>();
        for (Branch<I, O> b : all) {
            if (!names.add(b.name())) throw new IllegalStateException("Duplicate output name: " + b.name());
        }
        return new Pipeline<>(source, all, new Metrics(metricRegistry), errorSink, config);
    }
}
