package io.marcfilter.marc.job;

import io.marcfilter.config.PipelineConfig;
import io.marcfilter.core.Sink;
import io.marcfilter.error.ErrorSink;
import io.marcfilter.marc.codec.MarcRecordSource;
import io.marcfilter.marc.format.RecordFormat;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.predicate.MarcRecordFilter;
import io.marcfilter.marc.projection.FieldProjector;
import io.marcfilter.marc.projection.SelectionSpec;
import io.marcfilter.marc.sink.RecordStreamSink;
import io.marcfilter.runtime.Pipeline;
import io.marcfilter.runtime.PipelineBuilder;
import io.marcfilter.runtime.PipelineResult;
import io.marcfilter.sink.TeeSink;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stream-to-stream filtering: one input stream, a filter and selection in tree form, and one
 * already-open output stream per target format. The input is closed once read; output streams
 * are flushed and left open.
 */
public final class MarcFilter {

    private MarcFilter() { }

    public static PipelineResult run(InputStream in, Object filterSpec, Object selectionSpec,
                                     RecordFormat format, OutputStream out) throws IOException {
        Map<RecordFormat, OutputStream> targets = new LinkedHashMap<>();
        targets.put(format, out);
        return run(in, filterSpec, selectionSpec, targets, PipelineConfig.DEFAULTS.withLogEvery(0), ErrorSink.NOOP);
    }

    /**
     * @throws io.marcfilter.marc.predicate.SpecCompileException before anything is read, if a spec is invalid
     */
    public static PipelineResult run(InputStream in, Object filterSpec, Object selectionSpec,
                                     Map<RecordFormat, OutputStream> targets, PipelineConfig config,
                                     ErrorSink errorSink) throws IOException {
        MarcRecordFilter filter = MarcRecordFilter.compile(filterSpec);
        FieldProjector projector = new FieldProjector(SelectionSpec.parse(selectionSpec));
        List<RecordStreamSink> sinks = new ArrayList<>(targets.size());
        for (Map.Entry<RecordFormat, OutputStream> t : targets.entrySet()) {
            sinks.add(new RecordStreamSink(t.getValue(), t.getKey(), true, false));
        }
        Sink<MarcRecord> sink = sinks.size() == 1 ? sinks.get(0) : new TeeSink<>(sinks);
        try (Pipeline<MarcRecord, MarcRecord> pipeline = new PipelineBuilder<MarcRecord, MarcRecord>()
                .source(MarcRecordSource.of(in))
                .filter(filter)
                .transform(projector)
                .sink(sink)
                .errorSink(errorSink)
                .config(config)
                .build()) {
            return pipeline.run();
        }
    }
}
