package io.marcfilter.marc.job;

import com.codahale.metrics.MetricRegistry;
import io.marcfilter.config.PipelineConfig;
import io.marcfilter.core.Sink;
import io.marcfilter.core.Source;
import io.marcfilter.error.ErrorSink;
import io.marcfilter.marc.codec.MarcRecordSource;
import io.marcfilter.marc.format.RecordFormat;
import io.marcfilter.marc.format.RecordFormats;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.predicate.MarcRecordFilter;
import io.marcfilter.marc.predicate.SpecCompileException;
import io.marcfilter.marc.projection.FieldProjector;
import io.marcfilter.marc.projection.SelectionSpec;
import io.marcfilter.marc.sink.RollingFileSink;
import io.marcfilter.runtime.Pipeline;
import io.marcfilter.runtime.PipelineBuilder;
import io.marcfilter.runtime.PipelineResult;
import io.marcfilter.runtime.ShardedRunner;
import io.marcfilter.sink.TeeSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * A compiled {@link JobSpec}: every output's filter, selection and formats validated up front,
 * ready to be wired into pipelines writing under a base directory.
 * <p>
 * Each output writes to {@code <base>/<name>/<name>-NNNN<ext>}, one file series per format.
 */
public class MarcFilterJob {
    private static final Logger log = LoggerFactory.getLogger(MarcFilterJob.class);

    /** One output after compilation. */
    public record CompiledOutput(String name, MarcRecordFilter filter, FieldProjector projector,
                                 List<RecordFormat> formats, long limit) { }

    private final JobSpec spec;
    private final List<CompiledOutput> outputs;
    private final MetricRegistry registry;
    private final ErrorSink errorSink;
    private final PipelineConfig config;

    /**
     * @throws SpecCompileException with the problems of every output when any is invalid
     */
    public MarcFilterJob(JobSpec spec, MetricRegistry registry, ErrorSink errorSink, PipelineConfig config) {
        this.spec = spec;
        this.registry = registry;
        this.errorSink = errorSink;
        this.config = config;
        this.outputs = compile(spec);
    }

    public JobSpec spec() { return spec; }
    public List<CompiledOutput> outputs() { return outputs; }

    private static List<CompiledOutput> compile(JobSpec spec) {
        List<String> problems = new ArrayList<>();
        List<CompiledOutput> out = new ArrayList<>();
        Set<String> names = new HashSet<>();
        if (spec.outputs().isEmpty()) problems.add("job has no outputs");
        for (OutputSpec o : spec.outputs()) {
            String where = "output '" + o.name() + "'";
            if (!isPlainName(o.name())) problems.add(where + ": name must be a plain directory name");
            if (!names.add(o.name())) problems.add(where + ": duplicate name");
            MarcRecordFilter filter = null;
            SelectionSpec selection = null;
            List<RecordFormat> formats = new ArrayList<>();
            try {
                filter = MarcRecordFilter.compile(o.filter());
            } catch (SpecCompileException e) {
                for (String p : e.problems()) problems.add(where + " filter " + p);
            }
            try {
                selection = SelectionSpec.parse(o.selection());
            } catch (SpecCompileException e) {
                for (String p : e.problems()) problems.add(where + " selection " + p);
            }
            Set<String> seen = new HashSet<>();
            for (String f : spec.formatsOf(o)) {
                if (!seen.add(f)) {
                    problems.add(where + ": format '" + f + "' named twice");
                    continue;
                }
                try {
                    formats.add(RecordFormats.byName(f, spec.pretty()));
                } catch (IllegalArgumentException e) {
                    problems.add(where + ": " + e.getMessage());
                }
            }
            if (filter != null) {
                out.add(new CompiledOutput(o.name(), filter, new FieldProjector(selection), formats, spec.limitOf(o)));
            }
        }
        if (!problems.isEmpty()) throw new SpecCompileException("job", problems);
        return out;
    }

    /** Output names become directories under the base directory, so they must stay inside it. */
    static boolean isPlainName(String name) {
        return name != null && !name.isBlank() && !name.equals(".") && !name.contains("..")
                && name.indexOf('/') < 0 && name.indexOf('\\') < 0;
    }

    /**
     * Assembles a pipeline reading {@code source} and writing every output under {@code baseDir}.
     */
    public Pipeline<MarcRecord, MarcRecord> pipeline(Source<MarcRecord> source, Path baseDir) throws IOException {
        PipelineBuilder<MarcRecord, MarcRecord> builder = new PipelineBuilder<MarcRecord, MarcRecord>()
                .source(source)
                .metrics(registry)
                .errorSink(errorSink)
                .config(config);
        List<Sink<MarcRecord>> opened = new ArrayList<>();
        try {
            for (CompiledOutput o : outputs) {
                Sink<MarcRecord> sink = fileSink(o, baseDir.resolve(o.name()));
                opened.add(sink);
                builder.branch(o.name(), o.filter(), o.projector(), sink, o.limit());
            }
        } catch (IOException | RuntimeException e) {
            for (Sink<MarcRecord> s : opened) {
                try {
                    s.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw e;
        }
        return builder.build();
    }

    private Sink<MarcRecord> fileSink(CompiledOutput o, Path dir) throws IOException {
        List<RollingFileSink> sinks = new ArrayList<>(o.formats().size());
        try {
            for (RecordFormat f : o.formats()) {
                sinks.add(new RollingFileSink(dir, o.name(), f, spec.maxPerFile()));
            }
        } catch (IOException e) {
            for (RollingFileSink s : sinks) {
                try {
                    s.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw e;
        }
        return sinks.size() == 1 ? sinks.get(0) : new TeeSink<>(sinks);
    }

    /**
     * Runs the job over {@code inputs}. With more than one thread configured and more than one
     * input, each input becomes an independent shard writing to {@code <base>/shard-NNNN};
     * otherwise the inputs are read in order as one stream.
     */
    public PipelineResult run(List<Path> inputs, Path baseDir) throws IOException, InterruptedException {
        if (config.threads() > 1 && inputs.size() > 1) {
            return runSharded(inputs, baseDir);
        }
        try (Pipeline<MarcRecord, MarcRecord> pipeline = pipeline(MarcRecordSource.ofFiles(inputs), baseDir)) {
            return pipeline.run();
        }
    }

    private PipelineResult runSharded(List<Path> inputs, Path baseDir) throws InterruptedException {
        log.info("Running {} shards on {} threads", inputs.size(), config.threads());
        List<Callable<Pipeline<MarcRecord, MarcRecord>>> shards = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            Path input = inputs.get(i);
            Path shardDir = baseDir.resolve(String.format("shard-%04d", i + 1));
            shards.add(() -> pipeline(MarcRecordSource.ofFiles(List.of(input)), shardDir));
        }
        try (ShardedRunner runner = new ShardedRunner(config.threads())) {
            PipelineResult merged = PipelineResult.merge(runner.run(shards));
            log.info("All shards done: read={} matched={} errored={}", merged.read(), merged.matched(), merged.errored());
            return merged;
        }
    }
}
