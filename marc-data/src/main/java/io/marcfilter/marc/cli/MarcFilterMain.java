package io.marcfilter.marc.cli;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.marcfilter.config.PipelineConfig;
import io.marcfilter.error.ErrorSink;
import io.marcfilter.error.PipelineAbortedException;
import io.marcfilter.error.StreamFatalException;
import io.marcfilter.marc.job.JobSpec;
import io.marcfilter.marc.job.MarcFilterJob;
import io.marcfilter.marc.job.OutputSpec;
import io.marcfilter.marc.job.SpecLoader;
import io.marcfilter.marc.predicate.SpecCompileException;
import io.marcfilter.metrics.Metrics;
import io.marcfilter.runtime.BranchResult;
import io.marcfilter.runtime.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line entry point: filter MARC files into one or more output data sets.
 */
@CommandLine.Command(name = "marcfilter", mixinStandardHelpOptions = true,
        description = "Filter, reduce and convert MARC records in a single streaming pass")
public final class MarcFilterMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(MarcFilterMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_SPEC = 2;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "INPUT", description = "Binary MARC or MARC-in-JSON files, read in order")
    List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-f", "--filter"}, description = "Filter as inline JSON or a JSON file")
    String filter;

    @CommandLine.Option(names = {"-s", "--select"}, description = "Fields to keep, e.g. 245ab,650 or a JSON list/file")
    String select;

    @CommandLine.Option(names = {"-F", "--format"}, split = ",", description = "Output formats: marc, xml, text, json (repeatable)")
    List<String> formats = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output base directory", defaultValue = "marcfilter-output")
    Path out;

    @CommandLine.Option(names = {"-n", "--name"}, description = "Output name", defaultValue = "filtered")
    String name;

    @CommandLine.Option(names = {"-l", "--limit"}, description = "Maximum records to write; 0 for no limit", defaultValue = "0")
    long limit;

    @CommandLine.Option(names = "--max-per-file", description = "Records per output file; 0 for a single file", defaultValue = "0")
    long maxPerFile;

    @CommandLine.Option(names = "--job", description = "JSON job file describing several outputs")
    Path jobFile;

    @CommandLine.Option(names = "--max-errors", description = "Abort after this many failed records; -1 for no limit")
    Long maxErrors;

    @CommandLine.Option(names = "--errors-file", description = "Write failed records as JSON lines to this file")
    Path errorsFile;

    @CommandLine.Option(names = "--log-every", description = "Log progress every N records; 0 disables")
    Long logEvery;

    @CommandLine.Option(names = "--threads", description = "Worker threads; above 1 each input file runs as its own shard")
    Integer threads;

    @CommandLine.Option(names = "--pretty", description = "Pretty-print JSON output")
    boolean pretty;

    public static void main(String[] args) {
        int code = new CommandLine(new MarcFilterMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        PipelineConfig config = PipelineConfig.fromEnv();
        if (maxErrors != null) config = config.withMaxErrors(maxErrors);
        if (logEvery != null) config = config.withLogEvery(logEvery);
        if (threads != null) config = config.withThreads(threads);

        JobSpec job;
        MarcFilterJob compiled;
        Injector injector;
        try {
            job = jobSpec();
            injector = Guice.createInjector(new MarcFilterModule(config, job, errorsFile));
            compiled = injector.getInstance(MarcFilterJob.class);
        } catch (SpecCompileException e) {
            log.error("{}", e.getMessage());
            return EXIT_SPEC;
        } catch (IOException e) {
            log.error("Cannot read specification: {}", e.getMessage());
            return EXIT_SPEC;
        } catch (ProvisionException e) {
            if (e.getCause() instanceof SpecCompileException sce) {
                log.error("{}", sce.getMessage());
                return EXIT_SPEC;
            }
            log.error("Cannot set up the run: {}", e.getMessage());
            return EXIT_FATAL;
        }

        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        try (ErrorSink errors = injector.getInstance(ErrorSink.class)) {
            PipelineResult result = compiled.run(inputs, out);
            report(result, registry);
            return EXIT_OK;
        } catch (PipelineAbortedException e) {
            log.error("{}", e.getMessage());
            report(e.result(), registry);
            return EXIT_FATAL;
        } catch (StreamFatalException | IOException | UncheckedIOException e) {
            log.error("Run failed: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    private JobSpec jobSpec() throws IOException {
        if (jobFile != null) {
            if (filter != null || select != null || !formats.isEmpty()) {
                throw new SpecCompileException("options", List.of("--job cannot be combined with --filter, --select or --format"));
            }
            JobSpec fromFile = SpecLoader.loadJob(jobFile);
            return new JobSpec(fromFile.outputs(), maxPerFile > 0 ? maxPerFile : fromFile.maxPerFile(),
                    fromFile.defaultFormat(), fromFile.defaultLimit(), pretty || fromFile.pretty());
        }
        Object filterTree = filter == null ? null : SpecLoader.load(filter);
        Object selectTree = select == null ? null : SpecLoader.loadSelection(select);
        OutputSpec output = new OutputSpec(name, filterTree, selectTree, formats, limit);
        return new JobSpec(List.of(output), maxPerFile, JobSpec.DEFAULT_FORMAT, 0, pretty);
    }

    private static void report(PipelineResult result, MetricRegistry registry) {
        log.info("read={} matched={} errored={} written={}", result.read(), result.matched(), result.errored(), result.written());
        for (BranchResult b : result.outputs()) {
            log.info("  {}: matched={} written={}{}", b.name(), b.matched(), b.written(), b.limitReached() ? " (limit reached)" : "");
        }
        Meter in = registry.meter(Metrics.INPUT_RATE);
        Timer filterTime = registry.timer(Metrics.FILTER_TIME);
        Timer sinkTime = registry.timer(Metrics.SINK_TIME);
        log.info("metrics: in.rate(mean)={}/s filter.p50={}ms sink.p50={}ms", fmt(in.getMeanRate()),
                fmt(filterTime.getSnapshot().getMedian() / 1_000_000.0), fmt(sinkTime.getSnapshot().getMedian() / 1_000_000.0));
    }

    private static String fmt(double v) { return String.format("%.3f", v); }
}
