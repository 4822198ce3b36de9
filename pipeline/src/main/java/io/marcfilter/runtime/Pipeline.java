package io.marcfilter.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.marcfilter.config.PipelineConfig;
import io.marcfilter.core.Record;
import io.marcfilter.core.Source;
import io.marcfilter.error.ErrorSink;
import io.marcfilter.error.PipelineAbortedException;
import io.marcfilter.error.RecordError;
import io.marcfilter.error.RecordException;
import io.marcfilter.error.StreamFatalException;
import io.marcfilter.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-source -> many-output pipeline driven synchronously on the calling thread.
 * <p>
 * Exactly one input record is in flight at any time: it is pulled from the source, offered
 * to every open output (filter, then transform, then sink) and released before the next one
 * is read. Record-scoped failures are counted and reported through the {@link ErrorSink};
 * stream failures end the run. Sinks are flushed and closed when the run ends, including
 * when it ends on a fatal error, so partial output is preserved. The error sink belongs to
 * the caller and is left open.
 */
public class Pipeline<I, O> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final Source<I> source;
    private final List<Branch<I, O>> branches;
    private final ErrorSink errorSink;
    private final PipelineConfig config;

    private final Timer sourceTimer;
    private final Timer filterTimer;
    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter matchMeter;
    private final Meter outMeter;
    private final Meter errorMeter;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile PipelineState state = PipelineState.IDLE;

    private long read;
    private long matched;
    private long errored;
    private final List<RecordError> errors = new ArrayList<>();

    public Pipeline(Source<I> source,
                    List<Branch<I, O>> branches,
                    Metrics metrics,
                    ErrorSink errorSink,
                    PipelineConfig config) {
        this.source = Objects.requireNonNull(source);
        this.branches = List.copyOf(branches);
        if (this.branches.isEmpty()) throw new IllegalArgumentException("Pipeline needs at least one output");
        this.errorSink = Objects.requireNonNull(errorSink);
        this.config = Objects.requireNonNull(config);
        this.sourceTimer = metrics.timer(Metrics.SOURCE_TIME);
        this.filterTimer = metrics.timer(Metrics.FILTER_TIME);
        this.transformTimer = metrics.timer(Metrics.TRANSFORM_TIME);
        this.sinkTimer = metrics.timer(Metrics.SINK_TIME);
        this.inMeter = metrics.meter(Metrics.INPUT_RATE);
        this.matchMeter = metrics.meter(Metrics.MATCH_RATE);
        this.outMeter = metrics.meter(Metrics.OUTPUT_RATE);
        this.errorMeter = metrics.meter(Metrics.ERROR_RATE);
    }

    public PipelineState state() { return state; }
    public long readCount() { return read; }
    public long matchedCount() { return matched; }
    public long errorCount() { return errored; }

    /**
     * Requests a clean stop. Checked between records, never mid-record; whatever has been
     * written is flushed.
     */
    public void cancel() { cancelled.set(true); }

    public boolean isCancelled() { return cancelled.get(); }

    /**
     * Runs the pipeline to completion on the calling thread.
     *
     * @throws StreamFatalException     on an I/O failure or an unrecoverable input
     * @throws PipelineAbortedException when record failures exceed {@link PipelineConfig#maxErrors()}
     */
    public PipelineResult run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline has already been run");
        }
        boolean stoppedOnCancel = false;
        Throwable failure = null;
        try {
            while (true) {
                if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                    log.info("Cancellation requested after {} records", read);
                    stoppedOnCancel = true;
                    break;
                }
                if (openBranches() == 0) {
                    log.info("Reached limit for all outputs after {} records", read);
                    break;
                }
                state = PipelineState.READING;
                Optional<Record<I>> next;
                try (Timer.Context ignored = sourceTimer.time()) {
                    next = source.poll();
                } catch (RecordException e) {
                    read++;
                    inMeter.mark();
                    recordFailure(RecordError.of(RecordError.STAGE_READ, "", e), e);
                    logProgress();
                    continue;
                }
                if (next.isEmpty()) {
                    if (source.isFinished()) break;
                    continue;
                }
                read++;
                inMeter.mark();
                process(next.get());
                logProgress();
            }
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            state = PipelineState.DRAINING;
            drain(failure);
            state = PipelineState.DONE;
        }
        PipelineResult result = snapshot(stoppedOnCancel);
        logSummary(result);
        return result;
    }

    private void process(Record<I> in) {
        boolean kept = false;
        boolean failed = false;
        for (Branch<I, O> branch : branches) {
            if (branch.isClosed()) continue;
            String stage = RecordError.STAGE_FILTER;
            try {
                state = PipelineState.DECIDING;
                boolean keep;
                try (Timer.Context ignored = filterTimer.time()) {
                    keep = branch.filter().test(in.payload());
                }
                if (!keep) continue;
                kept = true;
                branch.onMatched();

                stage = RecordError.STAGE_TRANSFORM;
                state = PipelineState.PROJECTING;
                Record<O> out;
                try (Timer.Context ignored = transformTimer.time()) {
                    out = branch.transform().apply(in);
                }

                stage = RecordError.STAGE_WRITE;
                state = PipelineState.ENCODING;
                try (Timer.Context ignored = sinkTimer.time()) {
                    branch.sink().accept(out);
                }
                branch.onWritten();
                outMeter.mark();
                if (branch.limitReached()) {
                    log.info("Output '{}' reached its limit of {} records", branch.name(), branch.limit());
                    branch.close();
                }
            } catch (RecordException e) {
                RecordError error = new RecordError(in.seq(), in.offset(), stage, branch.name(), String.valueOf(e.getMessage()));
                if (!failed) {
                    failed = true;
                    recordFailure(error, e);
                } else {
                    report(error);
                }
            } catch (IOException e) {
                throw new StreamFatalException("Cannot write to output '" + branch.name() + "'", in.offset(), e);
            }
        }
        if (kept) {
            matched++;
            matchMeter.mark();
        }
    }

    private void recordFailure(RecordError error, RecordException cause) {
        errored++;
        errorMeter.mark();
        report(error);
        long budget = config.maxErrors();
        if (budget >= 0 && errored > budget) {
            throw new PipelineAbortedException(
                    "Aborting after " + errored + " failed records (max " + budget + "): " + error.reason(),
                    snapshot(false), cause);
        }
    }

    private void report(RecordError error) {
        if (errors.size() < config.maxRecordedErrors()) errors.add(error);
        errorSink.accept(error);
    }

    private int openBranches() {
        int open = 0;
        for (Branch<I, O> b : branches) {
            if (!b.isClosed()) open++;
        }
        return open;
    }

    private void drain(Throwable failure) {
        for (Branch<I, O> b : branches) {
            try {
                b.close();
            } catch (IOException e) {
                StreamFatalException closeFailure = new StreamFatalException("Cannot close output '" + b.name() + "'", -1, e);
                if (failure != null) {
                    failure.addSuppressed(closeFailure);
                } else {
                    throw closeFailure;
                }
            }
        }
    }

    private PipelineResult snapshot(boolean stoppedOnCancel) {
        List<BranchResult> outputs = new ArrayList<>(branches.size());
        for (Branch<I, O> b : branches) outputs.add(b.result());
        return new PipelineResult(read, matched, errored, outputs, errors, stoppedOnCancel);
    }

    private void logProgress() {
        long every = config.logEvery();
        if (every < 1 || read % every != 0) return;
        log.info("=== {} processed: {} matched, {} failed ===", read, matched, errored);
        for (Branch<I, O> b : branches) {
            if (b.limit() > 0) {
                log.info("{} \"{}\" records found (max {})", b.matched(), b.name(), b.limit());
            } else {
                log.info("{} \"{}\" records found", b.matched(), b.name());
            }
        }
    }

    private void logSummary(PipelineResult result) {
        if (config.logEvery() < 1) {
            log.debug("Run finished: read={} matched={} errored={}", result.read(), result.matched(), result.errored());
            return;
        }
        log.info("*** FINAL SUMMARY *** read={} matched={} errored={}{}", result.read(), result.matched(),
                result.errored(), result.cancelled() ? " (cancelled)" : "");
        for (BranchResult b : result.outputs()) {
            log.info("{} \"{}\" records found, {} written", b.matched(), b.name(), b.written());
        }
    }

    @Override
    public void close() throws IOException {
        cancel();
        IOException failure = null;
        for (Branch<I, O> b : branches) {
            try {
                b.close();
            } catch (IOException e) {
                if (failure == null) failure = e; else failure.addSuppressed(e);
            }
        }
        try {
            source.close();
        } catch (IOException e) {
            if (failure == null) failure = e; else failure.addSuppressed(e);
        }
        if (failure != null) throw failure;
    }
}
