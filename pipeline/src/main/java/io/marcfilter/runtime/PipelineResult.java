package io.marcfilter.runtime;

import io.marcfilter.error.RecordError;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters and failure descriptors of a finished (or aborted) run.
 *
 * @param read      records taken off the input, malformed ones included
 * @param matched   records kept by at least one output
 * @param errored   records that failed in any stage; each record counts once
 * @param outputs   per-output counters in declaration order
 * @param errors    failure descriptors, capped by {@code PipelineConfig.maxRecordedErrors}
 * @param cancelled whether the run stopped on a cancellation request
 */
public record PipelineResult(
        long read,
        long matched,
        long errored,
        List<BranchResult> outputs,
        List<RecordError> errors,
        boolean cancelled
) {
    public PipelineResult {
        outputs = List.copyOf(outputs);
        errors = List.copyOf(errors);
    }

    public long written() {
        long total = 0;
        for (BranchResult b : outputs) total += b.written();
        return total;
    }

    public BranchResult output(String name) {
        for (BranchResult b : outputs) {
            if (b.name().equals(name)) return b;
        }
        throw new IllegalArgumentException("No output named " + name);
    }

    /**
     * Sums the results of independent shards. Output counters are combined by name and errors
     * are concatenated in shard order.
     */
    public static PipelineResult merge(List<PipelineResult> shards) {
        long read = 0, matched = 0, errored = 0;
        boolean cancelled = false;
        Map<String, BranchResult> outputs = new LinkedHashMap<>();
        List<RecordError> errors = new ArrayList<>();
        for (PipelineResult r : shards) {
            read += r.read();
            matched += r.matched();
            errored += r.errored();
            cancelled |= r.cancelled();
            for (BranchResult b : r.outputs()) {
                outputs.merge(b.name(), b, BranchResult::plus);
            }
            errors.addAll(r.errors());
        }
        return new PipelineResult(read, matched, errored, new ArrayList<>(outputs.values()), errors, cancelled);
    }
}
