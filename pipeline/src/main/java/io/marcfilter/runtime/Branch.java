package io.marcfilter.runtime;

import io.marcfilter.core.RecordFilter;
import io.marcfilter.core.Sink;
import io.marcfilter.core.Transform;

import java.io.IOException;
import java.util.Objects;

/**
 * One named output of a pipeline: its own filter, transform, sink and record limit.
 * Holds the per-output counters; owned by a single {@link Pipeline}.
 */
public final class Branch<I, O> {
    private final String name;
    private final RecordFilter<I> filter;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final long limit;

    private long matched;
    private long written;
    private boolean closed;

    /**
     * @param limit maximum records to write to this output; below 1 means unlimited
     */
    public Branch(String name, RecordFilter<I> filter, Transform<I, O> transform, Sink<O> sink, long limit) {
        this.name = Objects.requireNonNull(name, "name");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.transform = Objects.requireNonNull(transform, "transform");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.limit = Math.max(0, limit);
    }

    public String name() { return name; }
    public RecordFilter<I> filter() { return filter; }
    public Transform<I, O> transform() { return transform; }
    public Sink<O> sink() { return sink; }
    public long limit() { return limit; }
    public long matched() { return matched; }
    public long written() { return written; }
    public boolean isClosed() { return closed; }

    void onMatched() { matched++; }
    void onWritten() { written++; }

    boolean limitReached() {
        return limit > 0 && written >= limit;
    }

    void close() throws IOException {
        if (closed) return;
        closed = true;
        try {
            sink.flush();
        } finally {
            sink.close();
        }
    }

    BranchResult result() {
        return new BranchResult(name, matched, written, limitReached());
    }
}
