package io.marcfilter.marc.sink;

import io.marcfilter.core.Record;
import io.marcfilter.marc.format.RecordFormat;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.sink.TeeSink;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes encoded records to one already-open stream, with the format's framing: header (and
 * multi-record prefix) up front, separators between records, suffix and footer on close.
 */
public class RecordStreamSink implements TeeSink.Prepared<MarcRecord> {
    private final OutputStream out;
    private final RecordFormat format;
    private final boolean multi;
    private final boolean closeStream;
    private long count;
    private boolean closed;

    /**
     * @param multi       whether the stream may hold more than one record
     * @param closeStream whether {@link #close()} closes {@code out}; false for e.g. stdout
     */
    public RecordStreamSink(OutputStream out, RecordFormat format, boolean multi, boolean closeStream) throws IOException {
        this.out = out instanceof BufferedOutputStream ? out : new BufferedOutputStream(out, 64 * 1024);
        this.format = format;
        this.multi = multi;
        this.closeStream = closeStream;
        this.out.write(format.header());
        if (multi) this.out.write(format.multiPrefix());
    }

    public RecordFormat format() { return format; }

    /** Records written so far. */
    public long count() { return count; }

    @Override
    public byte[] prepare(Record<MarcRecord> record) {
        return format.encode(record.payload());
    }

    @Override
    public void write(byte[] encoded) throws IOException {
        if (closed) throw new IOException("Sink is closed");
        if (count > 0 && multi) out.write(format.multiSeparator());
        out.write(encoded);
        count++;
    }

    @Override
    public void flush() throws IOException {
        if (!closed) out.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        try {
            if (multi) out.write(format.multiSuffix());
            out.write(format.footer());
            out.flush();
        } finally {
            if (closeStream) out.close();
        }
    }
}
