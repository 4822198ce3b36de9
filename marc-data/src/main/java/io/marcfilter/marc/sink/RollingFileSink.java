package io.marcfilter.marc.sink;

import io.marcfilter.core.Record;
import io.marcfilter.marc.format.RecordFormat;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.sink.TeeSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one output's records into numbered files {@code <name>-0001<ext>}, {@code <name>-0002<ext>}, ...
 * under a directory, starting a new file after {@code maxPerFile} records.
 * <p>
 * The first file is created up front so an output that matches nothing still leaves a valid,
 * empty file behind. Later files are opened only when a record needs them.
 */
public class RollingFileSink implements TeeSink.Prepared<MarcRecord> {
    private static final Logger log = LoggerFactory.getLogger(RollingFileSink.class);

    private final Path dir;
    private final String baseName;
    private final RecordFormat format;
    private final long maxPerFile;
    private final List<Path> files = new ArrayList<>();
    private RecordStreamSink active;
    private boolean closed;

    /**
     * @param maxPerFile records per file; below 1 puts everything in one file
     */
    public RollingFileSink(Path dir, String baseName, RecordFormat format, long maxPerFile) throws IOException {
        this.dir = dir;
        this.baseName = baseName;
        this.format = format;
        this.maxPerFile = Math.max(0, maxPerFile);
        Files.createDirectories(dir);
        openNext();
    }

    /** Files created so far, in order. */
    public List<Path> files() { return List.copyOf(files); }

    public Path pathOf(int nth) {
        return dir.resolve(String.format("%s-%04d%s", baseName, nth, format.extension()));
    }

    @Override
    public byte[] prepare(Record<MarcRecord> record) {
        return format.encode(record.payload());
    }

    @Override
    public void write(byte[] encoded) throws IOException {
        if (closed) throw new IOException("Sink is closed");
        if (active == null) openNext();
        active.write(encoded);
        if (maxPerFile > 0 && active.count() >= maxPerFile) closeActive();
    }

    private void openNext() throws IOException {
        Path p = pathOf(files.size() + 1);
        active = new RecordStreamSink(Files.newOutputStream(p), format, maxPerFile != 1, true);
        files.add(p);
        log.debug("Opened {}", p);
    }

    private void closeActive() throws IOException {
        if (active == null) return;
        RecordStreamSink s = active;
        active = null;
        s.close();
    }

    @Override
    public void flush() throws IOException {
        if (active != null) active.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        closeActive();
    }
}
