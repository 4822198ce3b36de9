package io.marcfilter.marc.codec;

import io.marcfilter.core.Record;
import io.marcfilter.core.Source;
import io.marcfilter.error.RecordException;
import io.marcfilter.error.StreamFatalException;
import io.marcfilter.marc.model.MarcRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads one or more inputs in order as a single stream of records.
 * <p>
 * Record indexes continue across inputs; byte offsets restart at zero for each input.
 * Each input is opened only when the previous one is exhausted.
 */
public class MarcRecordSource implements Source<MarcRecord> {
    private static final Logger log = LoggerFactory.getLogger(MarcRecordSource.class);

    /** Something that can be opened as a byte stream. */
    @FunctionalInterface
    public interface Input {
        InputStream open() throws IOException;
    }

    private final List<Input> inputs;
    private final List<String> names;
    private int inputIdx = 0;
    private RecordReader current;
    private long nextIndex = 0;
    private boolean finished;

    public MarcRecordSource(List<Input> inputs, List<String> names) {
        if (inputs.size() != names.size()) throw new IllegalArgumentException("inputs and names differ in size");
        this.inputs = List.copyOf(inputs);
        this.names = List.copyOf(names);
    }

    /** A source over a single already-open stream. */
    public static MarcRecordSource of(InputStream in) {
        return new MarcRecordSource(List.of(() -> in), List.of("<stream>"));
    }

    public static MarcRecordSource ofFiles(List<Path> files) {
        List<Input> inputs = new ArrayList<>(files.size());
        List<String> names = new ArrayList<>(files.size());
        for (Path p : files) {
            inputs.add(() -> Files.newInputStream(p));
            names.add(p.toString());
        }
        return new MarcRecordSource(inputs, names);
    }

    @Override
    public Optional<Record<MarcRecord>> poll() {
        while (!finished) {
            if (current == null && !openNext()) return Optional.empty();
            Optional<MarcRecord> next;
            try {
                next = current.next();
            } catch (RecordException e) {
                nextIndex = current.recordsRead();
                throw e;
            } catch (StreamFatalException e) {
                finished = true;
                try {
                    close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw e;
            }
            nextIndex = current.recordsRead();
            if (next.isPresent()) {
                return Optional.of(new Record<>(nextIndex - 1, current.lastRecordOffset(), next.get()));
            }
            closeCurrent();
            inputIdx++;
        }
        return Optional.empty();
    }

    private boolean openNext() {
        if (inputIdx >= inputs.size()) {
            finished = true;
            return false;
        }
        String name = names.get(inputIdx);
        try {
            current = InputFormat.open(inputs.get(inputIdx).open(), nextIndex);
        } catch (IOException e) {
            finished = true;
            throw new StreamFatalException("Cannot open input " + name, 0, e);
        }
        log.debug("Reading {} from record {}", name, nextIndex);
        return true;
    }

    private void closeCurrent() {
        if (current == null) return;
        RecordReader r = current;
        current = null;
        try {
            r.close();
        } catch (IOException e) {
            throw new StreamFatalException("Cannot close input " + names.get(inputIdx), -1, e);
        }
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    @Override
    public void close() throws IOException {
        finished = true;
        if (current != null) {
            RecordReader r = current;
            current = null;
            r.close();
        }
    }
}
