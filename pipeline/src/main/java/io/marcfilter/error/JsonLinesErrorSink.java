package io.marcfilter.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Appends one JSON object per record failure to a file.
 */
public class JsonLinesErrorSink implements ErrorSink {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private final BufferedWriter writer;

    public JsonLinesErrorSink(Path file) throws IOException {
        this.file = file;
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    }

    public Path file() { return file; }

    @Override
    public synchronized void accept(RecordError error) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("ts", Instant.now().toString());
        node.put("stage", error.stage());
        if (!error.output().isEmpty()) node.put("output", error.output());
        node.put("record", error.recordIndex());
        node.put("offset", error.byteOffset());
        node.put("reason", error.reason());
        try {
            writer.write(MAPPER.writeValueAsString(node));
            writer.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to error file " + file, e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot close error file " + file, e);
        }
    }
}
