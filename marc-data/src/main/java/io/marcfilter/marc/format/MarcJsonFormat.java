package io.marcfilter.marc.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.marcfilter.marc.codec.MarcEncodeException;
import io.marcfilter.marc.codec.MarcJson;
import io.marcfilter.marc.model.MarcRecord;

import java.nio.charset.StandardCharsets;

/**
 * MARC-in-JSON. A multi-record file is a JSON array; pretty printing puts each record on its
 * own indented block.
 */
public class MarcJsonFormat extends RecordFormat {
    public static final String NAME = "json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final boolean pretty;
    private final ObjectWriter writer;

    public MarcJsonFormat() {
        this(false);
    }

    public MarcJsonFormat(boolean pretty) {
        this.pretty = pretty;
        this.writer = pretty ? MAPPER.writerWithDefaultPrettyPrinter() : MAPPER.writer();
    }

    public boolean isPretty() { return pretty; }

    @Override
    public String name() { return NAME; }

    @Override
    public String extension() { return ".json"; }

    @Override
    public byte[] multiPrefix() { return ascii(pretty ? "[\n" : "["); }

    @Override
    public byte[] multiSuffix() { return ascii(pretty ? "\n]" : "]"); }

    @Override
    public byte[] multiSeparator() { return ascii(pretty ? ",\n" : ","); }

    @Override
    public byte[] encode(MarcRecord record) {
        try {
            return writer.writeValueAsBytes(MarcJson.toJson(record));
        } catch (JsonProcessingException e) {
            throw new MarcEncodeException("Cannot write record as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }
}
