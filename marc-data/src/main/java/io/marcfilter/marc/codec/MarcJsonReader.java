package io.marcfilter.marc.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marcfilter.error.StreamFatalException;
import io.marcfilter.marc.model.MarcRecord;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Streams MARC-in-JSON records from either a top level JSON array or a sequence of
 * concatenated objects. Only one record's tree is materialised at a time.
 * <p>
 * A syntactically valid object that is not a proper record is a per-record
 * {@link MarcDecodeException}; broken JSON ends the stream.
 */
public class MarcJsonReader implements RecordReader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JsonParser parser;
    private long index;
    private long lastOffset = -1;
    private boolean started;
    private boolean inArray;
    private boolean finished;

    public MarcJsonReader(InputStream in) {
        this(in, 0);
    }

    public MarcJsonReader(InputStream in, long firstIndex) {
        try {
            this.parser = MAPPER.getFactory().createParser(in);
        } catch (IOException e) {
            throw new StreamFatalException("Cannot open JSON input", 0, e);
        }
        this.index = firstIndex;
    }

    @Override
    public Optional<MarcRecord> next() {
        if (finished) return Optional.empty();
        try {
            JsonToken token = parser.nextToken();
            if (!started) {
                started = true;
                if (token == JsonToken.START_ARRAY) {
                    inArray = true;
                    token = parser.nextToken();
                }
            }
            if (token == null || (inArray && token == JsonToken.END_ARRAY)) {
                finished = true;
                return Optional.empty();
            }
            lastOffset = parser.currentTokenLocation().getByteOffset();
            long recordIndex = index++;
            if (token != JsonToken.START_OBJECT) {
                finished = true;
                throw new StreamFatalException("Expected a JSON object for record " + recordIndex + " but found " + token, lastOffset);
            }
            JsonNode tree = MAPPER.readTree(parser);
            try {
                return Optional.of(MarcJson.fromJson(tree));
            } catch (IllegalArgumentException e) {
                throw new MarcDecodeException(e.getMessage(), recordIndex, lastOffset, e);
            }
        } catch (IOException e) {
            finished = true;
            throw new StreamFatalException("Malformed JSON input: " + e.getMessage(), lastOffset, e);
        }
    }

    @Override
    public long recordsRead() { return index; }

    @Override
    public long lastRecordOffset() { return lastOffset; }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
