package io.marcfilter.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonLinesErrorSinkTest {
    @TempDir
    Path dir;

    @Test
    void writes_one_json_object_per_failure() throws Exception {
        Path file = dir.resolve("logs/errors.jsonl");
        try (JsonLinesErrorSink sink = new JsonLinesErrorSink(file)) {
            sink.accept(new RecordError(4, 1200, RecordError.STAGE_READ, "", "Truncated record"));
            sink.accept(new RecordError(7, 2048, RecordError.STAGE_WRITE, "subjects", "Field 245 is too long"));
        }

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        ObjectMapper mapper = new ObjectMapper();
        JsonNode first = mapper.readTree(lines.get(0));
        assertEquals("read", first.get("stage").asText());
        assertEquals(4, first.get("record").asLong());
        assertEquals(1200, first.get("offset").asLong());
        assertEquals("Truncated record", first.get("reason").asText());
        assertFalse(first.has("output"));
        assertTrue(first.has("ts"));
        JsonNode second = mapper.readTree(lines.get(1));
        assertEquals("subjects", second.get("output").asText());
        assertEquals("write", second.get("stage").asText());
    }
}
