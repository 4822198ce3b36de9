package io.marcfilter.marc.codec;

import io.marcfilter.error.StreamFatalException;
import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.model.Subfield;
import io.marcfilter.marc.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MarcJsonReaderTest {
    private static final String LEADER = "00000nam a2200000 a 4500";

    private static MarcJsonReader reader(String json) {
        return new MarcJsonReader(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void reads_records_from_a_json_array() throws Exception {
        String json = "[{\"leader\":\"" + LEADER + "\",\"fields\":[{\"001\":\"x1\"},"
                + "{\"245\":{\"ind1\":\"1\",\"ind2\":\"0\",\"subfields\":[{\"a\":\"Title\"},{\"c\":\"Author\"}]}}]},"
                + "{\"leader\":\"" + LEADER + "\",\"fields\":[]}]";
        try (MarcJsonReader r = reader(json)) {
            MarcRecord first = r.next().orElseThrow();
            MarcRecord second = r.next().orElseThrow();
            assertTrue(r.next().isEmpty());

            assertEquals(LEADER, first.leader().value());
            assertEquals("x1", first.controlFields().get(0).value());
            DataField title = first.dataFields().get(0);
            assertEquals('1', title.ind1());
            assertEquals('0', title.ind2());
            assertEquals(List.of(new Subfield('a', "Title"), new Subfield('c', "Author")), title.subfields());
            assertTrue(second.fields().isEmpty());
            assertEquals(2, r.recordsRead());
        }
    }

    @Test
    void reads_concatenated_objects() throws Exception {
        String one = MarcJson.toJson(Fixtures.computing()).toString();
        String two = MarcJson.toJson(Fixtures.history()).toString();
        try (MarcJsonReader r = reader(one + "\n" + two + "\n")) {
            assertEquals(Fixtures.computing().fields(), r.next().orElseThrow().fields());
            assertEquals(Fixtures.history().fields(), r.next().orElseThrow().fields());
            assertTrue(r.next().isEmpty());
        }
    }

    @Test
    void object_that_is_not_a_record_fails_alone() throws Exception {
        String json = "[{\"fields\":[]},{\"leader\":\"" + LEADER + "\",\"fields\":[{\"001\":\"ok\"}]}]";
        try (MarcJsonReader r = reader(json)) {
            MarcDecodeException e = assertThrows(MarcDecodeException.class, r::next);
            assertEquals(0, e.recordIndex());
            assertTrue(e.getMessage().contains("leader"));
            assertEquals("ok", r.next().orElseThrow().controlFields().get(0).value());
        }
    }

    @Test
    void bad_subfield_shape_is_a_record_error() throws Exception {
        String json = "{\"leader\":\"" + LEADER + "\",\"fields\":[{\"245\":{\"subfields\":[{\"ab\":\"x\"}]}}]}";
        try (MarcJsonReader r = reader(json)) {
            assertThrows(MarcDecodeException.class, r::next);
        }
    }

    @Test
    void field_shape_must_match_its_tag() throws Exception {
        String textForData = "{\"leader\":\"" + LEADER + "\",\"fields\":[{\"245\":\"plain text\"}]}";
        String objectForControl = "{\"leader\":\"" + LEADER + "\",\"fields\":[{\"008\":{\"ind1\":\" \",\"ind2\":\" \",\"subfields\":[]}}]}";
        String good = "{\"leader\":\"" + LEADER + "\",\"fields\":[{\"001\":\"ok\"}]}";
        try (MarcJsonReader r = reader(textForData + "\n" + objectForControl + "\n" + good)) {
            MarcDecodeException data = assertThrows(MarcDecodeException.class, r::next);
            assertTrue(data.getMessage().contains("245"));
            MarcDecodeException control = assertThrows(MarcDecodeException.class, r::next);
            assertTrue(control.getMessage().contains("008"));
            assertEquals("ok", r.next().orElseThrow().controlFields().get(0).value());
        }
    }

    @Test
    void broken_json_ends_the_stream() throws Exception {
        try (MarcJsonReader r = reader("[{\"leader\": \"" + LEADER + "\", \"fields\": [")) {
            assertThrows(StreamFatalException.class, r::next);
            assertTrue(r.next().isEmpty());
        }
    }

    @Test
    void empty_array_has_no_records() throws Exception {
        try (MarcJsonReader r = reader("  [ ]  ")) {
            assertTrue(r.next().isEmpty());
        }
    }
}
