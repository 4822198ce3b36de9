package io.marcfilter.sink;

import io.marcfilter.core.Record;
import io.marcfilter.error.RecordException;
import io.marcfilter.testing.CollectingSink;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TeeSinkTest {

    /** Writes the payload's text; refuses payloads containing a space. */
    static class TextSink implements TeeSink.Prepared<String> {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        boolean closed;

        @Override
        public byte[] prepare(Record<String> record) {
            if (record.payload().contains(" ")) throw new RecordException("no spaces", record.seq(), record.offset());
            return record.payload().getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public void write(byte[] encoded) {
            out.writeBytes(encoded);
        }

        @Override
        public void close() {
            closed = true;
        }

        String text() {
            return out.toString(StandardCharsets.UTF_8);
        }
    }

    @Test
    void every_sink_receives_every_record() throws Exception {
        var first = new TextSink();
        var second = new CollectingSink<String>();
        var tee = new TeeSink<>(List.of(first, second));

        tee.accept(new Record<>(0, 0, "a"));
        tee.accept(new Record<>(1, 1, "b"));
        tee.close();

        assertEquals("ab", first.text());
        assertEquals(List.of("a", "b"), second.items);
        assertTrue(first.closed);
        assertTrue(second.closed);
    }

    @Test
    void record_one_target_cannot_encode_reaches_no_target() throws Exception {
        var plain = new TextSink();
        var picky = new TextSink() {
            @Override
            public byte[] prepare(Record<String> record) {
                if (record.payload().startsWith("x")) throw new RecordException("no x", record.seq(), -1);
                return super.prepare(record);
            }
        };
        var tee = new TeeSink<>(List.of(plain, picky));

        tee.accept(new Record<>(0, 0, "ok"));
        assertThrows(RecordException.class, () -> tee.accept(new Record<>(1, 0, "xy")));

        assertEquals("ok", plain.text());
        assertEquals("ok", picky.text());
    }

    @Test
    void needs_at_least_one_sink() {
        assertThrows(IllegalArgumentException.class, () -> new TeeSink<String>(List.of()));
    }
}
