package io.marcfilter.marc.codec;

import io.marcfilter.error.StreamFatalException;
import io.marcfilter.marc.model.ControlField;
import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class MarcDecoderTest {

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] p : parts) out.writeBytes(p);
        return out.toByteArray();
    }

    /** Index of the field terminator of the field described by the n-th directory entry. */
    private static int fieldEnd(byte[] record, int entry) {
        int base = Integer.parseInt(new String(record, 12, 5, StandardCharsets.US_ASCII));
        int p = 24 + entry * 12;
        int length = Integer.parseInt(new String(record, p + 3, 4, StandardCharsets.US_ASCII));
        int start = Integer.parseInt(new String(record, p + 7, 5, StandardCharsets.US_ASCII));
        return base + start + length - 1;
    }

    @Test
    void decodes_concatenated_records_in_order() throws Exception {
        byte[] data = Fixtures.binary(Fixtures.computing(), Fixtures.history());
        try (MarcDecoder decoder = new MarcDecoder(new ByteArrayInputStream(data))) {
            MarcRecord first = decoder.next().orElseThrow();
            MarcRecord second = decoder.next().orElseThrow();
            assertTrue(decoder.next().isEmpty());

            assertEquals(Fixtures.computing().fields(), first.fields());
            assertEquals(Fixtures.history().fields(), second.fields());
            assertEquals(2, decoder.recordsRead());
            assertEquals(data.length, decoder.position());
        }
    }

    @Test
    void keeps_control_and_data_fields_in_directory_order() throws Exception {
        MarcRecord interleaved = MarcRecord.builder()
                .dataField("245", '0', '0', "a", "Title")
                .controlField("001", "id")
                .dataField("500", ' ', ' ', "a", "Note", "a", "Second note")
                .build();
        MarcRecord decoded = new MarcDecoder(new ByteArrayInputStream(Fixtures.binary(interleaved))).next().orElseThrow();

        assertEquals(interleaved.fields(), decoded.fields());
        assertInstanceOf(DataField.class, decoded.fields().get(0));
        assertInstanceOf(ControlField.class, decoded.fields().get(1));
    }

    @Test
    void never_reads_past_the_current_record() throws Exception {
        byte[] record = Fixtures.binary(Fixtures.computing());
        ByteArrayInputStream in = new ByteArrayInputStream(concat(record, "trailing".getBytes(StandardCharsets.US_ASCII)));
        MarcDecoder decoder = new MarcDecoder(in);

        decoder.next().orElseThrow();

        assertEquals("trailing".length(), in.available());
        assertEquals(record.length, decoder.position());
    }

    @Test
    void missing_record_terminator_fails_that_record_only() throws Exception {
        byte[] bad = Fixtures.binary(Fixtures.computing());
        bad[bad.length - 1] = 'X';
        byte[] good = Fixtures.binary(Fixtures.history());
        MarcDecoder decoder = new MarcDecoder(new ByteArrayInputStream(concat(good, bad, good)));

        decoder.next().orElseThrow();
        MarcDecodeException e = assertThrows(MarcDecodeException.class, decoder::next);
        assertEquals(1, e.recordIndex());
        assertEquals(good.length, e.byteOffset());
        assertTrue(e.getMessage().contains("record terminator"));

        MarcRecord third = decoder.next().orElseThrow();
        assertEquals(Fixtures.history().fields(), third.fields());
        assertEquals(3, decoder.recordsRead());
    }

    @Test
    void unterminated_field_is_a_record_error() throws Exception {
        byte[] bad = Fixtures.binary(Fixtures.history());
        bad[fieldEnd(bad, 2)] = 'Z';
        MarcDecoder decoder = new MarcDecoder(new ByteArrayInputStream(concat(bad, Fixtures.binary(Fixtures.computing()))));

        MarcDecodeException e = assertThrows(MarcDecodeException.class, decoder::next);
        assertTrue(e.getMessage().contains("245"), e.getMessage());
        assertTrue(decoder.next().isPresent());
    }

    @Test
    void declared_length_must_match_the_record() {
        byte[] data = Fixtures.binary(Fixtures.history());

        MarcDecodeException e = assertThrows(MarcDecodeException.class,
                () -> MarcDecoder.decode(Arrays.copyOf(data, data.length - 1), 3, 512));
        assertTrue(e.getMessage().contains("declares"));
        assertEquals(3, e.recordIndex());
        assertEquals(512, e.byteOffset());
    }

    @Test
    void truncated_final_record_is_reported_then_stream_ends() throws Exception {
        byte[] good = Fixtures.binary(Fixtures.history());
        byte[] cut = Arrays.copyOf(Fixtures.binary(Fixtures.computing()), 40);
        MarcDecoder decoder = new MarcDecoder(new ByteArrayInputStream(concat(good, cut)));

        decoder.next().orElseThrow();
        MarcDecodeException e = assertThrows(MarcDecodeException.class, decoder::next);
        assertTrue(e.getMessage().startsWith("Truncated record"));
        assertTrue(decoder.next().isEmpty());
    }

    @Test
    void short_leader_at_end_of_stream_is_a_record_error() throws Exception {
        MarcDecoder decoder = new MarcDecoder(new ByteArrayInputStream("00123nam".getBytes(StandardCharsets.US_ASCII)));
        assertThrows(MarcDecodeException.class, decoder::next);
        assertTrue(decoder.next().isEmpty());
    }

    @Test
    void unreadable_length_cannot_be_skipped_and_ends_the_stream() throws Exception {
        byte[] data = Fixtures.binary(Fixtures.history(), Fixtures.history());
        data[2] = 'x';
        MarcDecoder decoder = new MarcDecoder(new ByteArrayInputStream(data));

        assertThrows(StreamFatalException.class, decoder::next);
        assertTrue(decoder.next().isEmpty());
    }

    @Test
    void empty_stream_has_no_records() throws Exception {
        MarcDecoder decoder = new MarcDecoder(new ByteArrayInputStream(new byte[0]));
        assertTrue(decoder.next().isEmpty());
        assertEquals(0, decoder.recordsRead());
    }

    @Test
    void non_unicode_records_round_trip_byte_for_byte() throws Exception {
        MarcRecord latin = MarcRecord.builder()
                .leader("00000nam  2200000 a 4500")
                .controlField("001", "l1")
                .dataField("245", '1', '0', "a", "Café crème")
                .build();
        byte[] encoded = Fixtures.binary(latin);
        MarcRecord decoded = new MarcDecoder(new ByteArrayInputStream(encoded)).next().orElseThrow();

        assertEquals(latin.fields(), decoded.fields());
        assertFalse(decoded.leader().isUnicode());
        assertArrayEquals(encoded, Fixtures.binary(decoded));
    }

    @Test
    void first_index_continues_numbering() throws Exception {
        byte[] bad = Fixtures.binary(Fixtures.history());
        bad[bad.length - 1] = 'X';
        MarcDecoder decoder = new MarcDecoder(new ByteArrayInputStream(bad), 10);
        MarcDecodeException e = assertThrows(MarcDecodeException.class, decoder::next);
        assertEquals(10, e.recordIndex());
        assertEquals(11, decoder.recordsRead());
    }
}
