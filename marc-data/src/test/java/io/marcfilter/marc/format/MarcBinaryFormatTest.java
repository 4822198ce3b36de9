package io.marcfilter.marc.format;

import io.marcfilter.marc.codec.MarcDecoder;
import io.marcfilter.marc.codec.MarcEncodeException;
import io.marcfilter.marc.model.Leader;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class MarcBinaryFormatTest {
    private final MarcBinaryFormat format = new MarcBinaryFormat();

    @Test
    void computes_lengths_and_directory_from_content() {
        MarcRecord r = MarcRecord.builder()
                .leader("99999nam a2299999 a 4500")
                .controlField("001", "abc")
                .dataField("245", '1', '0', "a", "T")
                .build();
        byte[] b = format.encode(r);
        String s = new String(b, StandardCharsets.ISO_8859_1);

        // leader + 2 directory entries + terminator
        int base = 24 + 2 * 12 + 1;
        // "abc" + FT, "10" + SD + "a" + "T" + FT, RT
        int total = base + 4 + 6 + 1;
        assertEquals(total, b.length);
        assertEquals(String.format("%05d", total), s.substring(0, 5));
        assertEquals(String.format("%05d", base), s.substring(12, 17));
        assertEquals("001000400000", s.substring(24, 36));
        assertEquals("245000600004", s.substring(36, 48));
        assertEquals(0x1E, b[base - 1]);
        assertEquals(0x1D, b[b.length - 1]);
    }

    @Test
    void round_trips_through_the_decoder() throws Exception {
        for (MarcRecord r : new MarcRecord[]{Fixtures.computing(), Fixtures.history(), Fixtures.noSubjectTerm()}) {
            byte[] once = format.encode(r);
            MarcRecord back = new MarcDecoder(new ByteArrayInputStream(once)).next().orElseThrow();
            assertEquals(r.fields(), back.fields());
            assertArrayEquals(once, format.encode(back));
        }
    }

    @Test
    void multibyte_text_counts_bytes_not_characters() throws Exception {
        MarcRecord r = MarcRecord.builder().dataField("245", '0', '0', "a", "Ελληνικά").build();
        byte[] b = format.encode(r);
        MarcRecord back = new MarcDecoder(new ByteArrayInputStream(b)).next().orElseThrow();
        assertEquals("Ελληνικά", back.dataFields().get(0).subfields().get(0).value());
        assertEquals(new Leader(new String(b, 0, 24, StandardCharsets.ISO_8859_1)).recordLength(), b.length);
    }

    @Test
    void field_over_9999_bytes_cannot_be_encoded() {
        MarcRecord r = MarcRecord.builder().dataField("520", ' ', ' ', "a", "x".repeat(10_000)).build();
        MarcEncodeException e = assertThrows(MarcEncodeException.class, () -> format.encode(r));
        assertTrue(e.getMessage().contains("520"));
    }

    @Test
    void record_over_99999_bytes_cannot_be_encoded() {
        MarcRecord.Builder b = MarcRecord.builder();
        for (int i = 0; i < 12; i++) b.dataField("505", ' ', ' ', "a", "y".repeat(9_000));
        assertThrows(MarcEncodeException.class, () -> format.encode(b.build()));
    }

    @Test
    void single_byte_records_reject_characters_they_cannot_hold() {
        MarcRecord r = MarcRecord.builder()
                .leader("00000nam  2200000 a 4500")
                .dataField("245", '0', '0', "a", "日本")
                .build();
        assertThrows(MarcEncodeException.class, () -> format.encode(r));
    }

    @Test
    void structural_characters_in_content_cannot_be_encoded() {
        MarcRecord inValue = MarcRecord.builder()
                .leader("00000nam a2200000 a 4500")
                .dataField("245", '0', '0', "a", "Title\u001fzInjected")
                .build();
        assertThrows(MarcEncodeException.class, () -> format.encode(inValue));

        MarcRecord inControl = MarcRecord.builder()
                .leader("00000nam a2200000 a 4500")
                .controlField("001", "abc\u001e")
                .build();
        assertThrows(MarcEncodeException.class, () -> format.encode(inControl));

        MarcRecord inCode = MarcRecord.builder()
                .leader("00000nam a2200000 a 4500")
                .dataField("245", '0', '0', "\u001d", "Title")
                .build();
        assertThrows(MarcEncodeException.class, () -> format.encode(inCode));
    }
}
