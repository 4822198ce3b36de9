package io.marcfilter.marc.testing;

import io.marcfilter.marc.format.MarcBinaryFormat;
import io.marcfilter.marc.model.MarcRecord;

import java.io.ByteArrayOutputStream;

/**
 * Small catalog records used across the tests.
 */
public final class Fixtures {
    private Fixtures() { }

    public static MarcRecord computing() {
        return MarcRecord.builder()
                .controlField("001", "rec-cs")
                .controlField("008", "850101s1985    nyu           000 0 eng d")
                .dataField("100", '1', ' ', "a", "Knuth, Donald E.")
                .dataField("245", '1', '4', "a", "The art of computer programming /", "c", "Donald E. Knuth.")
                .dataField("650", ' ', '0', "a", "Computer programming.")
                .dataField("650", ' ', '0', "a", "Computer science", "x", "Mathematics.")
                .build();
    }

    public static MarcRecord history() {
        return MarcRecord.builder()
                .controlField("001", "rec-hist")
                .controlField("008", "991231s1999    enk           000 0 eng d")
                .dataField("245", '0', '0', "a", "A history of Europe")
                .dataField("650", ' ', '0', "a", "Europe", "x", "History.")
                .build();
    }

    /** Has a 650 but no subfield a in it. */
    public static MarcRecord noSubjectTerm() {
        return MarcRecord.builder()
                .controlField("001", "rec-nosub")
                .dataField("245", '1', '0', "a", "Untitled notes")
                .dataField("650", ' ', '7', "2", "local", "x", "Miscellanea.")
                .build();
    }

    public static byte[] binary(MarcRecord... records) {
        MarcBinaryFormat format = new MarcBinaryFormat();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (MarcRecord r : records) out.writeBytes(format.encode(r));
        return out.toByteArray();
    }
}
