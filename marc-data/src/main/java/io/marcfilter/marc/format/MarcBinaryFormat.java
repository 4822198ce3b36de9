package io.marcfilter.marc.format;

import io.marcfilter.marc.codec.MarcEncodeException;
import io.marcfilter.marc.model.ControlField;
import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.model.Field;
import io.marcfilter.marc.model.Leader;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.model.Subfield;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.marcfilter.marc.model.MarcConstants.DIRECTORY_ENTRY_LENGTH;
import static io.marcfilter.marc.model.MarcConstants.FIELD_TERMINATOR;
import static io.marcfilter.marc.model.MarcConstants.LEADER_LENGTH;
import static io.marcfilter.marc.model.MarcConstants.MAX_FIELD_LENGTH;
import static io.marcfilter.marc.model.MarcConstants.MAX_FIELD_START;
import static io.marcfilter.marc.model.MarcConstants.MAX_RECORD_LENGTH;
import static io.marcfilter.marc.model.MarcConstants.RECORD_TERMINATOR;
import static io.marcfilter.marc.model.MarcConstants.SUBFIELD_DELIMITER;
import static io.marcfilter.marc.model.MarcConstants.TAG_LENGTH;

/**
 * ISO 2709 binary. Record length, base address and every directory entry are computed from
 * the fields being written; the source leader's numbers are never reused.
 */
public class MarcBinaryFormat extends RecordFormat {
    public static final String NAME = "marc";

    @Override
    public String name() { return NAME; }

    @Override
    public String extension() { return ".mrc"; }

    @Override
    public byte[] encode(MarcRecord record) {
        Charset charset = record.leader().isUnicode() ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1;
        List<Field> fields = record.fields();
        ByteArrayOutputStream directory = new ByteArrayOutputStream(fields.size() * DIRECTORY_ENTRY_LENGTH + 1);
        ByteArrayOutputStream data = new ByteArrayOutputStream(256);
        for (Field f : fields) {
            if (f.tag().length() != TAG_LENGTH) throw new MarcEncodeException("Invalid tag '" + f.tag() + "'");
            int start = data.size();
            if (f instanceof ControlField cf) {
                data.writeBytes(bytes(cf.value(), charset, "field " + cf.tag()));
            } else if (f instanceof DataField df) {
                data.write(singleByte(df.ind1(), charset, df.tag(), "indicator"));
                data.write(singleByte(df.ind2(), charset, df.tag(), "indicator"));
                for (Subfield s : df.subfields()) {
                    data.write(SUBFIELD_DELIMITER);
                    data.write(singleByte(s.code(), charset, df.tag(), "subfield code"));
                    data.writeBytes(bytes(s.value(), charset, "field " + df.tag()));
                }
            }
            data.write(FIELD_TERMINATOR);
            int length = data.size() - start;
            if (length > MAX_FIELD_LENGTH) {
                throw new MarcEncodeException("Field " + f.tag() + " is " + length + " bytes; the limit is " + MAX_FIELD_LENGTH);
            }
            if (start > MAX_FIELD_START) {
                throw new MarcEncodeException("Field " + f.tag() + " starts at " + start + "; the limit is " + MAX_FIELD_START);
            }
            directory.writeBytes(f.tag().getBytes(StandardCharsets.ISO_8859_1));
            directory.writeBytes(pad(length, 4).getBytes(StandardCharsets.US_ASCII));
            directory.writeBytes(pad(start, 5).getBytes(StandardCharsets.US_ASCII));
        }
        directory.write(FIELD_TERMINATOR);
        data.write(RECORD_TERMINATOR);

        int base = LEADER_LENGTH + directory.size();
        int total = base + data.size();
        if (total > MAX_RECORD_LENGTH) {
            throw new MarcEncodeException("Record is " + total + " bytes; the limit is " + MAX_RECORD_LENGTH);
        }
        Leader leader = record.leader().withLengths(total, base);
        byte[] leaderBytes = bytes(leader.value(), StandardCharsets.ISO_8859_1, "leader");
        byte[] out = new byte[total];
        System.arraycopy(leaderBytes, 0, out, 0, LEADER_LENGTH);
        System.arraycopy(directory.toByteArray(), 0, out, LEADER_LENGTH, directory.size());
        System.arraycopy(data.toByteArray(), 0, out, base, data.size());
        return out;
    }

    private static byte[] bytes(String s, Charset charset, String where) {
        for (int i = 0; i < s.length(); i++) {
            if (isStructural(s.charAt(i))) {
                throw new MarcEncodeException("The " + where + " contains the structural character U+"
                        + String.format("%04X", (int) s.charAt(i)));
            }
        }
        if (charset == StandardCharsets.ISO_8859_1) {
            for (int i = 0; i < s.length(); i++) {
                if (s.charAt(i) > 0xFF) {
                    throw new MarcEncodeException("The " + where + " has a character that the record's single byte"
                            + " encoding cannot carry: U+" + String.format("%04X", (int) s.charAt(i)));
                }
            }
        }
        return s.getBytes(charset);
    }

    private static int singleByte(char c, Charset charset, String tag, String what) {
        int max = charset == StandardCharsets.UTF_8 ? 0x7F : 0xFF;
        if (c > max) throw new MarcEncodeException("Field " + tag + " has " + what + " '" + c + "' that does not fit in one byte");
        if (isStructural(c)) {
            throw new MarcEncodeException("Field " + tag + " has " + what + " U+" + String.format("%04X", (int) c)
                    + ", which is a structural character");
        }
        return c;
    }

    /** Subfield delimiter, field terminator and record terminator. */
    private static boolean isStructural(char c) {
        return c == RECORD_TERMINATOR || c == FIELD_TERMINATOR || c == SUBFIELD_DELIMITER;
    }

    private static String pad(int n, int width) {
        String s = Integer.toString(n);
        return "0".repeat(width - s.length()) + s;
    }
}
