package io.marcfilter.marc.format;

import io.marcfilter.marc.codec.MarcEncodeException;
import io.marcfilter.marc.model.ControlField;
import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.model.Field;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.model.Subfield;

import java.nio.charset.StandardCharsets;

/**
 * Line-oriented mnemonic form, one field per line:
 * <pre>
 * =LDR  00000nam a2200000 a 4500
 * =001  ocm123
 * =245  10$aTitle$cAuthor
 * </pre>
 * Blank indicators are written as {@code \}; a literal {@code $} in data becomes
 * {@code {dollar}}. Records in a file are separated by a blank line.
 */
public class MarcTextFormat extends RecordFormat {
    public static final String NAME = "text";

    private static final byte[] NEWLINE = {'\n'};

    @Override
    public String name() { return NAME; }

    @Override
    public String extension() { return ".mrk"; }

    @Override
    public byte[] multiSeparator() { return NEWLINE; }

    @Override
    public byte[] encode(MarcRecord record) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("=LDR  ").append(escape(record.leader().value(), "leader")).append('\n');
        for (Field f : record.fields()) {
            sb.append('=').append(f.tag()).append("  ");
            if (f instanceof ControlField cf) {
                sb.append(escape(cf.value(), "field " + cf.tag()));
            } else if (f instanceof DataField df) {
                sb.append(indicator(df.ind1())).append(indicator(df.ind2()));
                for (Subfield s : df.subfields()) {
                    sb.append('$').append(s.code()).append(escape(s.value(), "field " + df.tag()));
                }
            }
            sb.append('\n');
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static char indicator(char c) {
        return c == ' ' ? '\\' : c;
    }

    private static String escape(String value, String where) {
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new MarcEncodeException("The " + where + " contains a line break");
        }
        return value.indexOf('$') < 0 ? value : value.replace("$", "{dollar}");
    }
}
