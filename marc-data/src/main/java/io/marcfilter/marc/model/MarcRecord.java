package io.marcfilter.marc.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One catalog record: leader plus fields in source order.
 * <p>
 * Control and data fields live in a single ordered list so that their relative order survives
 * a decode/encode round trip; {@link #controlFields()} and {@link #dataFields()} are derived views.
 */
public record MarcRecord(Leader leader, List<Field> fields) {
    public MarcRecord {
        Objects.requireNonNull(leader, "leader");
        fields = List.copyOf(fields);
    }

    public List<ControlField> controlFields() {
        List<ControlField> out = new ArrayList<>();
        for (Field f : fields) {
            if (f instanceof ControlField cf) out.add(cf);
        }
        return out;
    }

    public List<DataField> dataFields() {
        List<DataField> out = new ArrayList<>();
        for (Field f : fields) {
            if (f instanceof DataField df) out.add(df);
        }
        return out;
    }

    public MarcRecord withFields(List<Field> newFields) {
        return new MarcRecord(leader, newFields);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Convenience for assembling records in code, mainly fixtures and conversions.
     */
    public static final class Builder {
        private Leader leader = Leader.defaultLeader();
        private final List<Field> fields = new ArrayList<>();

        public Builder leader(Leader l) { this.leader = l; return this; }
        public Builder leader(String l) { this.leader = new Leader(l); return this; }
        public Builder field(Field f) { this.fields.add(f); return this; }
        public Builder controlField(String tag, String value) { return field(new ControlField(tag, value)); }

        /**
         * Adds a data field from {@code ind1 ind2} and alternating code/value pairs,
         * e.g. {@code dataField("245", '1', '0', "a", "Title", "c", "Author")}.
         */
        public Builder dataField(String tag, char ind1, char ind2, String... codesAndValues) {
            if (codesAndValues.length % 2 != 0) {
                throw new IllegalArgumentException("Subfields must be code/value pairs");
            }
            List<Subfield> subs = new ArrayList<>(codesAndValues.length / 2);
            for (int i = 0; i < codesAndValues.length; i += 2) {
                String code = codesAndValues[i];
                if (code.length() != 1) throw new IllegalArgumentException("Subfield code must be one character: " + code);
                subs.add(new Subfield(code.charAt(0), codesAndValues[i + 1]));
            }
            return field(new DataField(tag, ind1, ind2, subs));
        }

        public MarcRecord build() {
            return new MarcRecord(leader, fields);
        }
    }
}
