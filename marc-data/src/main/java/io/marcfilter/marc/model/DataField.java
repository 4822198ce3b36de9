package io.marcfilter.marc.model;

import java.util.List;
import java.util.Objects;

/**
 * A data field: tag, two indicator characters and an ordered list of subfields.
 * Subfield codes may repeat; order is significant and preserved.
 */
public record DataField(String tag, char ind1, char ind2, List<Subfield> subfields) implements Field {
    public DataField {
        Objects.requireNonNull(tag, "tag");
        subfields = List.copyOf(subfields);
    }

    @Override
    public boolean isControlField() { return false; }

    /** All subfield values concatenated in field order. */
    public String joinedValue() {
        if (subfields.size() == 1) return subfields.get(0).value();
        StringBuilder sb = new StringBuilder();
        for (Subfield s : subfields) sb.append(s.value());
        return sb.toString();
    }

    public DataField withSubfields(List<Subfield> kept) {
        return new DataField(tag, ind1, ind2, kept);
    }
}
