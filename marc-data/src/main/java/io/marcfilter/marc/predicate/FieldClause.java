package io.marcfilter.marc.predicate;

import io.marcfilter.marc.index.FieldIndex;
import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.model.MarcConstants;

import java.util.List;

/**
 * Leaf of a predicate tree: true when at least one value gathered from the named tags
 * satisfies the operator.
 * <p>
 * Values gathered per occurrence: a control field's raw value; each named subfield value
 * of a data field; or, with no codes named, the data field's subfields joined in order.
 * When a position range is set each value is cut to it first, and values that do not reach
 * the start position are skipped.
 */
public final class FieldClause implements Predicate {
    public static final int NO_POSITION = -1;

    private final List<String> tags;
    private final String codes;
    private final Operator operator;
    private final String operand;
    private final Operator.ValueTest test;
    private final int start;
    private final int end;

    /**
     * @param codes subfield codes to gather, or null/empty for the whole field
     * @param start first character position (inclusive), or {@link #NO_POSITION}
     * @param end   last character position (inclusive), or {@link #NO_POSITION}
     */
    public FieldClause(List<String> tags, String codes, Operator operator, String operand,
                       boolean ignoreCase, int start, int end) {
        this.tags = List.copyOf(tags);
        this.codes = codes == null || codes.isEmpty() ? null : codes;
        this.operator = operator;
        this.operand = operand;
        this.test = operator.bind(operand, ignoreCase);
        this.start = start;
        this.end = end;
    }

    public List<String> tags() { return tags; }
    public String codes() { return codes; }
    public Operator operator() { return operator; }
    public String operand() { return operand; }

    @Override
    public boolean evaluate(FieldIndex index) {
        for (String tag : tags) {
            if (MarcConstants.isControlTag(tag)) {
                for (String v : index.controlValues(tag)) {
                    if (check(v)) return true;
                }
                continue;
            }
            for (DataField field : index.occurrences(tag)) {
                if (codes == null) {
                    if (check(field.joinedValue())) return true;
                    continue;
                }
                for (int i = 0; i < codes.length(); i++) {
                    for (String v : index.subfields(field, codes.charAt(i))) {
                        if (check(v)) return true;
                    }
                }
            }
        }
        return false;
    }

    private boolean check(String value) {
        if (start != NO_POSITION) {
            if (value.length() <= start) return false;
            value = value.substring(start, (int) Math.min((long) end + 1, value.length()));
        }
        return test.test(value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(operator.label()).append('(').append(String.join(",", tags));
        if (codes != null) sb.append('$').append(codes);
        if (start != NO_POSITION) sb.append('/').append(start).append('-').append(end);
        if (operator.requiresOperand()) sb.append(", \"").append(operand).append('"');
        return sb.append(')').toString();
    }
}
