package io.marcfilter.marc.predicate;

import java.util.Locale;

/**
 * Comparison applied to each gathered value of a leaf. Ordering operators read as
 * {@code value OP operand}.
 */
public enum Operator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    MATCHES_PATTERN("matches_pattern"),
    EXISTS("exists"),
    LESS_THAN("less_than"),
    LESS_OR_EQUAL("less_or_equal"),
    GREATER_THAN("greater_than"),
    GREATER_OR_EQUAL("greater_or_equal");

    /** A test bound to one operand. */
    @FunctionalInterface
    public interface ValueTest {
        boolean test(String value);
    }

    private final String label;

    Operator(String label) {
        this.label = label;
    }

    public String label() { return label; }

    public boolean requiresOperand() {
        return this != EXISTS;
    }

    /** Looks up an operator by its label, e.g. {@code starts_with}; null when unknown. */
    public static Operator fromLabel(String label) {
        for (Operator op : values()) {
            if (op.label.equals(label)) return op;
        }
        return null;
    }

    /**
     * Binds this operator to an operand.
     *
     * @throws IllegalArgumentException if the operand is not usable with this operator
     */
    public ValueTest bind(String operand, boolean ignoreCase) {
        if (this == EXISTS) return value -> true;
        if (this == MATCHES_PATTERN) {
            GlobPattern glob = GlobPattern.compile(operand, ignoreCase);
            return glob::matches;
        }
        String expected = ignoreCase ? fold(operand) : operand;
        switch (this) {
            case EQUALS:
                return value -> norm(value, ignoreCase).equals(expected);
            case NOT_EQUALS:
                return value -> !norm(value, ignoreCase).equals(expected);
            case CONTAINS:
                return value -> norm(value, ignoreCase).contains(expected);
            case STARTS_WITH:
                return value -> norm(value, ignoreCase).startsWith(expected);
            case LESS_THAN:
                return value -> compare(norm(value, ignoreCase), expected) < 0;
            case LESS_OR_EQUAL:
                return value -> compare(norm(value, ignoreCase), expected) <= 0;
            case GREATER_THAN:
                return value -> compare(norm(value, ignoreCase), expected) > 0;
            case GREATER_OR_EQUAL:
                return value -> compare(norm(value, ignoreCase), expected) >= 0;
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    /**
     * Numeric when both sides are integers, otherwise by character.
     */
    static int compare(String value, String operand) {
        Long a = asLong(value);
        Long b = asLong(operand);
        if (a != null && b != null) return Long.compare(a, b);
        return value.compareTo(operand);
    }

    private static Long asLong(String s) {
        String t = s.trim();
        if (t.isEmpty() || t.length() > 18) return null;
        int i = (t.charAt(0) == '-' || t.charAt(0) == '+') ? 1 : 0;
        if (i == t.length()) return null;
        for (; i < t.length(); i++) {
            if (!Character.isDigit(t.charAt(i)) || t.charAt(i) > '9') return null;
        }
        return Long.parseLong(t);
    }

    private static String norm(String value, boolean ignoreCase) {
        return ignoreCase ? fold(value) : value;
    }

    private static String fold(String s) {
        return s.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }
}
