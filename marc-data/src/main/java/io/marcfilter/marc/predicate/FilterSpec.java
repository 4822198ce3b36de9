package io.marcfilter.marc.predicate;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for filter specifications in their tree form: nested maps and lists, the same
 * shape Jackson produces when reading the JSON form.
 * <pre>
 * {"and": [{"tag": "650", "subfield": "a", "op": "equals", "value": "Computer science"},
 *          {"not": {"tag": "008", "positions": [7, 10], "op": "less_than", "value": "1990"}}]}
 * </pre>
 */
public final class FilterSpec {
    public static final String AND = "and";
    public static final String OR = "or";
    public static final String NOT = "not";
    public static final String TAG = "tag";
    public static final String SUBFIELD = "subfield";
    public static final String OP = "op";
    public static final String VALUE = "value";
    public static final String IGNORE_CASE = "ignore_case";
    public static final String POSITIONS = "positions";

    private FilterSpec() { }

    public static Map<String, Object> and(Object... children) {
        return Map.of(AND, Arrays.asList(children));
    }

    public static Map<String, Object> or(Object... children) {
        return Map.of(OR, Arrays.asList(children));
    }

    public static Map<String, Object> not(Object child) {
        return Map.of(NOT, child);
    }

    public static Map<String, Object> leaf(String tag, String subfield, String op, String value) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(TAG, tag);
        if (subfield != null) m.put(SUBFIELD, subfield);
        m.put(OP, op);
        if (value != null) m.put(VALUE, value);
        return m;
    }

    public static Map<String, Object> exists(String tag, String subfield) {
        return leaf(tag, subfield, Operator.EXISTS.label(), null);
    }

    public static Map<String, Object> equalsValue(String tag, String subfield, String value) {
        return leaf(tag, subfield, Operator.EQUALS.label(), value);
    }

    /** Returns a copy of {@code leaf} restricted to character positions {@code start..end}. */
    public static Map<String, Object> atPositions(Map<String, Object> leaf, int start, int end) {
        Map<String, Object> m = new LinkedHashMap<>(leaf);
        m.put(POSITIONS, List.of(start, end));
        return m;
    }

    public static Map<String, Object> ignoringCase(Map<String, Object> leaf) {
        Map<String, Object> m = new LinkedHashMap<>(leaf);
        m.put(IGNORE_CASE, true);
        return m;
    }
}
