package io.marcfilter.marc.predicate;

import io.marcfilter.marc.index.FieldIndex;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.marcfilter.marc.predicate.FilterSpec.*;
import static org.junit.jupiter.api.Assertions.*;

public class PredicateEvaluationTest {

    private static boolean eval(Object spec, MarcRecord record) {
        return PredicateCompiler.compile(spec).evaluate(new FieldIndex(record));
    }

    @Test
    void leaf_holds_when_any_occurrence_matches() {
        // first 650 does not match, second does
        assertTrue(eval(equalsValue("650", "a", "Computer science"), Fixtures.computing()));
        assertFalse(eval(equalsValue("650", "a", "Computer science"), Fixtures.history()));
    }

    @Test
    void absent_field_or_subfield_is_false_for_every_operator() {
        MarcRecord r = Fixtures.noSubjectTerm();
        for (Operator op : Operator.values()) {
            String value = op.requiresOperand() ? "x" : null;
            assertFalse(eval(leaf("999", null, op.label(), value), r), op.label() + " on absent tag");
            assertFalse(eval(leaf("650", "a", op.label(), value), r), op.label() + " on absent code");
        }
    }

    @Test
    void exists_needs_the_named_subfield() {
        assertFalse(eval(exists("650", "a"), Fixtures.noSubjectTerm()));
        assertTrue(eval(exists("650", null), Fixtures.noSubjectTerm()));
        assertTrue(eval(exists("650", "x"), Fixtures.noSubjectTerm()));
    }

    @Test
    void without_codes_the_joined_field_value_is_tested() {
        assertTrue(eval(leaf("245", null, "equals", "The art of computer programming /Donald E. Knuth."), Fixtures.computing()));
        assertTrue(eval(leaf("245", null, "contains", "programming /Donald"), Fixtures.computing()));
    }

    @Test
    void several_codes_are_checked_one_by_one() {
        assertTrue(eval(leaf("245", "ac", "starts_with", "Donald"), Fixtures.computing()));
        assertFalse(eval(leaf("245", "a", "starts_with", "Donald"), Fixtures.computing()));
    }

    @Test
    void several_tags_in_one_leaf() {
        assertTrue(eval(leaf("600,650,651", "a", "equals", "Europe"), Fixtures.history()));
        assertTrue(eval(existsAny(List.of("100", "700")), Fixtures.computing()));
    }

    private static Object existsAny(List<String> tags) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(TAG, tags);
        m.put(OP, "exists");
        return m;
    }

    @Test
    void control_field_value_and_character_positions() {
        // 008/07-10 is date 1
        Object after1990 = atPositions(leaf("008", null, "greater_than", "1990"), 7, 10);
        assertFalse(eval(after1990, Fixtures.computing()));
        assertTrue(eval(after1990, Fixtures.history()));
        assertTrue(eval(atPositions(leaf("008", null, "equals", "enk"), 15, 17), Fixtures.history()));
    }

    @Test
    void values_shorter_than_the_start_position_are_skipped() {
        assertFalse(eval(atPositions(exists("001", null), 20, 25), Fixtures.history()));
        assertTrue(eval(atPositions(leaf("001", null, "equals", "hist"), 4, 40), Fixtures.history()));
    }

    @Test
    void range_ending_at_the_largest_position_reads_to_the_end_of_the_value() {
        assertTrue(eval(atPositions(equalsValue("245", "a", "The art of computer programming /"), 0, Integer.MAX_VALUE),
                Fixtures.computing()));
        assertTrue(eval(atPositions(equalsValue("245", "a", "art of computer programming /"), 4, Integer.MAX_VALUE),
                Fixtures.computing()));
    }

    @Test
    void case_is_respected_unless_ignored() {
        Map<String, Object> lower = leaf("650", "a", "equals", "computer science");
        assertFalse(eval(lower, Fixtures.computing()));
        assertTrue(eval(ignoringCase(lower), Fixtures.computing()));
    }

    @Test
    void glob_patterns() {
        assertTrue(eval(leaf("245", "a", "matches_pattern", "*computer*"), Fixtures.computing()));
        assertFalse(eval(leaf("245", "a", "matches_pattern", "computer*"), Fixtures.computing()));
        assertTrue(eval(leaf("001", null, "matches_pattern", "rec-??"), Fixtures.computing()));
    }

    @Test
    void numeric_ordering_when_both_sides_are_numbers() {
        MarcRecord r = MarcRecord.builder().dataField("300", ' ', ' ', "a", "95").build();
        assertTrue(eval(leaf("300", "a", "less_than", "100"), r));
        assertTrue(eval(leaf("300", "a", "greater_or_equal", "95"), r));
        assertFalse(eval(leaf("300", "a", "not_equals", "95"), r));
        // text comparison when one side is not a number
        assertFalse(eval(leaf("300", "a", "less_than", "100a"), r));
    }

    @Test
    void combinators() {
        Object cs = equalsValue("650", "a", "Computer science");
        Object eu = equalsValue("650", "a", "Europe");
        assertTrue(eval(or(cs, eu), Fixtures.history()));
        assertFalse(eval(and(cs, eu), Fixtures.computing()));
        assertTrue(eval(and(cs, not(eu)), Fixtures.computing()));
        assertTrue(eval(not(exists("650", "a")), Fixtures.noSubjectTerm()));
    }

    @Test
    void and_stops_at_the_first_false_child() {
        AtomicInteger calls = new AtomicInteger();
        Predicate explosive = index -> {
            calls.incrementAndGet();
            throw new IllegalStateException("must not be evaluated");
        };
        Predicate falseLeaf = PredicateCompiler.compile(exists("999", null));
        Predicate trueLeaf = PredicateCompiler.compile(exists("245", null));
        FieldIndex index = new FieldIndex(Fixtures.computing());

        assertFalse(new And(List.of(falseLeaf, explosive)).evaluate(index));
        assertTrue(new Or(List.of(trueLeaf, explosive)).evaluate(index));
        assertEquals(0, calls.get());
        assertThrows(IllegalStateException.class, () -> new And(List.of(trueLeaf, explosive)).evaluate(index));
    }

    @Test
    void missing_filter_keeps_everything() {
        assertTrue(MarcRecordFilter.compile(null).test(Fixtures.noSubjectTerm()));
    }
}
