package io.marcfilter.marc.index;

import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FieldIndexTest {
    private final FieldIndex index = new FieldIndex(Fixtures.computing());

    @Test
    void returns_every_occurrence_of_a_repeated_tag_in_order() {
        List<DataField> subjects = index.occurrences("650");
        assertEquals(2, subjects.size());
        assertEquals("Computer programming.", subjects.get(0).subfields().get(0).value());
        assertEquals("Computer science", subjects.get(1).subfields().get(0).value());
    }

    @Test
    void absent_tags_and_codes_give_empty_lists() {
        assertTrue(index.occurrences("999").isEmpty());
        assertTrue(index.controlValues("005").isEmpty());
        DataField title = index.occurrences("245").get(0);
        assertTrue(index.subfields(title, 'z').isEmpty());
    }

    @Test
    void looks_up_subfield_values_by_code() {
        DataField title = index.occurrences("245").get(0);
        assertEquals(List.of("The art of computer programming /"), index.subfields(title, 'a'));
        assertEquals(List.of("Donald E. Knuth."), index.subfields(title, 'c'));
    }

    @Test
    void control_fields_are_looked_up_by_tag() {
        assertEquals(List.of("rec-cs"), index.controlValues("001"));
        assertTrue(index.occurrences("001").isEmpty());
    }

    @Test
    void views_are_read_only() {
        assertThrows(UnsupportedOperationException.class, () -> index.occurrences("999").add(null));
    }
}
