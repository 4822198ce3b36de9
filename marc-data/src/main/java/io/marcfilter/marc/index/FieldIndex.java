package io.marcfilter.marc.index;

import io.marcfilter.marc.model.ControlField;
import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.model.Field;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.model.Subfield;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only lookup view over one record: all occurrences of a tag, and the values of a
 * subfield code within an occurrence. Absent tags and codes give empty lists.
 * <p>
 * The tag map is built on first use in one pass over the fields; per-field code maps are
 * built the first time a field is asked for a code. The index lives and dies with its record.
 */
public final class FieldIndex {
    private final MarcRecord record;
    private Map<String, List<DataField>> dataByTag;
    private Map<String, List<String>> controlByTag;
    private final Map<DataField, Map<Character, List<String>>> codesByField = new IdentityHashMap<>();

    public FieldIndex(MarcRecord record) {
        this.record = record;
    }

    public MarcRecord record() { return record; }

    /** Data fields with {@code tag}, in record order. */
    public List<DataField> occurrences(String tag) {
        build();
        return dataByTag.getOrDefault(tag, Collections.emptyList());
    }

    /** Raw values of control fields with {@code tag}, in record order. */
    public List<String> controlValues(String tag) {
        build();
        return controlByTag.getOrDefault(tag, Collections.emptyList());
    }

    /** Values of subfield {@code code} in {@code field}, in field order. */
    public List<String> subfields(DataField field, char code) {
        Map<Character, List<String>> byCode = codesByField.get(field);
        if (byCode == null) {
            byCode = new HashMap<>();
            for (Subfield s : field.subfields()) {
                byCode.computeIfAbsent(s.code(), c -> new ArrayList<>(1)).add(s.value());
            }
            codesByField.put(field, byCode);
        }
        return byCode.getOrDefault(code, Collections.emptyList());
    }

    private void build() {
        if (dataByTag != null) return;
        dataByTag = new HashMap<>();
        controlByTag = new HashMap<>();
        for (Field f : record.fields()) {
            if (f instanceof DataField df) {
                dataByTag.computeIfAbsent(df.tag(), t -> new ArrayList<>(2)).add(df);
            } else if (f instanceof ControlField cf) {
                controlByTag.computeIfAbsent(cf.tag(), t -> new ArrayList<>(1)).add(cf.value());
            }
        }
    }
}
