package io.marcfilter.marc.projection;

import io.marcfilter.marc.model.MarcConstants;
import io.marcfilter.marc.predicate.SpecCompileException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which data fields (and optionally which of their subfield codes) to keep.
 * <p>
 * Accepted forms: the compact string {@code "245ab,650,100a"} (tag then optional codes), or a
 * list of {@code {"tag": "245", "subfields": "ab"}} objects. Naming a tag twice merges its codes;
 * naming it once without codes keeps the whole field.
 */
public final class SelectionSpec {
    public static final String TAG = "tag";
    public static final String SUBFIELDS = "subfields";
    private static final Set<String> ENTRY_KEYS = Set.of(TAG, SUBFIELDS);

    // tag -> codes to keep, null for the whole field
    private final Map<String, String> entries;

    private SelectionSpec(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public Set<String> tags() { return entries.keySet(); }

    public boolean selects(String tag) {
        return entries.containsKey(tag);
    }

    /** Codes to keep for {@code tag}, or null when the whole field is kept. */
    public String codes(String tag) {
        return entries.get(tag);
    }

    /**
     * @return null when {@code spec} is null
     * @throws SpecCompileException listing every problem found
     */
    public static SelectionSpec parse(Object spec) {
        if (spec == null) return null;
        List<String> problems = new ArrayList<>();
        Map<String, String> entries = new LinkedHashMap<>();
        if (spec instanceof String s) {
            String[] parts = s.split(",");
            for (int i = 0; i < parts.length; i++) {
                String part = parts[i].trim();
                if (part.length() < MarcConstants.TAG_LENGTH) {
                    problems.add("$[" + i + "]: invalid entry '" + part + "'");
                    continue;
                }
                String tag = part.substring(0, MarcConstants.TAG_LENGTH);
                String codes = part.substring(MarcConstants.TAG_LENGTH);
                add(entries, tag, codes.isEmpty() ? null : codes, "$[" + i + "]", problems);
            }
        } else if (spec instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                String path = "$[" + i + "]";
                Object item = list.get(i);
                if (item instanceof String s) {
                    add(entries, s, null, path, problems);
                    continue;
                }
                if (!(item instanceof Map<?, ?> m)) {
                    problems.add(path + ": expected an object");
                    continue;
                }
                for (Object k : m.keySet()) {
                    if (!ENTRY_KEYS.contains(String.valueOf(k))) problems.add(path + ": unknown key '" + k + "'");
                }
                Object tag = m.get(TAG);
                if (!(tag instanceof String t)) {
                    problems.add(path + ": missing '" + TAG + "'");
                    continue;
                }
                Object codes = m.get(SUBFIELDS);
                String c = null;
                if (codes instanceof String cs) {
                    c = cs.isEmpty() ? null : cs;
                } else if (codes instanceof List<?> cl) {
                    StringBuilder sb = new StringBuilder();
                    for (Object o : cl) sb.append(o);
                    c = sb.length() == 0 ? null : sb.toString();
                } else if (codes != null) {
                    problems.add(path + "." + SUBFIELDS + ": expected subfield codes");
                }
                add(entries, t, c, path, problems);
            }
        } else {
            problems.add("$: expected a string or a list of entries");
        }
        if (entries.isEmpty() && problems.isEmpty()) problems.add("$: selects nothing");
        if (!problems.isEmpty()) throw new SpecCompileException("selection", problems);
        return new SelectionSpec(entries);
    }

    private static void add(Map<String, String> entries, String tag, String codes, String path, List<String> problems) {
        if (!MarcConstants.isValidTag(tag)) {
            problems.add(path + ": invalid tag '" + tag + "'");
            return;
        }
        if (!entries.containsKey(tag)) {
            entries.put(tag, codes);
            return;
        }
        String existing = entries.get(tag);
        if (existing == null || codes == null) {
            entries.put(tag, null);
        } else {
            entries.put(tag, existing + codes);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : entries.entrySet()) {
            if (sb.length() > 0) sb.append(',');
            sb.append(e.getKey());
            if (e.getValue() != null) sb.append(e.getValue());
        }
        return sb.toString();
    }
}
