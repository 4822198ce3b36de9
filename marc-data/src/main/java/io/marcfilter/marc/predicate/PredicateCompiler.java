package io.marcfilter.marc.predicate;

import io.marcfilter.marc.model.MarcConstants;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.marcfilter.marc.predicate.FilterSpec.AND;
import static io.marcfilter.marc.predicate.FilterSpec.IGNORE_CASE;
import static io.marcfilter.marc.predicate.FilterSpec.NOT;
import static io.marcfilter.marc.predicate.FilterSpec.OP;
import static io.marcfilter.marc.predicate.FilterSpec.OR;
import static io.marcfilter.marc.predicate.FilterSpec.POSITIONS;
import static io.marcfilter.marc.predicate.FilterSpec.SUBFIELD;
import static io.marcfilter.marc.predicate.FilterSpec.TAG;
import static io.marcfilter.marc.predicate.FilterSpec.VALUE;

/**
 * Turns a filter specification tree (maps, lists, strings, numbers, booleans) into a
 * {@link Predicate}.
 * <p>
 * The whole tree is validated in one pass; if anything is wrong a single
 * {@link SpecCompileException} lists every problem with its path, e.g. {@code $.and[1].op}.
 * A null specification compiles to {@link #ACCEPT_ALL}.
 */
public final class PredicateCompiler {
    public static final Predicate ACCEPT_ALL = index -> true;

    private static final Set<String> LEAF_KEYS = Set.of(TAG, SUBFIELD, OP, VALUE, IGNORE_CASE, POSITIONS);

    private PredicateCompiler() { }

    public static Predicate compile(Object spec) {
        if (spec == null) return ACCEPT_ALL;
        List<String> problems = new ArrayList<>();
        Predicate p = node(spec, "$", problems);
        if (!problems.isEmpty()) throw new SpecCompileException("filter", problems);
        return p;
    }

    private static Predicate node(Object spec, String path, List<String> problems) {
        if (!(spec instanceof Map<?, ?> map)) {
            problems.add(path + ": expected an object but found " + describe(spec));
            return null;
        }
        if (map.containsKey(AND) || map.containsKey(OR) || map.containsKey(NOT)) {
            if (map.size() != 1) {
                problems.add(path + ": a combinator must be the only key of its object, found " + map.keySet());
                return null;
            }
            Map.Entry<?, ?> e = map.entrySet().iterator().next();
            String kind = String.valueOf(e.getKey());
            if (NOT.equals(kind)) {
                Predicate child = node(e.getValue(), path + "." + NOT, problems);
                return child == null ? null : new Not(child);
            }
            List<Predicate> children = children(e.getValue(), path + "." + kind, problems);
            if (children == null) return null;
            return AND.equals(kind) ? new And(children) : new Or(children);
        }
        return leaf(map, path, problems);
    }

    private static List<Predicate> children(Object value, String path, List<String> problems) {
        if (!(value instanceof List<?> list)) {
            problems.add(path + ": expected a list of conditions but found " + describe(value));
            return null;
        }
        if (list.isEmpty()) {
            problems.add(path + ": needs at least one condition");
            return null;
        }
        List<Predicate> out = new ArrayList<>(list.size());
        boolean ok = true;
        for (int i = 0; i < list.size(); i++) {
            Predicate p = node(list.get(i), path + "[" + i + "]", problems);
            if (p == null) ok = false; else out.add(p);
        }
        return ok ? out : null;
    }

    private static Predicate leaf(Map<?, ?> map, String path, List<String> problems) {
        int before = problems.size();
        for (Object key : map.keySet()) {
            if (!LEAF_KEYS.contains(String.valueOf(key))) {
                problems.add(path + ": unknown key '" + key + "'");
            }
        }

        List<String> tags = tags(map.get(TAG), path + "." + TAG, problems);

        String codes = null;
        Object sub = map.get(SUBFIELD);
        if (sub instanceof String s) {
            codes = s;
        } else if (sub instanceof List<?> l) {
            StringBuilder sb = new StringBuilder();
            for (Object o : l) sb.append(o);
            codes = sb.toString();
        } else if (sub != null) {
            problems.add(path + "." + SUBFIELD + ": expected subfield codes but found " + describe(sub));
        }

        Operator op = null;
        Object opValue = map.get(OP);
        if (opValue == null) {
            problems.add(path + ": missing '" + OP + "'");
        } else {
            op = Operator.fromLabel(String.valueOf(opValue));
            if (op == null) problems.add(path + "." + OP + ": unknown operator '" + opValue + "'");
        }

        Object rawValue = map.get(VALUE);
        String operand = null;
        if (rawValue instanceof String || rawValue instanceof Number) {
            operand = String.valueOf(rawValue);
        } else if (rawValue != null) {
            problems.add(path + "." + VALUE + ": expected a string or number but found " + describe(rawValue));
        }
        if (op != null && op.requiresOperand() && rawValue == null) {
            problems.add(path + ": operator '" + op.label() + "' needs a '" + VALUE + "'");
        }

        boolean ignoreCase = false;
        Object ic = map.get(IGNORE_CASE);
        if (ic instanceof Boolean b) {
            ignoreCase = b;
        } else if (ic != null) {
            problems.add(path + "." + IGNORE_CASE + ": expected true or false but found " + describe(ic));
        }

        int[] range = positions(map.get(POSITIONS), path + "." + POSITIONS, problems);

        if (op == Operator.MATCHES_PATTERN && operand != null) {
            try {
                GlobPattern.compile(operand, ignoreCase);
            } catch (IllegalArgumentException e) {
                problems.add(path + "." + VALUE + ": " + e.getMessage());
            }
        }
        if (problems.size() > before) return null;
        return new FieldClause(tags, codes, op, operand, ignoreCase, range[0], range[1]);
    }

    private static List<String> tags(Object value, String path, List<String> problems) {
        List<String> raw = new ArrayList<>();
        if (value == null) {
            problems.add(path + ": missing");
            return raw;
        }
        if (value instanceof String s) {
            for (String part : s.split(",")) raw.add(part.trim());
        } else if (value instanceof List<?> l) {
            for (Object o : l) raw.add(String.valueOf(o).trim());
        } else {
            problems.add(path + ": expected a tag or list of tags but found " + describe(value));
            return raw;
        }
        if (raw.isEmpty()) problems.add(path + ": no tags given");
        for (String t : raw) {
            if (!MarcConstants.isValidTag(t)) problems.add(path + ": invalid tag '" + t + "'");
        }
        return raw;
    }

    private static int[] positions(Object value, String path, List<String> problems) {
        int[] none = {FieldClause.NO_POSITION, FieldClause.NO_POSITION};
        if (value == null) return none;
        if (value instanceof Number n) {
            long p = n.longValue();
            if (p < 0 || p > Integer.MAX_VALUE) {
                problems.add(path + ": position " + n + " is out of range");
                return none;
            }
            return new int[]{(int) p, (int) p};
        }
        if (!(value instanceof List<?> l) || l.size() != 2
                || !(l.get(0) instanceof Number) || !(l.get(1) instanceof Number)) {
            problems.add(path + ": expected [start, end] but found " + describe(value));
            return none;
        }
        long start = ((Number) l.get(0)).longValue();
        long end = ((Number) l.get(1)).longValue();
        if (start < 0 || end < start || end > Integer.MAX_VALUE) {
            problems.add(path + ": invalid range [" + l.get(0) + ", " + l.get(1) + "]");
            return none;
        }
        return new int[]{(int) start, (int) end};
    }

    private static String describe(Object o) {
        if (o == null) return "nothing";
        if (o instanceof Map) return "an object";
        if (o instanceof List) return "a list";
        if (o instanceof String s) return "\"" + s + "\"";
        return String.valueOf(o);
    }
}
