package io.marcfilter.marc.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marcfilter.marc.predicate.SpecCompileException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads filter, selection and job specifications from JSON into the plain map/list trees the
 * compilers accept. Arguments may be inline JSON or a path to a JSON file.
 */
public final class SpecLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Object> TREE = new TypeReference<>() { };

    static final String OUTPUTS = "outputs";
    static final String NAME = "name";
    static final String FILTER = "filter";
    static final String SELECT = "select";
    static final String FORMATS = "formats";
    static final String LIMIT = "limit";
    static final String MAX_PER_FILE = "max_per_file";
    static final String DEFAULT_FORMAT = "default_format";
    static final String DEFAULT_LIMIT = "default_limit";
    static final String PRETTY = "pretty";

    private static final Set<String> JOB_KEYS = Set.of(OUTPUTS, MAX_PER_FILE, DEFAULT_FORMAT, DEFAULT_LIMIT, PRETTY);
    private static final Set<String> OUTPUT_KEYS = Set.of(NAME, FILTER, SELECT, FORMATS, LIMIT);

    private SpecLoader() { }

    /** Parses JSON text into maps, lists, strings, numbers and booleans. */
    public static Object parse(String json) {
        try {
            return MAPPER.readValue(json, TREE);
        } catch (JsonProcessingException e) {
            throw new SpecCompileException("JSON", List.of(String.valueOf(e.getOriginalMessage())));
        }
    }

    /**
     * Treats {@code arg} as inline JSON when it starts with {@code {} or {@code [}, otherwise as
     * a file to read.
     */
    public static Object load(String arg) throws IOException {
        String trimmed = arg.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) return parse(trimmed);
        return parse(Files.readString(Path.of(arg)));
    }

    /**
     * A selection is either the compact form ({@code 245ab,650}) or JSON inline/in a file.
     */
    public static Object loadSelection(String arg) throws IOException {
        String trimmed = arg.trim();
        if (trimmed.startsWith("[")) return parse(trimmed);
        if (Files.isRegularFile(Path.of(trimmed))) return parse(Files.readString(Path.of(trimmed)));
        return trimmed;
    }

    public static JobSpec loadJob(Path file) throws IOException {
        return job(parse(Files.readString(file)));
    }

    /**
     * @throws SpecCompileException listing every structural problem of the job tree
     */
    public static JobSpec job(Object tree) {
        List<String> problems = new ArrayList<>();
        if (!(tree instanceof Map<?, ?> root)) {
            throw new SpecCompileException("job", List.of("$: expected an object"));
        }
        for (Object k : root.keySet()) {
            if (!JOB_KEYS.contains(String.valueOf(k))) problems.add("$: unknown key '" + k + "'");
        }
        long maxPerFile = number(root.get(MAX_PER_FILE), 0, "$." + MAX_PER_FILE, problems);
        long defaultLimit = number(root.get(DEFAULT_LIMIT), 0, "$." + DEFAULT_LIMIT, problems);
        Object df = root.get(DEFAULT_FORMAT);
        String defaultFormat = df instanceof String s ? s : JobSpec.DEFAULT_FORMAT;
        if (df != null && !(df instanceof String)) problems.add("$." + DEFAULT_FORMAT + ": expected a format name");
        boolean pretty = Boolean.TRUE.equals(root.get(PRETTY));

        List<OutputSpec> outputs = new ArrayList<>();
        Object rawOutputs = root.get(OUTPUTS);
        if (!(rawOutputs instanceof List<?> list) || list.isEmpty()) {
            problems.add("$." + OUTPUTS + ": expected a non-empty list");
        } else {
            for (int i = 0; i < list.size(); i++) {
                OutputSpec o = output(list.get(i), "$." + OUTPUTS + "[" + i + "]", problems);
                if (o != null) outputs.add(o);
            }
        }
        if (!problems.isEmpty()) throw new SpecCompileException("job", problems);
        return new JobSpec(outputs, maxPerFile, defaultFormat, defaultLimit, pretty);
    }

    private static OutputSpec output(Object item, String path, List<String> problems) {
        if (!(item instanceof Map<?, ?> m)) {
            problems.add(path + ": expected an object");
            return null;
        }
        for (Object k : m.keySet()) {
            if (!OUTPUT_KEYS.contains(String.valueOf(k))) problems.add(path + ": unknown key '" + k + "'");
        }
        if (!(m.get(NAME) instanceof String name) || name.isBlank()) {
            problems.add(path + ": missing '" + NAME + "'");
            return null;
        }
        List<String> formats = new ArrayList<>();
        Object f = m.get(FORMATS);
        if (f instanceof String s) {
            formats.add(s);
        } else if (f instanceof List<?> l) {
            for (Object o : l) formats.add(String.valueOf(o));
        } else if (f != null) {
            problems.add(path + "." + FORMATS + ": expected a format name or list of names");
        }
        Long limit = m.containsKey(LIMIT) ? number(m.get(LIMIT), 0, path + "." + LIMIT, problems) : null;
        return new OutputSpec(name, m.get(FILTER), m.get(SELECT), formats, limit);
    }

    private static long number(Object value, long fallback, String path, List<String> problems) {
        if (value == null) return fallback;
        if (value instanceof Number n) return n.longValue();
        problems.add(path + ": expected a number");
        return fallback;
    }
}
