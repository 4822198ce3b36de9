package io.marcfilter.marc.job;

import io.marcfilter.marc.predicate.SpecCompileException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SpecLoaderTest {
    @TempDir
    Path tmp;

    @Test
    void inline_json_becomes_a_plain_tree() throws Exception {
        Object tree = SpecLoader.load("{\"tag\": \"650\", \"subfield\": \"a\", \"op\": \"equals\", \"value\": \"Computer science\"}");
        assertEquals(Map.of("tag", "650", "subfield", "a", "op", "equals", "value", "Computer science"), tree);
    }

    @Test
    void other_arguments_are_read_as_files() throws Exception {
        Path f = tmp.resolve("filter.json");
        Files.writeString(f, "{\"or\": [{\"tag\": \"100\", \"op\": \"exists\"}, {\"tag\": \"110\", \"op\": \"exists\"}]}");

        Object tree = SpecLoader.load(f.toString());
        assertTrue(tree instanceof Map);
        assertEquals(2, ((List<?>) ((Map<?, ?>) tree).get("or")).size());
    }

    @Test
    void selection_accepts_compact_json_and_file_forms() throws Exception {
        assertEquals("245ab,650", SpecLoader.loadSelection(" 245ab,650 "));
        assertEquals(List.of("245"), SpecLoader.loadSelection("[\"245\"]"));
        Path f = tmp.resolve("select.json");
        Files.writeString(f, "[{\"tag\": \"650\", \"subfields\": \"a\"}]");
        assertEquals(List.of(Map.of("tag", "650", "subfields", "a")), SpecLoader.loadSelection(f.toString()));
    }

    @Test
    void bad_json_is_a_spec_error() {
        SpecCompileException e = assertThrows(SpecCompileException.class, () -> SpecLoader.parse("{\"tag\": "));
        assertEquals(1, e.problems().size());
    }

    @Test
    void job_file_with_defaults_and_overrides() throws Exception {
        Path f = tmp.resolve("job.json");
        Files.writeString(f, "{"
                + "\"max_per_file\": 500, \"default_format\": \"xml\", \"default_limit\": 1000, \"pretty\": true,"
                + "\"outputs\": ["
                + "  {\"name\": \"computing\", \"filter\": {\"tag\": \"650\", \"subfield\": \"a\", \"op\": \"starts_with\", \"value\": \"Computer\"},"
                + "   \"select\": \"245,650a\", \"formats\": [\"marc\", \"json\"], \"limit\": 0},"
                + "  {\"name\": \"everything\"}"
                + "]}");

        JobSpec job = SpecLoader.loadJob(f);

        assertEquals(500, job.maxPerFile());
        assertTrue(job.pretty());
        OutputSpec computing = job.outputs().get(0);
        assertEquals("245,650a", computing.selection());
        assertEquals(List.of("marc", "json"), job.formatsOf(computing));
        assertEquals(0, job.limitOf(computing));
        OutputSpec everything = job.outputs().get(1);
        assertNull(everything.filter());
        assertEquals(List.of("xml"), job.formatsOf(everything));
        assertEquals(1000, job.limitOf(everything));
    }

    @Test
    void structural_job_problems_are_collected() {
        Object tree = SpecLoader.parse("{\"outputz\": [], \"max_per_file\": \"many\"}");

        SpecCompileException e = assertThrows(SpecCompileException.class, () -> SpecLoader.job(tree));
        assertEquals(3, e.problems().size(), e.problems().toString());
    }

    @Test
    void outputs_need_names() {
        Object tree = SpecLoader.parse("{\"outputs\": [{\"filter\": null}, \"x\", {\"name\": \"ok\", \"colour\": 1}]}");

        SpecCompileException e = assertThrows(SpecCompileException.class, () -> SpecLoader.job(tree));
        assertEquals(List.of("$.outputs[0]: missing 'name'", "$.outputs[1]: expected an object",
                "$.outputs[2]: unknown key 'colour'"), e.problems());
    }
}
