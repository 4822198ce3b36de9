package io.marcfilter.marc.job;

import java.util.List;
import java.util.Objects;

/**
 * One named data set of a job.
 *
 * @param name      directory and file name stem for this output
 * @param filter    filter specification tree, null to keep every record
 * @param selection selection specification (compact string or list), null to keep whole records
 * @param formats   format names; empty means the job default
 * @param limit     maximum records to write, below 1 unlimited, null for the job default
 */
public record OutputSpec(String name, Object filter, Object selection, List<String> formats, Long limit) {
    public OutputSpec {
        Objects.requireNonNull(name, "name");
        formats = formats == null ? List.of() : List.copyOf(formats);
    }

    public static OutputSpec of(String name, Object filter) {
        return new OutputSpec(name, filter, null, List.of(), null);
    }
}
