package io.marcfilter.marc.job;

import java.util.List;

/**
 * A filtering job: several outputs fed from one pass over the input.
 *
 * @param outputs       the data sets to produce, in order
 * @param maxPerFile    records per output file, below 1 for one file per output and format
 * @param defaultFormat format used by outputs that name none
 * @param defaultLimit  limit used by outputs that set none, below 1 unlimited
 * @param pretty        pretty-print JSON output
 */
public record JobSpec(List<OutputSpec> outputs, long maxPerFile, String defaultFormat, long defaultLimit, boolean pretty) {
    public static final String DEFAULT_FORMAT = "marc";

    public JobSpec {
        outputs = List.copyOf(outputs);
        if (defaultFormat == null) defaultFormat = DEFAULT_FORMAT;
    }

    public static JobSpec single(OutputSpec output) {
        return new JobSpec(List.of(output), 0, DEFAULT_FORMAT, 0, false);
    }

    public List<String> formatsOf(OutputSpec o) {
        return o.formats().isEmpty() ? List.of(defaultFormat) : o.formats();
    }

    public long limitOf(OutputSpec o) {
        return o.limit() == null ? defaultLimit : o.limit();
    }
}
