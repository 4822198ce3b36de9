package io.marcfilter.config;

/**
 * Run-wide settings for a pipeline.
 *
 * @param maxErrors         record failures tolerated before the run aborts; -1 for unlimited, 0 to fail fast
 * @param logEvery          log a progress line every this many input records; below 1 disables progress lines
 * @param maxRecordedErrors cap on error descriptors kept in the result; failures past it are still counted
 * @param threads           worker threads for sharded runs
 */
public record PipelineConfig(
        long maxErrors,
        long logEvery,
        int maxRecordedErrors,
        int threads
) {
    public static final PipelineConfig DEFAULTS = new PipelineConfig(-1, 10_000, 1_000, 1);

    public static PipelineConfig fromEnv() {
        long maxErrors = Long.parseLong(System.getProperty("marcfilter.maxErrors", System.getenv().getOrDefault("MARCFILTER_MAX_ERRORS", "-1")));
        long logEvery = Long.parseLong(System.getProperty("marcfilter.logEvery", System.getenv().getOrDefault("MARCFILTER_LOG_EVERY", "10000")));
        int kept = Integer.parseInt(System.getProperty("marcfilter.maxRecordedErrors", System.getenv().getOrDefault("MARCFILTER_MAX_RECORDED_ERRORS", "1000")));
        int threads = Integer.parseInt(System.getProperty("marcfilter.threads", System.getenv().getOrDefault("MARCFILTER_THREADS", "1")));
        return new PipelineConfig(maxErrors, logEvery, kept, threads);
    }

    public PipelineConfig withMaxErrors(long value) { return new PipelineConfig(value, logEvery, maxRecordedErrors, threads); }
    public PipelineConfig withLogEvery(long value) { return new PipelineConfig(maxErrors, value, maxRecordedErrors, threads); }
    public PipelineConfig withThreads(int value) { return new PipelineConfig(maxErrors, logEvery, maxRecordedErrors, value); }
}
