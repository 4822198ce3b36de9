package io.marcfilter.error;

/**
 * Structured description of one record-scoped failure, for callers to log or act on.
 *
 * @param recordIndex zero-based index of the record in the input, -1 if unknown
 * @param byteOffset  offset of the record within its input stream, -1 if unknown
 * @param stage       pipeline stage that failed: {@code read}, {@code filter}, {@code transform} or {@code write}
 * @param output      name of the output branch involved, empty for the read stage
 * @param reason      human readable cause
 */
public record RecordError(long recordIndex, long byteOffset, String stage, String output, String reason) {
    public static final String STAGE_READ = "read";
    public static final String STAGE_FILTER = "filter";
    public static final String STAGE_TRANSFORM = "transform";
    public static final String STAGE_WRITE = "write";

    public static RecordError of(String stage, String output, RecordException e) {
        return new RecordError(e.recordIndex(), e.byteOffset(), stage, output, String.valueOf(e.getMessage()));
    }
}
