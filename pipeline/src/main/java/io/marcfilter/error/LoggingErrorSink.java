package io.marcfilter.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits every record failure as a WARN line via SLF4J.
 */
public final class LoggingErrorSink implements ErrorSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingErrorSink.class);

    @Override
    public void accept(RecordError error) {
        if (error.output().isEmpty()) {
            log.warn("Record {} at offset {} failed in {}: {}",
                    error.recordIndex(), error.byteOffset(), error.stage(), error.reason());
        } else {
            log.warn("Record {} at offset {} failed in {} for output '{}': {}",
                    error.recordIndex(), error.byteOffset(), error.stage(), error.output(), error.reason());
        }
    }
}
