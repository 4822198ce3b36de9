package io.marcfilter.runtime;

/**
 * Where a {@link Pipeline} currently is. Per record the driver moves
 * READING -> DECIDING -> (PROJECTING -> ENCODING) -> READING, skipping the bracketed part on
 * a drop; DRAINING once input ends or every output is closed, then DONE.
 */
public enum PipelineState {
    IDLE,
    READING,
    DECIDING,
    PROJECTING,
    ENCODING,
    DRAINING,
    DONE
}
