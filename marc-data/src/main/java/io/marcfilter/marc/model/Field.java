package io.marcfilter.marc.model;

/**
 * A variable field of a record: either a {@link ControlField} or a {@link DataField}.
 */
public interface Field {
    String tag();

    boolean isControlField();
}
