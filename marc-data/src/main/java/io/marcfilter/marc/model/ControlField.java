package io.marcfilter.marc.model;

import java.util.Objects;

/**
 * A 00X field: tag plus raw value, no subfield structure.
 */
public record ControlField(String tag, String value) implements Field {
    public ControlField {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isControlField() { return true; }
}
