package io.marcfilter.marc.model;

import java.util.Objects;

public record Subfield(char code, String value) {
    public Subfield {
        Objects.requireNonNull(value, "value");
    }
}
