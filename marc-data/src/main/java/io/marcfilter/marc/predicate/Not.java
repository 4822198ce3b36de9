package io.marcfilter.marc.predicate;

import io.marcfilter.marc.index.FieldIndex;

import java.util.Objects;

public final class Not implements Predicate {
    private final Predicate child;

    public Not(Predicate child) {
        this.child = Objects.requireNonNull(child);
    }

    public Predicate child() { return child; }

    @Override
    public boolean evaluate(FieldIndex index) {
        return !child.evaluate(index);
    }

    @Override
    public String toString() {
        return "Not[" + child + "]";
    }
}
