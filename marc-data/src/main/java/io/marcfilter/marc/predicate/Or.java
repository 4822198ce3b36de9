package io.marcfilter.marc.predicate;

import io.marcfilter.marc.index.FieldIndex;

import java.util.List;

/**
 * True when any child is true. Children run left to right and evaluation stops at the first true one.
 */
public final class Or implements Predicate {
    private final List<Predicate> children;

    public Or(List<Predicate> children) {
        this.children = List.copyOf(children);
    }

    public List<Predicate> children() { return children; }

    @Override
    public boolean evaluate(FieldIndex index) {
        for (Predicate p : children) {
            if (p.evaluate(index)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "Or" + children;
    }
}
