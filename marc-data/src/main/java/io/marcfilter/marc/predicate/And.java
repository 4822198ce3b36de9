package io.marcfilter.marc.predicate;

import io.marcfilter.marc.index.FieldIndex;

import java.util.List;

/**
 * True when every child is true. Children run left to right and evaluation stops at the first false one.
 */
public final class And implements Predicate {
    private final List<Predicate> children;

    public And(List<Predicate> children) {
        this.children = List.copyOf(children);
    }

    public List<Predicate> children() { return children; }

    @Override
    public boolean evaluate(FieldIndex index) {
        for (Predicate p : children) {
            if (!p.evaluate(index)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "And" + children;
    }
}
