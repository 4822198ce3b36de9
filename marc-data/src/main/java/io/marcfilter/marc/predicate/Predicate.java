package io.marcfilter.marc.predicate;

import io.marcfilter.marc.index.FieldIndex;

/**
 * A compiled filter. Evaluation is pure: the same index always gives the same answer.
 */
public interface Predicate {
    boolean evaluate(FieldIndex index);
}
