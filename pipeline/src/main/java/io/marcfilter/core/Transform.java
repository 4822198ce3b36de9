package io.marcfilter.core;

/**
 * Transform converts an input record into exactly one output record.
 * Implementations must preserve the input's seq and offset in the output.
 */
@FunctionalInterface
public interface Transform<I, O> {
    Record<O> apply(Record<I> input);
}
