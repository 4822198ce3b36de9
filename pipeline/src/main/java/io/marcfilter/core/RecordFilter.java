package io.marcfilter.core;

/**
 * Keep/drop decision for one payload. Implementations must be side-effect free.
 */
@FunctionalInterface
public interface RecordFilter<T> {
    RecordFilter<Object> ACCEPT_ALL = payload -> true;

    boolean test(T payload);

    @SuppressWarnings("unchecked")
    static <T> RecordFilter<T> acceptAll() {
        return (RecordFilter<T>) ACCEPT_ALL;
    }
}
