package io.marcfilter.marc.predicate;

import io.marcfilter.core.RecordFilter;
import io.marcfilter.marc.index.FieldIndex;
import io.marcfilter.marc.model.MarcRecord;

/**
 * Adapts a compiled {@link Predicate} to the pipeline: builds the record's {@link FieldIndex}
 * and evaluates against it. The index is dropped as soon as the decision is made.
 */
public class MarcRecordFilter implements RecordFilter<MarcRecord> {
    private final Predicate predicate;

    public MarcRecordFilter(Predicate predicate) {
        this.predicate = predicate;
    }

    /** Compiles {@code spec}; null accepts every record. */
    public static MarcRecordFilter compile(Object spec) {
        return new MarcRecordFilter(PredicateCompiler.compile(spec));
    }

    public Predicate predicate() { return predicate; }

    @Override
    public boolean test(MarcRecord record) {
        if (predicate == PredicateCompiler.ACCEPT_ALL) return true;
        return predicate.evaluate(new FieldIndex(record));
    }
}
