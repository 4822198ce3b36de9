package io.marcfilter.marc.projection;

import io.marcfilter.core.Record;
import io.marcfilter.core.Transform;
import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.model.Field;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.model.Subfield;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces a record to the fields named by a {@link SelectionSpec}.
 * <p>
 * The leader and control fields always survive. Data fields survive when their tag is
 * selected; if codes are named only those subfields are kept, and a field left with no
 * subfields is dropped. Order is never changed. Without a selection the record is returned
 * as is.
 */
public class FieldProjector implements Transform<MarcRecord, MarcRecord> {
    private final SelectionSpec selection;

    public FieldProjector(SelectionSpec selection) {
        this.selection = selection;
    }

    public static FieldProjector identity() {
        return new FieldProjector(null);
    }

    @Override
    public Record<MarcRecord> apply(Record<MarcRecord> input) {
        if (selection == null) return input;
        return input.withPayload(project(input.payload()));
    }

    public MarcRecord project(MarcRecord record) {
        if (selection == null) return record;
        List<Field> kept = new ArrayList<>(record.fields().size());
        for (Field f : record.fields()) {
            if (!(f instanceof DataField df)) {
                kept.add(f);
                continue;
            }
            if (!selection.selects(df.tag())) continue;
            String codes = selection.codes(df.tag());
            if (codes == null) {
                kept.add(df);
                continue;
            }
            List<Subfield> subs = new ArrayList<>(df.subfields().size());
            for (Subfield s : df.subfields()) {
                if (codes.indexOf(s.code()) >= 0) subs.add(s);
            }
            if (subs.isEmpty()) continue;
            kept.add(subs.size() == df.subfields().size() ? df : df.withSubfields(subs));
        }
        return record.withFields(kept);
    }
}
