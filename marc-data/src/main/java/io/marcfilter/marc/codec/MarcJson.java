package io.marcfilter.marc.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marcfilter.marc.model.ControlField;
import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.model.Field;
import io.marcfilter.marc.model.Leader;
import io.marcfilter.marc.model.MarcConstants;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.model.Subfield;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static io.marcfilter.marc.model.MarcConstants.FIELDS_LABEL;
import static io.marcfilter.marc.model.MarcConstants.IND1_LABEL;
import static io.marcfilter.marc.model.MarcConstants.IND2_LABEL;
import static io.marcfilter.marc.model.MarcConstants.LEADER_LABEL;
import static io.marcfilter.marc.model.MarcConstants.SUBFIELDS_LABEL;

/**
 * Maps records to and from the MARC-in-JSON tree:
 * <pre>
 * {"leader": "...", "fields": [{"001": "value"},
 *   {"245": {"ind1": "1", "ind2": "0", "subfields": [{"a": "Title"}]}}]}
 * </pre>
 */
public final class MarcJson {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private MarcJson() { }

    public static ObjectNode toJson(MarcRecord record) {
        ObjectNode root = NODES.objectNode();
        root.put(LEADER_LABEL, record.leader().value());
        ArrayNode fields = root.putArray(FIELDS_LABEL);
        for (Field f : record.fields()) {
            ObjectNode entry = fields.addObject();
            if (f instanceof ControlField cf) {
                entry.put(cf.tag(), cf.value());
            } else if (f instanceof DataField df) {
                ObjectNode body = entry.putObject(df.tag());
                body.put(IND1_LABEL, String.valueOf(df.ind1()));
                body.put(IND2_LABEL, String.valueOf(df.ind2()));
                ArrayNode subs = body.putArray(SUBFIELDS_LABEL);
                for (Subfield s : df.subfields()) {
                    subs.addObject().put(String.valueOf(s.code()), s.value());
                }
            }
        }
        return root;
    }

    /**
     * @throws IllegalArgumentException when the tree is not a MARC-in-JSON record
     */
    public static MarcRecord fromJson(JsonNode node) {
        if (node == null || !node.isObject()) throw new IllegalArgumentException("Record must be a JSON object");
        JsonNode leader = node.get(LEADER_LABEL);
        if (leader == null || !leader.isTextual()) throw new IllegalArgumentException("Record has no leader");
        JsonNode fieldsNode = node.get(FIELDS_LABEL);
        if (fieldsNode != null && !fieldsNode.isArray()) throw new IllegalArgumentException("'fields' must be an array");
        List<Field> fields = new ArrayList<>();
        if (fieldsNode != null) {
            for (JsonNode entry : fieldsNode) {
                if (!entry.isObject() || entry.size() != 1) {
                    throw new IllegalArgumentException("Each field must be an object with exactly one tag");
                }
                Map.Entry<String, JsonNode> only = entry.fields().next();
                fields.add(field(only.getKey(), only.getValue()));
            }
        }
        return new MarcRecord(new Leader(leader.textValue()), fields);
    }

    private static Field field(String tag, JsonNode value) {
        if (tag.length() != 3) throw new IllegalArgumentException("Invalid tag '" + tag + "'");
        if (MarcConstants.isControlTag(tag)) {
            if (!value.isTextual()) throw new IllegalArgumentException("Control field " + tag + " must be a string");
            return new ControlField(tag, value.textValue());
        }
        if (!value.isObject()) {
            throw new IllegalArgumentException("Data field " + tag + " must be an object with indicators and subfields");
        }
        char ind1 = indicator(tag, value.get(IND1_LABEL));
        char ind2 = indicator(tag, value.get(IND2_LABEL));
        JsonNode subsNode = value.get(SUBFIELDS_LABEL);
        List<Subfield> subs = new ArrayList<>();
        if (subsNode != null) {
            if (!subsNode.isArray()) throw new IllegalArgumentException("Subfields of " + tag + " must be an array");
            for (JsonNode s : subsNode) {
                Iterator<Map.Entry<String, JsonNode>> it = s.fields();
                if (!s.isObject() || s.size() != 1) {
                    throw new IllegalArgumentException("Each subfield of " + tag + " must be an object with one code");
                }
                Map.Entry<String, JsonNode> e = it.next();
                if (e.getKey().length() != 1 || !e.getValue().isTextual()) {
                    throw new IllegalArgumentException("Bad subfield '" + e.getKey() + "' in field " + tag);
                }
                subs.add(new Subfield(e.getKey().charAt(0), e.getValue().textValue()));
            }
        }
        return new DataField(tag, ind1, ind2, subs);
    }

    private static char indicator(String tag, JsonNode node) {
        if (node == null || node.isNull()) return ' ';
        String s = node.asText();
        if (s.length() > 1) throw new IllegalArgumentException("Indicator of " + tag + " must be one character: '" + s + "'");
        return s.isEmpty() ? ' ' : s.charAt(0);
    }
}
