package io.marcfilter.marc.model;

/**
 * Structural constants of the ISO 2709 / MARC 21 record layout, plus the element names
 * shared by MARCXML and MARC-in-JSON.
 */
public final class MarcConstants {

    private MarcConstants() { }

    public static final int LEADER_LENGTH = 24;
    public static final int DIRECTORY_ENTRY_LENGTH = 12;
    public static final int TAG_LENGTH = 3;
    public static final int MAX_RECORD_LENGTH = 99_999;
    public static final int MAX_FIELD_LENGTH = 9_999;
    public static final int MAX_FIELD_START = 99_999;

    public static final byte SUBFIELD_DELIMITER = 0x1F;
    public static final byte FIELD_TERMINATOR = 0x1E;
    public static final byte RECORD_TERMINATOR = 0x1D;

    public static final String MARCXML_NAMESPACE = "http://www.loc.gov/MARC21/slim";
    public static final String COLLECTION_LABEL = "collection";
    public static final String RECORD_LABEL = "record";
    public static final String LEADER_LABEL = "leader";
    public static final String DATAFIELD_LABEL = "datafield";
    public static final String CONTROLFIELD_LABEL = "controlfield";
    public static final String TAG_LABEL = "tag";
    public static final String SUBFIELD_LABEL = "subfield";
    public static final String SUBFIELDS_LABEL = "subfields";
    public static final String CODE_LABEL = "code";
    public static final String FIELDS_LABEL = "fields";
    public static final String IND1_LABEL = "ind1";
    public static final String IND2_LABEL = "ind2";

    /** Control fields are the 00X tags; they carry a raw value and no indicators or subfields. */
    public static boolean isControlTag(String tag) {
        return tag.length() == TAG_LENGTH && tag.charAt(0) == '0' && tag.charAt(1) == '0';
    }

    /** Three ASCII letters or digits. */
    public static boolean isValidTag(String tag) {
        if (tag == null || tag.length() != TAG_LENGTH) return false;
        for (int i = 0; i < TAG_LENGTH; i++) {
            char c = tag.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z'))) return false;
        }
        return true;
    }
}
