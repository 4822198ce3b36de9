package io.marcfilter.marc.format;

import io.marcfilter.marc.model.MarcRecord;

/**
 * An output representation: how one record becomes bytes, plus the framing a file of such
 * records needs. A file holding a single record gets only header, record and footer; a
 * multi-record file additionally gets the prefix, separators and suffix.
 */
public abstract class RecordFormat {
    protected static final byte[] NONE = new byte[0];

    /** Short name used on the command line and in job files, e.g. {@code marc}. */
    public abstract String name();

    /** File extension including the dot. */
    public abstract String extension();

    public byte[] header() { return NONE; }
    public byte[] footer() { return NONE; }
    public byte[] multiPrefix() { return NONE; }
    public byte[] multiSuffix() { return NONE; }
    public byte[] multiSeparator() { return NONE; }

    /**
     * Encodes one record. Pure: depends only on the record.
     *
     * @throws io.marcfilter.marc.codec.MarcEncodeException if the record cannot be represented
     */
    public abstract byte[] encode(MarcRecord record);

    @Override
    public String toString() {
        return name();
    }
}
