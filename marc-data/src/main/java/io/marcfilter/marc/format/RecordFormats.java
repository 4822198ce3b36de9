package io.marcfilter.marc.format;

import java.util.List;

/**
 * Looks up formats by name.
 */
public final class RecordFormats {
    public static final List<String> NAMES = List.of(
            MarcBinaryFormat.NAME, MarcXmlFormat.NAME, MarcTextFormat.NAME, MarcJsonFormat.NAME);

    private RecordFormats() { }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static RecordFormat byName(String name, boolean pretty) {
        switch (name) {
            case MarcBinaryFormat.NAME: return new MarcBinaryFormat();
            case MarcXmlFormat.NAME: return new MarcXmlFormat();
            case MarcTextFormat.NAME: return new MarcTextFormat();
            case MarcJsonFormat.NAME: return new MarcJsonFormat(pretty);
            default:
                throw new IllegalArgumentException("Unknown format '" + name + "'; expected one of " + NAMES);
        }
    }
}
