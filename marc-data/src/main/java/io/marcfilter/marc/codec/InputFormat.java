package io.marcfilter.marc.codec;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Input representations the reader understands.
 */
public enum InputFormat {
    MARC,
    JSON;

    private static final int SNIFF_LIMIT = 4096;

    /**
     * Guesses the representation from the first non-whitespace byte: {@code {} or {@code [}
     * means MARC-in-JSON, anything else binary MARC. The stream must support mark/reset and is
     * left at its original position.
     */
    public static InputFormat detect(InputStream in) throws IOException {
        if (!in.markSupported()) throw new IllegalArgumentException("Stream must support mark/reset");
        in.mark(SNIFF_LIMIT);
        try {
            for (int i = 0; i < SNIFF_LIMIT; i++) {
                int b = in.read();
                if (b < 0) return MARC;
                if (b == ' ' || b == '\t' || b == '\r' || b == '\n') continue;
                return (b == '{' || b == '[') ? JSON : MARC;
            }
            return MARC;
        } finally {
            in.reset();
        }
    }

    /**
     * Opens a reader over {@code in}, detecting its representation first.
     */
    public static RecordReader open(InputStream in, long firstIndex) throws IOException {
        BufferedInputStream buffered = in instanceof BufferedInputStream b ? b : new BufferedInputStream(in);
        return switch (detect(buffered)) {
            case JSON -> new MarcJsonReader(buffered, firstIndex);
            case MARC -> new MarcDecoder(buffered, firstIndex);
        };
    }
}
