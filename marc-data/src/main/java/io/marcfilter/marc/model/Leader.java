package io.marcfilter.marc.model;

import java.util.Objects;

/**
 * The 24 character record leader. Only the positions the codec depends on get accessors;
 * everything else is carried through as is.
 */
public record Leader(String value) {
    public static final int UNKNOWN = -1;

    public Leader {
        Objects.requireNonNull(value, "value");
        if (value.length() != MarcConstants.LEADER_LENGTH) {
            throw new IllegalArgumentException("Leader must be " + MarcConstants.LEADER_LENGTH
                    + " characters, got " + value.length() + ": '" + value + "'");
        }
    }

    /** Blank leader for a new UTF-8 bibliographic record; lengths are filled in on encode. */
    public static Leader defaultLeader() {
        return new Leader("00000nam a2200000 a 4500");
    }

    /** Positions 0-4, or {@link #UNKNOWN} if not five digits. */
    public int recordLength() {
        return digits(0, 5);
    }

    /** Positions 12-16, or {@link #UNKNOWN} if not five digits. */
    public int baseAddress() {
        return digits(12, 17);
    }

    public char status() { return value.charAt(5); }
    public char type() { return value.charAt(6); }
    public char bibliographicLevel() { return value.charAt(7); }
    public char characterCodingScheme() { return value.charAt(9); }

    /** Position 9 {@code a} marks UCS/Unicode (UTF-8) content. */
    public boolean isUnicode() { return characterCodingScheme() == 'a'; }

    /** Position 10, 2 for MARC 21; defaults to 2 when not a digit. */
    public int indicatorCount() {
        char c = value.charAt(10);
        return Character.isDigit(c) ? c - '0' : 2;
    }

    /** Position 11, delimiter plus code, 2 for MARC 21; defaults to 2 when not a digit. */
    public int subfieldCodeLength() {
        char c = value.charAt(11);
        return Character.isDigit(c) ? c - '0' : 2;
    }

    /**
     * Copy with recomputed length and base address; indicator count, subfield code length and
     * the entry map are normalised to the values the encoder writes.
     */
    public Leader withLengths(int recordLength, int baseAddress) {
        StringBuilder sb = new StringBuilder(value);
        sb.replace(0, 5, pad(recordLength));
        sb.setCharAt(10, '2');
        sb.setCharAt(11, '2');
        sb.replace(12, 17, pad(baseAddress));
        sb.replace(20, 24, "4500");
        return new Leader(sb.toString());
    }

    private int digits(int from, int to) {
        int n = 0;
        for (int i = from; i < to; i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') return UNKNOWN;
            n = n * 10 + (c - '0');
        }
        return n;
    }

    private static String pad(int n) {
        String s = Integer.toString(n);
        return "00000".substring(s.length()) + s;
    }

    @Override
    public String toString() {
        return value;
    }
}
