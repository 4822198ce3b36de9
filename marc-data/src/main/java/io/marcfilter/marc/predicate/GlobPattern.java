package io.marcfilter.marc.predicate;

/**
 * Anchored glob match: {@code *} matches any run of characters, {@code ?} exactly one,
 * and {@code \} makes the next character literal. Runs in O(value x pattern) time with
 * no backtracking blow-up.
 */
public final class GlobPattern {
    private static final char ANY = '*';
    private static final char ONE = '?';
    private static final char ESCAPE = '\\';

    private final String source;
    // pattern tokens: literal chars with a parallel flag array marking wildcards
    private final char[] tokens;
    private final boolean[] wild;
    private final boolean ignoreCase;

    private GlobPattern(String source, char[] tokens, boolean[] wild, boolean ignoreCase) {
        this.source = source;
        this.tokens = tokens;
        this.wild = wild;
        this.ignoreCase = ignoreCase;
    }

    /**
     * @throws IllegalArgumentException if the pattern ends with a lone escape
     */
    public static GlobPattern compile(String pattern, boolean ignoreCase) {
        char[] tokens = new char[pattern.length()];
        boolean[] wild = new boolean[pattern.length()];
        int n = 0;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == ESCAPE) {
                if (++i == pattern.length()) {
                    throw new IllegalArgumentException("Pattern '" + pattern + "' ends with an escape character");
                }
                tokens[n++] = fold(pattern.charAt(i), ignoreCase);
            } else if (c == ANY || c == ONE) {
                // collapse runs of '*'
                if (c == ANY && n > 0 && wild[n - 1] && tokens[n - 1] == ANY) continue;
                wild[n] = true;
                tokens[n++] = c;
            } else {
                tokens[n++] = fold(c, ignoreCase);
            }
        }
        char[] t = new char[n];
        boolean[] w = new boolean[n];
        System.arraycopy(tokens, 0, t, 0, n);
        System.arraycopy(wild, 0, w, 0, n);
        return new GlobPattern(pattern, t, w, ignoreCase);
    }

    public boolean matches(String value) {
        int v = 0;
        int p = 0;
        int starP = -1;
        int starV = 0;
        while (v < value.length()) {
            if (p < tokens.length && wild[p] && tokens[p] == ANY) {
                starP = p++;
                starV = v;
            } else if (p < tokens.length && (wild[p] ? tokens[p] == ONE : tokens[p] == fold(value.charAt(v), ignoreCase))) {
                p++;
                v++;
            } else if (starP >= 0) {
                p = starP + 1;
                v = ++starV;
            } else {
                return false;
            }
        }
        while (p < tokens.length && wild[p] && tokens[p] == ANY) p++;
        return p == tokens.length;
    }

    private static char fold(char c, boolean ignoreCase) {
        return ignoreCase ? Character.toLowerCase(Character.toUpperCase(c)) : c;
    }

    @Override
    public String toString() {
        return source;
    }
}
