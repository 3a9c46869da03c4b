package dev.py2flow.analyzer;

/**
 * Naming of the synthetic variables that hold intermediate results of a
 * method chain, e.g. {@code result$3_1} for the first link of
 * {@code result = df.a().b()} in statement 3.
 */
public final class Temporaries {

    static final char MARKER = '$';

    private Temporaries() {}

    public static String name(String base, int statement, int index) {
        return base + MARKER + statement + "_" + index;
    }

    public static boolean isTemporary(String variable) {
        return variable != null && variable.indexOf(MARKER) >= 0;
    }

    /** The variable a temporary was derived from; the variable itself otherwise. */
    public static String baseName(String variable) {
        int marker = variable.indexOf(MARKER);
        return marker < 0 ? variable : variable.substring(0, marker);
    }
}
