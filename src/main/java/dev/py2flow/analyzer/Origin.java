package dev.py2flow.analyzer;

/**
 * Where an operation was recognized: top-level statement position, line and
 * the statement text.
 */
public record Origin(int statement, int line, String text) {

    public static Origin unknown() {
        return new Origin(0, 0, "");
    }
}
