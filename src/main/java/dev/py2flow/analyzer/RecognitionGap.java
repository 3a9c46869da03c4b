package dev.py2flow.analyzer;

/**
 * A statement the analyzer could not classify.
 *
 * @param statement position of the enclosing top-level statement
 * @param line      source line
 * @param construct the unrecognized source text
 * @param reason    why it was not recognized
 */
public record RecognitionGap(int statement, int line, String construct, String reason) {

    @Override
    public String toString() {
        return "line %d: %s (%s)".formatted(line, construct, reason);
    }
}
