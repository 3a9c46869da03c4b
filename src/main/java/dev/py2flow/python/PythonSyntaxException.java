package dev.py2flow.python;

import dev.py2flow.Py2FlowException;

/**
 * Raised when the source text cannot be tokenized at all, e.g. an
 * unterminated triple-quoted string or a dedent that matches no outer block.
 */
public class PythonSyntaxException extends Py2FlowException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public PythonSyntaxException(String message, int line) {
        super("line %d: %s".formatted(line, message), "INVALID_PYTHON_CODE");
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
