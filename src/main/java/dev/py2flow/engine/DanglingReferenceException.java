package dev.py2flow.engine;

import dev.py2flow.Py2FlowException;

/**
 * An operation read a variable that was never bound to a dataset.
 */
public class DanglingReferenceException extends Py2FlowException {

    private static final long serialVersionUID = 1L;

    private final String variable;
    private final int line;

    public DanglingReferenceException(String variable, int line) {
        super("Operation at line %d refers to variable '%s', which is not bound to a dataset"
            .formatted(line, variable), "DANGLING_REFERENCE");
        this.variable = variable;
        this.line = line;
    }

    public String getVariable() {
        return variable;
    }

    public int getLine() {
        return line;
    }
}
