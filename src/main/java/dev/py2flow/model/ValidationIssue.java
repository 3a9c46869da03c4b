package dev.py2flow.model;

/**
 * A structural finding about a flow.
 *
 * @param code     e.g. CYCLE_DETECTED, ROLE_VIOLATION
 * @param severity ERROR or WARNING
 * @param message  human-readable description
 * @param subject  dataset or recipe name the issue is about, or null
 */
public record ValidationIssue(String code, Severity severity, String message, String subject) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
