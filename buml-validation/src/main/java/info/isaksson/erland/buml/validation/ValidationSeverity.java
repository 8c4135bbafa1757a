package info.isaksson.erland.buml.validation;

/** Severity of a {@link ValidationIssue}. Errors sort before warnings. */
public enum ValidationSeverity {
    ERROR,
    WARNING
}
