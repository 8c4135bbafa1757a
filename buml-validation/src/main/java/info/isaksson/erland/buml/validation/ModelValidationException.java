package info.isaksson.erland.buml.validation;

/** Thrown by {@link ValidationReport#throwIfInvalid()} when a report has errors. */
public final class ModelValidationException extends RuntimeException {

    public final ValidationReport report;

    public ModelValidationException(ValidationReport report) {
        super(describe(report));
        this.report = report;
    }

    private static String describe(ValidationReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Model '").append(report.model).append("' is invalid: ")
                .append(report.errors().size()).append(" error(s)");
        for (ValidationIssue issue : report.errors()) {
            sb.append("\n  ").append(issue.code).append(": ").append(issue.message);
        }
        return sb.toString();
    }
}
