package info.isaksson.erland.buml.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects issues during one validation run.
 *
 * <p>When warnings are escalated, {@link #warn} records with severity {@code ERROR}.</p>
 */
final class ValidationIssues {

    private final List<ValidationIssue> issues = new ArrayList<>();
    private final boolean warningsAsErrors;

    ValidationIssues(boolean warningsAsErrors) {
        this.warningsAsErrors = warningsAsErrors;
    }

    void error(String code, String message, Map<String, String> context) {
        issues.add(new ValidationIssue(ValidationSeverity.ERROR, code, message, context));
    }

    void warn(String code, String message, Map<String, String> context) {
        ValidationSeverity severity = warningsAsErrors ? ValidationSeverity.ERROR : ValidationSeverity.WARNING;
        issues.add(new ValidationIssue(severity, code, message, context));
    }

    static Map<String, String> ctx(String k1, String v1) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        return ctx;
    }

    static Map<String, String> ctx(String k1, String v1, String k2, String v2) {
        Map<String, String> ctx = ctx(k1, v1);
        ctx.put(k2, v2);
        return ctx;
    }

    static Map<String, String> ctx(String k1, String v1, String k2, String v2, String k3, String v3) {
        Map<String, String> ctx = ctx(k1, v1, k2, v2);
        ctx.put(k3, v3);
        return ctx;
    }

    ValidationReport toReport(String model) {
        return new ValidationReport(model, issues);
    }
}
