package info.isaksson.erland.buml.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Outcome of validating one domain model.
 *
 * <p>Issues are kept sorted by (severity, code, message, context), so two validations of equal
 * models give equal reports regardless of hash or creation order. Issue contexts are already
 * key-sorted, which makes their string form a stable tie-breaker.</p>
 */
@JsonPropertyOrder({"model", "errorCount", "warningCount", "issues"})
@JsonIgnoreProperties(value = {"errorCount", "warningCount"}, allowGetters = true)
public final class ValidationReport {

    static final Comparator<ValidationIssue> ORDER = Comparator
            .comparing((ValidationIssue i) -> i.severity)
            .thenComparing(i -> i.code)
            .thenComparing(i -> i.message)
            .thenComparing(i -> i.context.toString());

    /** Name of the validated model. */
    public final String model;

    public final List<ValidationIssue> issues;

    @JsonCreator
    public ValidationReport(
            @JsonProperty("model") String model,
            @JsonProperty("issues") List<ValidationIssue> issues
    ) {
        this.model = model;
        List<ValidationIssue> sorted = issues == null ? new ArrayList<>() : new ArrayList<>(issues);
        sorted.sort(ORDER);
        this.issues = Collections.unmodifiableList(sorted);
    }

    @JsonProperty("errorCount")
    public int errorCount() {
        return errors().size();
    }

    @JsonProperty("warningCount")
    public int warningCount() {
        return warnings().size();
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    public List<ValidationIssue> errors() {
        return filter(ValidationSeverity.ERROR);
    }

    public List<ValidationIssue> warnings() {
        return filter(ValidationSeverity.WARNING);
    }

    /** Issues with the given code, in report order. */
    public List<ValidationIssue> withCode(String code) {
        List<ValidationIssue> out = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            if (issue.code.equals(code)) out.add(issue);
        }
        return out;
    }

    /** @throws ModelValidationException if the report has at least one error */
    public void throwIfInvalid() {
        if (hasErrors()) throw new ModelValidationException(this);
    }

    private List<ValidationIssue> filter(ValidationSeverity severity) {
        List<ValidationIssue> out = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            if (issue.severity == severity) out.add(issue);
        }
        return out;
    }
}
