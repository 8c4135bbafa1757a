package info.isaksson.erland.buml.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/** A problem found while validating a domain model. */
@JsonPropertyOrder({"severity", "code", "message", "context"})
public final class ValidationIssue {

    public final ValidationSeverity severity;

    /** Issue code stable across versions, e.g. {@code GENERALIZATION_CYCLE}. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Names of the elements involved, keyed by role ({@code class}, {@code member}, ...), in key order. */
    public final SortedMap<String, String> context;

    @JsonCreator
    public ValidationIssue(
            @JsonProperty("severity") ValidationSeverity severity,
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("context") Map<String, String> context
    ) {
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptySortedMap();
        } else {
            this.context = Collections.unmodifiableSortedMap(new TreeMap<>(context));
        }
    }

    @JsonIgnore
    public boolean isError() {
        return severity == ValidationSeverity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + code + ": " + message;
    }
}
