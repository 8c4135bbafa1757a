package info.isaksson.erland.buml.structural;

import java.util.Objects;

/**
 * Raised when a mutation or constructor would break a structural invariant of the metamodel.
 *
 * <p>All checks run against the complete candidate state before anything is committed, so the
 * receiver of a failed call is left exactly as it was.</p>
 */
public final class StructuralException extends IllegalArgumentException {

    public enum Kind {
        /** Bad visibility, primitive type name, multiplicity bound or end typing. */
        INVALID_VALUE,
        /** Two members/types/associations/packages/constraints share a name in one collection. */
        DUPLICATE_NAME,
        /** More than one attribute of a class is marked as identifier. */
        MULTIPLE_IDENTIFIERS,
        /** A data type was assigned as owner of a property, method or literal. */
        INVALID_OWNER,
        /** A generalization whose general and specific class are the same. */
        SELF_GENERALIZATION,
        /** Wrong number of association ends, or a binary association composite at both ends. */
        ARITY_VIOLATION,
        /** A class reached itself while following generalization edges. */
        CYCLIC_GENERALIZATION
    }

    public final Kind kind;

    public StructuralException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    static StructuralException invalidValue(String message) {
        return new StructuralException(Kind.INVALID_VALUE, message);
    }

    static StructuralException duplicateName(String message) {
        return new StructuralException(Kind.DUPLICATE_NAME, message);
    }

    static StructuralException invalidOwner(String message) {
        return new StructuralException(Kind.INVALID_OWNER, message);
    }

    static StructuralException arity(String message) {
        return new StructuralException(Kind.ARITY_VIOLATION, message);
    }
}
