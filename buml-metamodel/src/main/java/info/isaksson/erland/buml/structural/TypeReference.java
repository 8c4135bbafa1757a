package info.isaksson.erland.buml.structural;

import java.util.Objects;

/**
 * Constructor input for a typed element: either an already resolved {@link Type} or a type name.
 *
 * <p>A name is resolved against {@link PrimitiveDataTypes}; a name that is not a primitive becomes
 * a fresh ad hoc {@link Type}. Resolution has no side effects.</p>
 */
public final class TypeReference {

    public enum Kind { RESOLVED, NAME }

    public final Kind kind;

    /** For RESOLVED. */
    public final Type type;

    /** For NAME. */
    public final String name;

    private TypeReference(Kind kind, Type type, String name) {
        this.kind = kind;
        this.type = type;
        this.name = name;
    }

    public static TypeReference of(Type type) {
        Objects.requireNonNull(type, "type must not be null");
        return new TypeReference(Kind.RESOLVED, type, null);
    }

    public static TypeReference named(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return new TypeReference(Kind.NAME, null, name);
    }

    public Type resolve() {
        if (kind == Kind.RESOLVED) return type;
        return PrimitiveDataTypes.lookup(name).<Type>map(p -> p).orElseGet(() -> new Type(name));
    }

    @Override
    public String toString() {
        return kind == Kind.RESOLVED ? String.valueOf(type) : name;
    }
}
