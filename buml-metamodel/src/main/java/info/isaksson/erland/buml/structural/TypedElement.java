package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** A named element with a type. */
public abstract class TypedElement extends NamedElement {

    private Type type;

    protected TypedElement(String name, TypeReference type, Instant timestamp, List<String> synonyms,
                           Visibility visibility) {
        super(name, timestamp, synonyms, visibility);
        this.type = Objects.requireNonNull(type, "type must not be null").resolve();
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        assignType(type);
    }

    final void assignType(Type type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    static TypeReference ref(Type type) {
        return TypeReference.of(type);
    }

    static TypeReference ref(String typeName) {
        return TypeReference.named(typeName);
    }
}
