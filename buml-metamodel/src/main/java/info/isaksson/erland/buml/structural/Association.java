package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An association between classes, made of two or more ends.
 *
 * <p>Each end is owned by the association and typed by a {@link Class}; that class holds this
 * association in {@link Class#getAssociations()} for as long as one of the current ends is typed by
 * it.</p>
 */
public class Association extends NamedElement {

    private Set<Property> ends;

    public Association(String name, Set<Property> ends) {
        this(name, ends, null, null);
    }

    public Association(String name, Set<Property> ends, Instant timestamp, List<String> synonyms) {
        super(name, timestamp, synonyms, Visibility.PUBLIC);
        setEnds(ends);
    }

    public Set<Property> getEnds() {
        return Collections.unmodifiableSet(ends);
    }

    /**
     * Replaces the ends. The classes of the previous ends lose their back-reference to this
     * association, then every new end is owned by this association and its class gains the
     * back-reference. Nothing changes when the new ends are rejected.
     */
    public final void setEnds(Set<Property> ends) {
        List<Property> candidates = NameRules.candidates(ends);
        validateEnds(candidates);
        if (this.ends != null) {
            for (Property old : this.ends) {
                if (old.getType() instanceof Class) {
                    ((Class) old.getType()).removeAssociationRef(this);
                }
            }
        }
        for (Property end : candidates) {
            end.setOwner(this);
            ((Class) end.getType()).addAssociationRef(this);
        }
        this.ends = new LinkedHashSet<>(candidates);
    }

    /** Checks a candidate end set before it replaces the current one. */
    protected void validateEnds(List<Property> candidates) {
        if (candidates.size() <= 1) {
            throw StructuralException.arity("An association must have more than one end: " + getName() + ".");
        }
        for (Property end : candidates) {
            if (!(end.getType() instanceof Class)) {
                throw StructuralException.invalidValue("Association end '" + end.getName() + "' of " + getName()
                        + " must be typed by a class, got " + end.getType() + ".");
            }
        }
    }

    /** Moves the back-reference of {@code end} from its current class to {@code type}. */
    void retypeEnd(Property end, Type type) {
        Objects.requireNonNull(type, "type must not be null");
        if (!(type instanceof Class)) {
            throw StructuralException.invalidValue("Association end '" + end.getName() + "' of " + getName()
                    + " must be typed by a class, got " + type + ".");
        }
        Type previous = end.getType();
        end.assignType(type);
        if (previous instanceof Class && !typesAnyEnd((Class) previous)) {
            ((Class) previous).removeAssociationRef(this);
        }
        ((Class) type).addAssociationRef(this);
    }

    private boolean typesAnyEnd(Class c) {
        for (Property p : ends) {
            if (p.getType() == c) return true;
        }
        return false;
    }

    /** The end typed by {@code type}, if exactly one end is; otherwise empty. */
    public Optional<Property> endTypedBy(Class type) {
        Property found = null;
        for (Property end : ends) {
            if (end.getType() == type) {
                if (found != null) return Optional.empty();
                found = end;
            }
        }
        return Optional.ofNullable(found);
    }
}
