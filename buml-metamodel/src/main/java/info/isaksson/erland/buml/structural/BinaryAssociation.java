package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/** An association with exactly two ends, at most one of them composite. */
public class BinaryAssociation extends Association {

    public BinaryAssociation(String name, Set<Property> ends) {
        super(name, ends);
    }

    public BinaryAssociation(String name, Set<Property> ends, Instant timestamp, List<String> synonyms) {
        super(name, ends, timestamp, synonyms);
    }

    @Override
    protected void validateEnds(List<Property> candidates) {
        if (candidates.size() != 2) {
            throw StructuralException.arity("A binary association must have exactly two ends: " + getName() + ".");
        }
        if (candidates.get(0).isComposite() && candidates.get(1).isComposite()) {
            throw StructuralException.arity("The composition attribute cannot be tagged at both ends: " + getName() + ".");
        }
        super.validateEnds(candidates);
    }

    /** The end opposite to {@code end}. */
    public Property opposite(Property end) {
        for (Property p : getEnds()) {
            if (p != end) return p;
        }
        throw new IllegalArgumentException("Not an end of " + getName() + ": " + end);
    }
}
