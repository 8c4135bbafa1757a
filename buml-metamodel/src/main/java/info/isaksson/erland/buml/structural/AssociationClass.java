package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** A class that also stands for an association, carrying attributes of the link itself. */
public class AssociationClass extends Class {

    private Association association;

    public AssociationClass(String name, Set<Property> attributes, Association association) {
        this(name, attributes, association, null, null);
    }

    public AssociationClass(String name, Set<Property> attributes, Association association,
                            Instant timestamp, List<String> synonyms) {
        super(name, requireAssociation(attributes, association), null, false, false, timestamp, synonyms);
        this.association = association;
    }

    // checked before the attributes are taken over
    private static Set<Property> requireAssociation(Set<Property> attributes, Association association) {
        Objects.requireNonNull(association, "association must not be null");
        return attributes;
    }

    public Association getAssociation() {
        return association;
    }

    public void setAssociation(Association association) {
        this.association = Objects.requireNonNull(association, "association must not be null");
    }
}
