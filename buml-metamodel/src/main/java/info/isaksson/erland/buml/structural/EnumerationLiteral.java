package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;

/** A literal of an {@link Enumeration}. */
public class EnumerationLiteral extends NamedElement {

    private DataType owner;

    public EnumerationLiteral(String name) {
        this(name, null, null, null);
    }

    public EnumerationLiteral(String name, DataType owner, Instant timestamp, List<String> synonyms) {
        super(name, timestamp, synonyms, Visibility.PUBLIC);
        setOwner(owner);
    }

    public DataType getOwner() {
        return owner;
    }

    /** A primitive data type never owns literals. */
    public void setOwner(DataType owner) {
        if (owner instanceof PrimitiveDataType) {
            throw StructuralException.invalidOwner("Invalid owner of literal '" + getName()
                    + "': primitive data type " + owner.getName() + " cannot own enumeration literals.");
        }
        this.owner = owner;
    }
}
