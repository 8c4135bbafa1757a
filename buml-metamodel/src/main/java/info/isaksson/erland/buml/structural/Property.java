package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;

/**
 * An attribute of a class or an end of an association.
 *
 * <p>The owner is the {@link Class} or {@link Association} holding the property in its member
 * collection; it is set by that owner when the property is added. Data types never own
 * properties.</p>
 */
public class Property extends TypedElement {

    private NamedElement owner;
    private Multiplicity multiplicity;
    private boolean composite;
    private boolean navigable;
    private boolean id;
    private boolean readOnly;

    public Property(String name, Type type) {
        this(name, ref(type), null, Multiplicity.one());
    }

    /** @param typeName primitive name (see {@link PrimitiveDataTypes}) or an ad hoc type name */
    public Property(String name, String typeName) {
        this(name, ref(typeName), null, Multiplicity.one());
    }

    public Property(String name, Type type, Multiplicity multiplicity) {
        this(name, ref(type), null, multiplicity);
    }

    public Property(String name, String typeName, Multiplicity multiplicity) {
        this(name, ref(typeName), null, multiplicity);
    }

    public Property(String name, TypeReference type, NamedElement owner, Multiplicity multiplicity) {
        this(name, type, owner, multiplicity, Visibility.PUBLIC, false, true, false, false, null, null);
    }

    public Property(String name,
                    TypeReference type,
                    NamedElement owner,
                    Multiplicity multiplicity,
                    Visibility visibility,
                    boolean composite,
                    boolean navigable,
                    boolean id,
                    boolean readOnly,
                    Instant timestamp,
                    List<String> synonyms) {
        super(name, type, timestamp, synonyms, visibility == null ? Visibility.PUBLIC : visibility);
        setOwner(owner);
        setMultiplicity(multiplicity);
        this.composite = composite;
        this.navigable = navigable;
        this.id = id;
        this.readOnly = readOnly;
    }

    public NamedElement getOwner() {
        return owner;
    }

    public void setOwner(NamedElement owner) {
        if (owner instanceof DataType) {
            throw StructuralException.invalidOwner("Invalid owner of property '" + getName()
                    + "': data type " + owner.getName() + " cannot own properties.");
        }
        this.owner = owner;
    }

    /**
     * Retypes this property. For an end of an association the association's back-reference moves
     * to the new class, which must be a {@link Class}.
     */
    @Override
    public void setType(Type type) {
        if (owner instanceof Association && ((Association) owner).getEnds().contains(this)) {
            ((Association) owner).retypeEnd(this, type);
        } else {
            super.setType(type);
        }
    }

    public Multiplicity getMultiplicity() {
        return multiplicity;
    }

    /** {@code null} resets to {@code 1..1}. */
    public void setMultiplicity(Multiplicity multiplicity) {
        this.multiplicity = multiplicity == null ? Multiplicity.one() : multiplicity;
    }

    public boolean isComposite() {
        return composite;
    }

    public void setComposite(boolean composite) {
        this.composite = composite;
    }

    public boolean isNavigable() {
        return navigable;
    }

    public void setNavigable(boolean navigable) {
        this.navigable = navigable;
    }

    public boolean isId() {
        return id;
    }

    public void setId(boolean id) {
        this.id = id;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    @Override
    public String toString() {
        return "Property(" + getName() + ": " + getType().getName() + " [" + multiplicity.label() + "])";
    }
}
