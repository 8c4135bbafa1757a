package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.Objects;

/**
 * A parent/child edge between two classes.
 *
 * <p>Both sides hold this generalization in {@link Class#getGeneralizations()}. Each setter moves the
 * back-reference from the previous class to the new one on its own.</p>
 */
public class Generalization extends Element {

    private Class general;
    private Class specific;

    public Generalization(Class general, Class specific) {
        this(general, specific, null);
    }

    public Generalization(Class general, Class specific, Instant timestamp) {
        super(timestamp);
        Objects.requireNonNull(general, "general must not be null");
        Objects.requireNonNull(specific, "specific must not be null");
        if (general == specific) throw selfGeneralization(general);
        setGeneral(general);
        setSpecific(specific);
    }

    public Class getGeneral() {
        return general;
    }

    public void setGeneral(Class general) {
        Objects.requireNonNull(general, "general must not be null");
        if (general == specific) throw selfGeneralization(general);
        if (this.general != null) this.general.removeGeneralizationRef(this);
        general.addGeneralizationRef(this);
        this.general = general;
    }

    public Class getSpecific() {
        return specific;
    }

    public void setSpecific(Class specific) {
        Objects.requireNonNull(specific, "specific must not be null");
        if (specific == general) throw selfGeneralization(specific);
        if (this.specific != null) this.specific.removeGeneralizationRef(this);
        specific.addGeneralizationRef(this);
        this.specific = specific;
    }

    private static StructuralException selfGeneralization(Class c) {
        return new StructuralException(StructuralException.Kind.SELF_GENERALIZATION,
                "A class cannot be a generalization of itself: " + c.getName() + ".");
    }

    @Override
    public String toString() {
        return "Generalization(" + general.getName() + " <- " + specific.getName() + ")";
    }
}
