package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * One of the eight built-in scalar types.
 *
 * <p>Use the shared instances in {@link PrimitiveDataTypes}; identity comparison against them is
 * how callers detect a primitive. A primitive is frozen once constructed: its name, synonyms,
 * visibility and timestamp cannot be changed afterwards.</p>
 */
public final class PrimitiveDataType extends DataType {

    /** Allowed names. */
    public static final Set<String> NAMES = Set.of(
            "int", "float", "str", "bool", "time", "date", "datetime", "timedelta"
    );

    // false while the superclass constructors run
    private boolean frozen;

    public PrimitiveDataType(String name) {
        super(name);
        this.frozen = true;
    }

    @Override
    public void setName(String name) {
        requireMutable("name");
        if (name == null || !NAMES.contains(name)) {
            throw StructuralException.invalidValue("Invalid primitive data type: " + name);
        }
        super.setName(name);
    }

    @Override
    public void setSynonyms(List<String> synonyms) {
        requireMutable("synonyms");
        super.setSynonyms(synonyms);
    }

    @Override
    public void setVisibility(Visibility visibility) {
        requireMutable("visibility");
        super.setVisibility(visibility);
    }

    @Override
    public void setTimestamp(Instant timestamp) {
        requireMutable("timestamp");
        super.setTimestamp(timestamp);
    }

    private void requireMutable(String what) {
        if (frozen) {
            throw StructuralException.invalidValue("Cannot change the " + what + " of primitive data type '"
                    + getName() + "'.");
        }
    }
}
