package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;

/**
 * A named type. Used directly for ad hoc type references that are neither primitives nor
 * classes of a model; {@link DataType} and {@link Class} specialize it.
 */
public class Type extends NamedElement {

    public Type(String name) {
        super(name);
    }

    public Type(String name, Instant timestamp, List<String> synonyms) {
        super(name, timestamp, synonyms, Visibility.PUBLIC);
    }
}
