package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;

/** A typed parameter of a {@link Method}, with an optional default value. */
public class Parameter extends TypedElement {

    private Object defaultValue;

    public Parameter(String name, Type type) {
        this(name, ref(type), null, null, null);
    }

    public Parameter(String name, String typeName) {
        this(name, ref(typeName), null, null, null);
    }

    public Parameter(String name, Type type, Object defaultValue) {
        this(name, ref(type), defaultValue, null, null);
    }

    public Parameter(String name, TypeReference type, Object defaultValue, Instant timestamp, List<String> synonyms) {
        super(name, type, timestamp, synonyms, Visibility.PUBLIC);
        this.defaultValue = defaultValue;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(Object defaultValue) {
        this.defaultValue = defaultValue;
    }
}
