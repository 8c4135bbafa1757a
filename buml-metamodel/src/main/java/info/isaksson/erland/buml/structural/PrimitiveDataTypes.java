package info.isaksson.erland.buml.structural;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-wide registry of the primitive data types.
 *
 * <p>The instances are created once when this class is initialized and are never replaced.</p>
 */
public final class PrimitiveDataTypes {

    private PrimitiveDataTypes() {}

    public static final PrimitiveDataType STRING = new PrimitiveDataType("str");
    public static final PrimitiveDataType INTEGER = new PrimitiveDataType("int");
    public static final PrimitiveDataType FLOAT = new PrimitiveDataType("float");
    public static final PrimitiveDataType BOOLEAN = new PrimitiveDataType("bool");
    public static final PrimitiveDataType TIME = new PrimitiveDataType("time");
    public static final PrimitiveDataType DATE = new PrimitiveDataType("date");
    public static final PrimitiveDataType DATETIME = new PrimitiveDataType("datetime");
    public static final PrimitiveDataType TIMEDELTA = new PrimitiveDataType("timedelta");

    private static final Set<PrimitiveDataType> ALL;
    static {
        Set<PrimitiveDataType> all = new LinkedHashSet<>();
        all.add(STRING);
        all.add(INTEGER);
        all.add(FLOAT);
        all.add(BOOLEAN);
        all.add(TIME);
        all.add(DATE);
        all.add(DATETIME);
        all.add(TIMEDELTA);
        ALL = Collections.unmodifiableSet(all);
    }

    // "string" is accepted as an alias of "str".
    private static final Map<String, PrimitiveDataType> BY_NAME = Map.of(
            "str", STRING,
            "string", STRING,
            "int", INTEGER,
            "float", FLOAT,
            "bool", BOOLEAN,
            "time", TIME,
            "date", DATE,
            "datetime", DATETIME,
            "timedelta", TIMEDELTA
    );

    /** All eight primitives, in a fixed order. */
    public static Set<PrimitiveDataType> all() {
        return ALL;
    }

    public static Optional<PrimitiveDataType> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /** True if {@code type} is one of the shared registry instances. */
    public static boolean isPrimitive(Type type) {
        return type instanceof PrimitiveDataType && ALL.contains(type);
    }
}
