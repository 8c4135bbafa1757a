package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;

/** A type whose instances are identified only by their value. Cannot own properties or methods. */
public class DataType extends Type {

    public DataType(String name) {
        super(name);
    }

    public DataType(String name, Instant timestamp, List<String> synonyms) {
        super(name, timestamp, synonyms);
    }
}
