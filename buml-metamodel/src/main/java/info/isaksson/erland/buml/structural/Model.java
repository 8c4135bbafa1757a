package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;

/** Base of every kind of model. */
public abstract class Model extends NamedElement {

    protected Model(String name, Instant timestamp, List<String> synonyms) {
        super(name, timestamp, synonyms, Visibility.PUBLIC);
    }
}
