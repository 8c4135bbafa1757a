package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** A named grouping of classes. */
public class Package extends NamedElement {

    private Set<Class> classes;

    public Package(String name, Set<Class> classes) {
        this(name, classes, null, null);
    }

    public Package(String name, Set<Class> classes, Instant timestamp, List<String> synonyms) {
        super(name, timestamp, synonyms, Visibility.PUBLIC);
        setClasses(classes);
    }

    public Set<Class> getClasses() {
        return Collections.unmodifiableSet(classes);
    }

    public void setClasses(Set<Class> classes) {
        this.classes = new LinkedHashSet<>(NameRules.candidates(classes));
    }

    public Optional<Class> getClassByName(String name) {
        for (Class c : classes) {
            if (Objects.equals(c.getName(), name)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
