package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Root container of a structural model: types, associations, generalizations, packages and
 * constraints.
 *
 * <p>Every collection setter validates the whole candidate collection and either replaces the
 * stored one or throws, leaving it untouched. The {@code add*} operations are shorthands for
 * "current set plus one" and run the same validation. The primitive data types are always part of
 * {@link #getTypes()}.</p>
 *
 * <p>{@link #getClasses()} and {@link #getEnumerations()} iterate in creation order.</p>
 */
public class DomainModel extends Model {

    private Set<Type> types = new LinkedHashSet<>();
    private Set<Association> associations = new LinkedHashSet<>();
    private Set<Generalization> generalizations = new LinkedHashSet<>();
    private Set<Package> packages = new LinkedHashSet<>();
    private Set<Constraint> constraints = new LinkedHashSet<>();

    public DomainModel(String name) {
        this(name, null, null, null, null, null);
    }

    public DomainModel(String name, Set<Type> types, Set<Association> associations, Set<Generalization> generalizations) {
        this(name, types, associations, generalizations, null, null);
    }

    public DomainModel(String name,
                       Set<Type> types,
                       Set<Association> associations,
                       Set<Generalization> generalizations,
                       Set<Package> packages,
                       Set<Constraint> constraints) {
        this(name, types, associations, generalizations, packages, constraints, null, null);
    }

    public DomainModel(String name,
                       Set<Type> types,
                       Set<Association> associations,
                       Set<Generalization> generalizations,
                       Set<Package> packages,
                       Set<Constraint> constraints,
                       Instant timestamp,
                       List<String> synonyms) {
        super(name, timestamp, synonyms);
        setTypes(types);
        setPackages(packages);
        setConstraints(constraints);
        setAssociations(associations);
        setGeneralizations(generalizations);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    // --- types ---------------------------------------------------------------

    public Set<Type> getTypes() {
        return Collections.unmodifiableSet(types);
    }

    /** Replaces the types; the primitive data types are added to whatever is given. */
    public void setTypes(Set<Type> types) {
        Set<Type> candidates = new LinkedHashSet<>(NameRules.candidates(types));
        candidates.addAll(PrimitiveDataTypes.all());
        NameRules.requireUniqueNames(candidates, "The model cannot have types");
        this.types = candidates;
    }

    public void addType(Type type) {
        Objects.requireNonNull(type, "type must not be null");
        setTypes(plus(types, type));
    }

    public Optional<Type> getTypeByName(String name) {
        for (Type t : types) {
            if (Objects.equals(t.getName(), name)) return Optional.of(t);
        }
        return Optional.empty();
    }

    public Set<Class> getClasses() {
        return sorted(types, Class.class);
    }

    public Optional<Class> getClassByName(String name) {
        for (Type t : types) {
            if (t instanceof Class && Objects.equals(t.getName(), name)) return Optional.of((Class) t);
        }
        return Optional.empty();
    }

    public Set<Enumeration> getEnumerations() {
        return sorted(types, Enumeration.class);
    }

    // --- associations --------------------------------------------------------

    public Set<Association> getAssociations() {
        return Collections.unmodifiableSet(associations);
    }

    public void setAssociations(Set<Association> associations) {
        List<Association> candidates = NameRules.candidates(associations);
        NameRules.requireUniqueNames(candidates, "The model cannot have associations");
        this.associations = new LinkedHashSet<>(candidates);
    }

    public void addAssociation(Association association) {
        Objects.requireNonNull(association, "association must not be null");
        setAssociations(plus(associations, association));
    }

    public Optional<Association> getAssociationByName(String name) {
        for (Association a : associations) {
            if (Objects.equals(a.getName(), name)) return Optional.of(a);
        }
        return Optional.empty();
    }

    // --- generalizations -----------------------------------------------------

    public Set<Generalization> getGeneralizations() {
        return Collections.unmodifiableSet(generalizations);
    }

    public void setGeneralizations(Set<Generalization> generalizations) {
        this.generalizations = new LinkedHashSet<>(NameRules.candidates(generalizations));
    }

    public void addGeneralization(Generalization generalization) {
        Objects.requireNonNull(generalization, "generalization must not be null");
        setGeneralizations(plus(generalizations, generalization));
    }

    // --- packages ------------------------------------------------------------

    public Set<Package> getPackages() {
        return Collections.unmodifiableSet(packages);
    }

    public void setPackages(Set<Package> packages) {
        List<Package> candidates = NameRules.candidates(packages);
        NameRules.requireUniqueNames(candidates, "The model cannot have packages");
        this.packages = new LinkedHashSet<>(candidates);
    }

    public void addPackage(Package pkg) {
        Objects.requireNonNull(pkg, "package must not be null");
        setPackages(plus(packages, pkg));
    }

    // --- constraints ---------------------------------------------------------

    public Set<Constraint> getConstraints() {
        return Collections.unmodifiableSet(constraints);
    }

    public void setConstraints(Set<Constraint> constraints) {
        List<Constraint> candidates = NameRules.candidates(constraints);
        NameRules.requireUniqueNames(candidates, "The model cannot have constraints");
        this.constraints = new LinkedHashSet<>(candidates);
    }

    public void addConstraint(Constraint constraint) {
        Objects.requireNonNull(constraint, "constraint must not be null");
        setConstraints(plus(constraints, constraint));
    }

    // --- inheritance order ---------------------------------------------------

    /**
     * All classes ordered so that every class comes after all of its ancestors.
     *
     * <p>Depth-first postorder over the child edges of the model's classes, reversed. Roots and
     * children are visited in reverse creation order, which keeps unrelated classes in creation
     * order in the result. Edges to a general class that is not part of the model are ignored.</p>
     *
     * @throws StructuralException {@code CYCLIC_GENERALIZATION} if the classes' generalizations form a cycle
     */
    public List<Class> classesSortedByInheritance() {
        List<Class> classes = new ArrayList<>(getClasses());
        Collections.reverse(classes);

        Map<Class, List<Class>> children = new LinkedHashMap<>();
        for (Class c : classes) children.put(c, new ArrayList<>());
        for (Class c : classes) {
            for (Generalization g : c.getGeneralizations()) {
                if (g.getSpecific() != c) continue;
                List<Class> siblings = children.get(g.getGeneral());
                if (siblings != null && !siblings.contains(c)) siblings.add(c);
            }
        }

        Set<Class> visited = new HashSet<>();
        Set<Class> inProgress = new HashSet<>();
        List<Class> out = new ArrayList<>(classes.size());
        for (Class c : classes) {
            if (!visited.contains(c)) visit(c, children, visited, inProgress, out);
        }
        Collections.reverse(out);
        return out;
    }

    private static void visit(Class c, Map<Class, List<Class>> children, Set<Class> visited,
                              Set<Class> inProgress, List<Class> out) {
        visited.add(c);
        inProgress.add(c);
        for (Class child : children.get(c)) {
            if (inProgress.contains(child)) {
                throw new StructuralException(StructuralException.Kind.CYCLIC_GENERALIZATION,
                        "Generalization cycle through class '" + child.getName() + "'.");
            }
            if (!visited.contains(child)) visit(child, children, visited, inProgress, out);
        }
        inProgress.remove(c);
        out.add(c);
    }

    // --- helpers -------------------------------------------------------------

    private static <T> Set<T> plus(Set<T> current, T extra) {
        Set<T> next = new LinkedHashSet<>(current);
        next.add(extra);
        return next;
    }

    private static <T extends Element> Set<T> sorted(Set<Type> types, java.lang.Class<T> kind) {
        List<T> out = new ArrayList<>();
        for (Type t : types) {
            if (kind.isInstance(t)) out.add(kind.cast(t));
        }
        out.sort(Element.CREATION_ORDER);
        return Collections.unmodifiableSet(new LinkedHashSet<>(out));
    }

    /**
     * Accumulates the contents of a model and validates them once, in {@link #build()}.
     *
     * <p>Nothing is checked while adding, so elements may be added in any order. A builder can be
     * built more than once; every call produces an independent model over the same elements.</p>
     */
    public static final class Builder {

        private final String name;
        private final Set<Type> types = new LinkedHashSet<>();
        private final Set<Association> associations = new LinkedHashSet<>();
        private final Set<Generalization> generalizations = new LinkedHashSet<>();
        private final Set<Package> packages = new LinkedHashSet<>();
        private final Set<Constraint> constraints = new LinkedHashSet<>();
        private Instant timestamp;
        private List<String> synonyms;

        private Builder(String name) {
            this.name = name;
        }

        public Builder type(Type type) {
            types.add(Objects.requireNonNull(type, "type must not be null"));
            return this;
        }

        public Builder types(Collection<? extends Type> types) {
            for (Type t : types) type(t);
            return this;
        }

        public Builder association(Association association) {
            associations.add(Objects.requireNonNull(association, "association must not be null"));
            return this;
        }

        public Builder generalization(Generalization generalization) {
            generalizations.add(Objects.requireNonNull(generalization, "generalization must not be null"));
            return this;
        }

        public Builder pkg(Package pkg) {
            packages.add(Objects.requireNonNull(pkg, "package must not be null"));
            return this;
        }

        public Builder constraint(Constraint constraint) {
            constraints.add(Objects.requireNonNull(constraint, "constraint must not be null"));
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder synonyms(List<String> synonyms) {
            this.synonyms = synonyms;
            return this;
        }

        /** @throws StructuralException {@code DUPLICATE_NAME} if any collection has a name clash */
        public DomainModel build() {
            return new DomainModel(name, types, associations, generalizations, packages, constraints,
                    timestamp, synonyms);
        }
    }
}
