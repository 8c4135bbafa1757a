package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * A class of the domain model.
 *
 * <p>A class owns its attributes and methods. It also keeps back-references to the associations
 * and generalizations that mention it; those sets are maintained exclusively by
 * {@link Association#setEnds(Set)} and the {@link Generalization} setters and are read-only here.</p>
 *
 * <p>Transitive queries ({@link #allParents()}, {@link #allSpecializations()} and everything built on
 * them) fail with {@code CYCLIC_GENERALIZATION} when a class is reached again on the path being
 * followed. A class reached through two different paths is merged.</p>
 */
public class Class extends Type {

    private Set<Property> attributes = new LinkedHashSet<>();
    private Set<Method> methods = new LinkedHashSet<>();
    private boolean isAbstract;
    private boolean readOnly;

    private final Set<Association> associations = new LinkedHashSet<>();
    private final Set<Generalization> generalizations = new LinkedHashSet<>();

    public Class(String name) {
        this(name, null, null, false, false, null, null);
    }

    public Class(String name, Set<Property> attributes) {
        this(name, attributes, null, false, false, null, null);
    }

    public Class(String name, Set<Property> attributes, Set<Method> methods) {
        this(name, attributes, methods, false, false, null, null);
    }

    public Class(String name,
                 Set<Property> attributes,
                 Set<Method> methods,
                 boolean isAbstract,
                 boolean readOnly,
                 Instant timestamp,
                 List<String> synonyms) {
        super(name, timestamp, synonyms);
        List<Property> attributeCandidates = NameRules.candidates(attributes);
        List<Method> methodCandidates = NameRules.candidates(methods);
        checkAttributes(attributeCandidates);
        NameRules.requireUniqueNames(methodCandidates, "A class cannot have methods");
        commitAttributes(attributeCandidates);
        commitMethods(methodCandidates);
        this.isAbstract = isAbstract;
        this.readOnly = readOnly;
    }

    // --- attributes ----------------------------------------------------------

    public Set<Property> getAttributes() {
        return Collections.unmodifiableSet(attributes);
    }

    /**
     * Replaces all attributes. Members dropped from the previous set keep their owner.
     */
    public void setAttributes(Set<Property> attributes) {
        List<Property> candidates = NameRules.candidates(attributes);
        checkAttributes(candidates);
        commitAttributes(candidates);
    }

    private void checkAttributes(List<Property> candidates) {
        NameRules.requireUniqueNames(candidates, "A class cannot have attributes");
        int ids = 0;
        for (Property p : candidates) {
            if (p.isId()) ids++;
        }
        if (ids > 1) {
            throw new StructuralException(StructuralException.Kind.MULTIPLE_IDENTIFIERS,
                    "A class cannot have more than one attribute marked as id: " + getName() + ".");
        }
    }

    private void commitAttributes(List<Property> candidates) {
        for (Property p : candidates) {
            p.setOwner(this);
        }
        this.attributes = new LinkedHashSet<>(candidates);
    }

    public void addAttribute(Property attribute) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        if (NameRules.containsName(attributes, attribute.getName())) {
            throw StructuralException.duplicateName(
                    "A class cannot have two attributes with the same name: '" + attribute.getName() + "'.");
        }
        if (attribute.isId() && idAttribute().isPresent()) {
            throw new StructuralException(StructuralException.Kind.MULTIPLE_IDENTIFIERS,
                    "A class cannot have more than one attribute marked as id: " + getName() + ".");
        }
        attribute.setOwner(this);
        attributes.add(attribute);
    }

    public Optional<Property> getAttributeByName(String name) {
        return findByName(attributes, name);
    }

    /** The attribute marked as identifier, if any. */
    public Optional<Property> idAttribute() {
        for (Property p : attributes) {
            if (p.isId()) return Optional.of(p);
        }
        return Optional.empty();
    }

    /** Attributes of every transitive parent. */
    public Set<Property> inheritedAttributes() {
        Set<Property> out = new LinkedHashSet<>();
        for (Class parent : allParents()) {
            out.addAll(parent.attributes);
        }
        return out;
    }

    /** Own attributes followed by inherited ones. Same-named attributes of different classes are all kept. */
    public Set<Property> allAttributes() {
        Set<Property> out = new LinkedHashSet<>(attributes);
        out.addAll(inheritedAttributes());
        return out;
    }

    // --- methods -------------------------------------------------------------

    public Set<Method> getMethods() {
        return Collections.unmodifiableSet(methods);
    }

    public void setMethods(Set<Method> methods) {
        List<Method> candidates = NameRules.candidates(methods);
        NameRules.requireUniqueNames(candidates, "A class cannot have methods");
        commitMethods(candidates);
    }

    private void commitMethods(List<Method> candidates) {
        for (Method m : candidates) {
            m.setOwner(this);
        }
        this.methods = new LinkedHashSet<>(candidates);
    }

    public void addMethod(Method method) {
        Objects.requireNonNull(method, "method must not be null");
        if (NameRules.containsName(methods, method.getName())) {
            throw StructuralException.duplicateName(
                    "A class cannot have two methods with the same name: '" + method.getName() + "'.");
        }
        method.setOwner(this);
        methods.add(method);
    }

    public Optional<Method> getMethodByName(String name) {
        return findByName(methods, name);
    }

    // --- flags ---------------------------------------------------------------

    public boolean isAbstract() {
        return isAbstract;
    }

    public void setAbstract(boolean isAbstract) {
        this.isAbstract = isAbstract;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    // --- back-references -----------------------------------------------------

    /** Associations having at least one end typed by this class. */
    public Set<Association> getAssociations() {
        return Collections.unmodifiableSet(associations);
    }

    /** Generalizations in which this class is the general or the specific side. */
    public Set<Generalization> getGeneralizations() {
        return Collections.unmodifiableSet(generalizations);
    }

    void addAssociationRef(Association association) {
        associations.add(association);
    }

    void removeAssociationRef(Association association) {
        associations.remove(association);
    }

    void addGeneralizationRef(Generalization generalization) {
        generalizations.add(generalization);
    }

    void removeGeneralizationRef(Generalization generalization) {
        generalizations.remove(generalization);
    }

    // --- association ends ----------------------------------------------------

    /**
     * The opposite ends of every association of this class. For a binary self-association both
     * ends are returned.
     */
    public Set<Property> associationEnds() {
        Set<Property> out = new LinkedHashSet<>();
        for (Association association : associations) {
            Set<Property> ends = association.getEnds();
            boolean selfAssociation = isSelfAssociation(ends);
            for (Property end : ends) {
                if (selfAssociation || end.getType() != this) out.add(end);
            }
        }
        return out;
    }

    /** {@link #associationEnds()} of this class and of every transitive parent. */
    public Set<Property> allAssociationEnds() {
        Set<Property> out = associationEnds();
        for (Class parent : allParents()) {
            out.addAll(parent.associationEnds());
        }
        return out;
    }

    private static boolean isSelfAssociation(Set<Property> ends) {
        if (ends.size() != 2) return false;
        var it = ends.iterator();
        return it.next().getType() == it.next().getType();
    }

    // --- inheritance ---------------------------------------------------------

    /** Direct parents. */
    public Set<Class> parents() {
        Set<Class> out = new LinkedHashSet<>();
        for (Generalization g : generalizations) {
            if (g.getGeneral() != this) out.add(g.getGeneral());
        }
        return out;
    }

    /** Direct and indirect parents. */
    public Set<Class> allParents() {
        return closure(Class::parents);
    }

    /** Direct children. */
    public Set<Class> specializations() {
        Set<Class> out = new LinkedHashSet<>();
        for (Generalization g : generalizations) {
            if (g.getSpecific() != this) out.add(g.getSpecific());
        }
        return out;
    }

    /** Direct and indirect children. */
    public Set<Class> allSpecializations() {
        return closure(Class::specializations);
    }

    private Set<Class> closure(Function<Class, Set<Class>> next) {
        Set<Class> out = new LinkedHashSet<>();
        Set<Class> onPath = new HashSet<>();
        walk(this, next, onPath, out);
        return out;
    }

    private static void walk(Class node, Function<Class, Set<Class>> next, Set<Class> onPath, Set<Class> out) {
        onPath.add(node);
        for (Class c : next.apply(node)) {
            if (onPath.contains(c)) {
                throw new StructuralException(StructuralException.Kind.CYCLIC_GENERALIZATION,
                        "Generalization cycle through class '" + c.getName() + "'.");
            }
            if (out.add(c)) walk(c, next, onPath, out);
        }
        onPath.remove(node);
    }

    private static <T extends NamedElement> Optional<T> findByName(Set<T> elements, String name) {
        for (T e : elements) {
            if (Objects.equals(e.getName(), name)) return Optional.of(e);
        }
        return Optional.empty();
    }
}
