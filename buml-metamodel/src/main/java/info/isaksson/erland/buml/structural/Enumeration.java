package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** A data type with a fixed set of named literals. */
public class Enumeration extends DataType {

    private Set<EnumerationLiteral> literals = new LinkedHashSet<>();

    public Enumeration(String name) {
        this(name, null);
    }

    public Enumeration(String name, Set<EnumerationLiteral> literals) {
        this(name, literals, null, null);
    }

    public Enumeration(String name, Set<EnumerationLiteral> literals, Instant timestamp, List<String> synonyms) {
        super(name, timestamp, synonyms);
        setLiterals(literals);
    }

    public Set<EnumerationLiteral> getLiterals() {
        return Collections.unmodifiableSet(literals);
    }

    /** Replaces all literals; every literal of the new set is owned by this enumeration. */
    public void setLiterals(Set<EnumerationLiteral> literals) {
        List<EnumerationLiteral> candidates = NameRules.candidates(literals);
        NameRules.requireUniqueNames(candidates, "An enumeration cannot have literals");
        for (EnumerationLiteral literal : candidates) {
            literal.setOwner(this);
        }
        this.literals = new LinkedHashSet<>(candidates);
    }

    public void addLiteral(EnumerationLiteral literal) {
        Objects.requireNonNull(literal, "literal must not be null");
        if (NameRules.containsName(literals, literal.getName())) {
            throw StructuralException.duplicateName(
                    "An enumeration cannot have two literals with the same name: '" + literal.getName() + "'.");
        }
        literal.setOwner(this);
        literals.add(literal);
    }

    public Optional<EnumerationLiteral> getLiteralByName(String name) {
        for (EnumerationLiteral literal : literals) {
            if (Objects.equals(literal.getName(), name)) return Optional.of(literal);
        }
        return Optional.empty();
    }
}
