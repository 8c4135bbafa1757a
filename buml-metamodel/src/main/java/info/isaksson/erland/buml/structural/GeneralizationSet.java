package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** A named group of generalizations with disjointness and completeness flags. */
public class GeneralizationSet extends NamedElement {

    private Set<Generalization> generalizations;
    private boolean disjoint;
    private boolean complete;

    public GeneralizationSet(String name, Set<Generalization> generalizations, boolean disjoint, boolean complete) {
        this(name, generalizations, disjoint, complete, null, null);
    }

    public GeneralizationSet(String name, Set<Generalization> generalizations, boolean disjoint, boolean complete,
                             Instant timestamp, List<String> synonyms) {
        super(name, timestamp, synonyms, Visibility.PUBLIC);
        setGeneralizations(generalizations);
        this.disjoint = disjoint;
        this.complete = complete;
    }

    public Set<Generalization> getGeneralizations() {
        return Collections.unmodifiableSet(generalizations);
    }

    public void setGeneralizations(Set<Generalization> generalizations) {
        this.generalizations = new LinkedHashSet<>(NameRules.candidates(generalizations));
    }

    public boolean isDisjoint() {
        return disjoint;
    }

    public void setDisjoint(boolean disjoint) {
        this.disjoint = disjoint;
    }

    public boolean isComplete() {
        return complete;
    }

    public void setComplete(boolean complete) {
        this.complete = complete;
    }
}
