package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;

/**
 * An element with a name, optional synonyms and a visibility (default {@code public}).
 */
public abstract class NamedElement extends Element {

    private String name;
    private List<String> synonyms;
    private Visibility visibility;

    protected NamedElement(String name) {
        this(name, null, null, Visibility.PUBLIC);
    }

    protected NamedElement(String name, Instant timestamp, List<String> synonyms, Visibility visibility) {
        super(timestamp);
        setName(name);
        setSynonyms(synonyms);
        setVisibility(visibility);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /** Synonyms in the order given; empty when none were set. */
    public List<String> getSynonyms() {
        return synonyms;
    }

    public void setSynonyms(List<String> synonyms) {
        this.synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public void setVisibility(Visibility visibility) {
        if (visibility == null) {
            throw StructuralException.invalidValue("Invalid value of visibility: null");
        }
        this.visibility = visibility;
    }

    /** Textual form, one of {@code public|private|protected|package}. */
    public void setVisibility(String visibility) {
        setVisibility(Visibility.parse(visibility));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
