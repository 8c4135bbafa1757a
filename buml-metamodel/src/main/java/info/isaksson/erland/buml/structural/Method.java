package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An operation of a class. Parameters keep the order in which they were given.
 */
public class Method extends TypedElement {

    /** Name of the return type used when none is given. */
    public static final String VOID_TYPE_NAME = "OclVoid";

    private boolean isAbstract;
    private Set<Parameter> parameters = new LinkedHashSet<>();
    private NamedElement owner;
    private String code;

    public Method(String name) {
        this(name, null, null);
    }

    public Method(String name, Type type) {
        this(name, type, null);
    }

    public Method(String name, Type type, Set<Parameter> parameters) {
        this(name, Visibility.PUBLIC, false, parameters, type == null ? null : TypeReference.of(type), null, "", null, null);
    }

    /**
     * @param type return type; {@code null} means {@value #VOID_TYPE_NAME}
     */
    public Method(String name,
                  Visibility visibility,
                  boolean isAbstract,
                  Set<Parameter> parameters,
                  TypeReference type,
                  NamedElement owner,
                  String code,
                  Instant timestamp,
                  List<String> synonyms) {
        super(name, type == null ? TypeReference.named(VOID_TYPE_NAME) : type, timestamp, synonyms,
                visibility == null ? Visibility.PUBLIC : visibility);
        this.isAbstract = isAbstract;
        setParameters(parameters);
        setOwner(owner);
        setCode(code);
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public void setAbstract(boolean isAbstract) {
        this.isAbstract = isAbstract;
    }

    public Set<Parameter> getParameters() {
        return Collections.unmodifiableSet(parameters);
    }

    public void setParameters(Set<Parameter> parameters) {
        List<Parameter> candidates = NameRules.candidates(parameters);
        NameRules.requireUniqueNames(candidates, "A method cannot have parameters");
        this.parameters = new LinkedHashSet<>(candidates);
    }

    public void addParameter(Parameter parameter) {
        Objects.requireNonNull(parameter, "parameter must not be null");
        if (NameRules.containsName(parameters, parameter.getName())) {
            throw StructuralException.duplicateName(
                    "A method cannot have two parameters with the same name: '" + parameter.getName() + "'.");
        }
        parameters.add(parameter);
    }

    public NamedElement getOwner() {
        return owner;
    }

    public void setOwner(NamedElement owner) {
        if (owner instanceof DataType) {
            throw StructuralException.invalidOwner("Invalid owner of method '" + getName()
                    + "': data type " + owner.getName() + " cannot own methods.");
        }
        this.owner = owner;
    }

    /** Method body as source text; empty when none. */
    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code == null ? "" : code;
    }
}
