package info.isaksson.erland.buml.validation;

/**
 * Switches for {@link DomainModelValidator}.
 *
 * <p>The structural checks (cycles, elements missing from the model, identifier conflicts) always
 * run; only the advisory ones can be turned off.</p>
 */
public final class ValidationOptions {

    /** Report attributes and parameters typed by a type that is neither primitive nor part of the model. */
    public boolean checkAttributeTypes = true;

    /** Report attribute names that are also the name of a reachable association end. */
    public boolean checkMemberNameClashes = true;

    /** Record every warning with severity {@code ERROR}. */
    public boolean treatWarningsAsErrors = false;
}
