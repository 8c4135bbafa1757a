package info.isaksson.erland.buml.validation;

import info.isaksson.erland.buml.structural.Association;
import info.isaksson.erland.buml.structural.Class;
import info.isaksson.erland.buml.structural.Constraint;
import info.isaksson.erland.buml.structural.DomainModel;
import info.isaksson.erland.buml.structural.Generalization;
import info.isaksson.erland.buml.structural.Method;
import info.isaksson.erland.buml.structural.NamedElement;
import info.isaksson.erland.buml.structural.Package;
import info.isaksson.erland.buml.structural.Parameter;
import info.isaksson.erland.buml.structural.PrimitiveDataTypes;
import info.isaksson.erland.buml.structural.Property;
import info.isaksson.erland.buml.structural.Type;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import static info.isaksson.erland.buml.validation.ValidationIssues.ctx;

/**
 * Whole-model checks that the setters of the metamodel cannot enforce on their own, because they
 * span several elements or depend on what the model contains.
 *
 * <p>Validation never throws and never modifies the model. Every class on a generalization cycle
 * is reported as {@code GENERALIZATION_CYCLE}; classes on or below a cycle are left out of the
 * checks that walk inherited members.</p>
 */
public final class DomainModelValidator {

    public static final String GENERALIZATION_CYCLE = "GENERALIZATION_CYCLE";
    public static final String GENERALIZATION_NOT_IN_MODEL = "GENERALIZATION_NOT_IN_MODEL";
    public static final String ASSOCIATION_END_NOT_IN_MODEL = "ASSOCIATION_END_NOT_IN_MODEL";
    public static final String CONSTRAINT_CONTEXT_NOT_IN_MODEL = "CONSTRAINT_CONTEXT_NOT_IN_MODEL";
    public static final String PACKAGE_CLASS_NOT_IN_MODEL = "PACKAGE_CLASS_NOT_IN_MODEL";
    public static final String INHERITED_ID_CONFLICT = "INHERITED_ID_CONFLICT";
    public static final String MEMBER_NAME_CLASH = "MEMBER_NAME_CLASH";
    public static final String UNKNOWN_ATTRIBUTE_TYPE = "UNKNOWN_ATTRIBUTE_TYPE";
    public static final String STALE_OWNER = "STALE_OWNER";
    public static final String UNREGISTERED_ASSOCIATION = "UNREGISTERED_ASSOCIATION";
    public static final String UNREGISTERED_GENERALIZATION = "UNREGISTERED_GENERALIZATION";

    private DomainModelValidator() {}

    public static ValidationReport validate(DomainModel model) {
        return validate(model, new ValidationOptions());
    }

    public static ValidationReport validate(DomainModel model, ValidationOptions options) {
        Objects.requireNonNull(model, "model must not be null");
        ValidationOptions opt = options == null ? new ValidationOptions() : options;
        ValidationIssues issues = new ValidationIssues(opt.treatWarningsAsErrors);

        Set<Type> types = model.getTypes();
        Set<Class> classes = model.getClasses();

        for (Class c : classes) {
            if (ancestors(c).contains(c)) {
                issues.error(GENERALIZATION_CYCLE,
                        "Class '" + c.getName() + "' is its own ancestor.",
                        ctx("class", c.getName()));
            }
        }

        checkGeneralizations(model, types, issues);
        checkAssociations(model, types, issues);
        checkConstraints(model, types, issues);
        checkPackages(model, types, issues);

        for (Class c : classes) {
            checkOwnership(c, issues);
            checkRegistration(model, c, issues);
            if (opt.checkAttributeTypes) checkMemberTypes(c, types, issues);

            if (touchesCycle(c)) continue;
            checkInheritedIdentifiers(c, issues);
            if (opt.checkMemberNameClashes) checkNameClashes(c, issues);
        }

        return issues.toReport(model.getName());
    }

    private static void checkGeneralizations(DomainModel model, Set<Type> types, ValidationIssues issues) {
        for (Generalization g : model.getGeneralizations()) {
            for (Class side : List.of(g.getGeneral(), g.getSpecific())) {
                if (types.contains(side)) continue;
                issues.error(GENERALIZATION_NOT_IN_MODEL,
                        "Generalization " + g.getGeneral().getName() + " <- " + g.getSpecific().getName()
                                + " refers to class '" + side.getName() + "' which is not part of the model.",
                        ctx("general", g.getGeneral().getName(),
                                "specific", g.getSpecific().getName(),
                                "class", side.getName()));
            }
        }
    }

    private static void checkAssociations(DomainModel model, Set<Type> types, ValidationIssues issues) {
        for (Association a : model.getAssociations()) {
            for (Property end : a.getEnds()) {
                if (types.contains(end.getType())) continue;
                issues.error(ASSOCIATION_END_NOT_IN_MODEL,
                        "End '" + end.getName() + "' of association '" + a.getName() + "' is typed by class '"
                                + end.getType().getName() + "' which is not part of the model.",
                        ctx("association", a.getName(), "end", end.getName(), "class", end.getType().getName()));
            }
        }
    }

    private static void checkConstraints(DomainModel model, Set<Type> types, ValidationIssues issues) {
        for (Constraint constraint : model.getConstraints()) {
            Class context = constraint.getContext();
            if (types.contains(context)) continue;
            issues.error(CONSTRAINT_CONTEXT_NOT_IN_MODEL,
                    "Constraint '" + constraint.getName() + "' has context class '" + context.getName()
                            + "' which is not part of the model.",
                    ctx("constraint", constraint.getName(), "class", context.getName()));
        }
    }

    private static void checkPackages(DomainModel model, Set<Type> types, ValidationIssues issues) {
        for (Package pkg : model.getPackages()) {
            for (Class c : pkg.getClasses()) {
                if (types.contains(c)) continue;
                issues.error(PACKAGE_CLASS_NOT_IN_MODEL,
                        "Package '" + pkg.getName() + "' contains class '" + c.getName()
                                + "' which is not part of the model.",
                        ctx("package", pkg.getName(), "class", c.getName()));
            }
        }
    }

    private static void checkOwnership(Class c, ValidationIssues issues) {
        List<NamedElement> members = new ArrayList<>(c.getAttributes());
        members.addAll(c.getMethods());
        for (NamedElement member : members) {
            NamedElement owner = member instanceof Property
                    ? ((Property) member).getOwner()
                    : ((Method) member).getOwner();
            if (owner == c) continue;
            String kind = member instanceof Property ? "Attribute" : "Method";
            String ownerName = owner == null ? "<none>" : owner.getName();
            issues.warn(STALE_OWNER,
                    kind + " '" + member.getName() + "' of class '" + c.getName() + "' is owned by '" + ownerName + "'.",
                    ctx("class", c.getName(), "member", member.getName(), "owner", ownerName));
        }
    }

    private static void checkRegistration(DomainModel model, Class c, ValidationIssues issues) {
        Set<Association> associations = model.getAssociations();
        for (Association a : c.getAssociations()) {
            if (associations.contains(a)) continue;
            issues.warn(UNREGISTERED_ASSOCIATION,
                    "Class '" + c.getName() + "' takes part in association '" + a.getName()
                            + "' which is not part of the model.",
                    ctx("class", c.getName(), "association", a.getName()));
        }
        Set<Generalization> generalizations = model.getGeneralizations();
        for (Generalization g : c.getGeneralizations()) {
            if (generalizations.contains(g)) continue;
            issues.warn(UNREGISTERED_GENERALIZATION,
                    "Class '" + c.getName() + "' takes part in generalization " + g.getGeneral().getName()
                            + " <- " + g.getSpecific().getName() + " which is not part of the model.",
                    ctx("class", c.getName(), "general", g.getGeneral().getName(),
                            "specific", g.getSpecific().getName()));
        }
    }

    private static void checkMemberTypes(Class c, Set<Type> types, ValidationIssues issues) {
        for (Property p : c.getAttributes()) {
            if (isKnown(p.getType(), types)) continue;
            issues.warn(UNKNOWN_ATTRIBUTE_TYPE,
                    "Attribute '" + p.getName() + "' of class '" + c.getName() + "' is typed by '"
                            + p.getType().getName() + "' which is neither primitive nor part of the model.",
                    ctx("class", c.getName(), "member", p.getName(), "type", p.getType().getName()));
        }
        for (Method m : c.getMethods()) {
            for (Parameter p : m.getParameters()) {
                if (isKnown(p.getType(), types)) continue;
                String member = m.getName() + "." + p.getName();
                issues.warn(UNKNOWN_ATTRIBUTE_TYPE,
                        "Parameter '" + p.getName() + "' of method '" + c.getName() + "." + m.getName()
                                + "' is typed by '" + p.getType().getName()
                                + "' which is neither primitive nor part of the model.",
                        ctx("class", c.getName(), "member", member, "type", p.getType().getName()));
            }
        }
    }

    private static void checkInheritedIdentifiers(Class c, ValidationIssues issues) {
        Set<String> ids = new TreeSet<>();
        int count = 0;
        for (Property p : c.allAttributes()) {
            if (!p.isId()) continue;
            count++;
            ids.add(qualified(p));
        }
        if (count <= 1) return;
        String names = String.join(", ", ids);
        issues.error(INHERITED_ID_CONFLICT,
                "Class '" + c.getName() + "' inherits more than one identifier attribute: " + names + ".",
                ctx("class", c.getName(), "attributes", names));
    }

    private static void checkNameClashes(Class c, ValidationIssues issues) {
        Set<String> endNames = new HashSet<>();
        for (Property end : c.allAssociationEnds()) endNames.add(end.getName());

        Set<String> clashes = new TreeSet<>();
        for (Property p : c.allAttributes()) {
            if (endNames.contains(p.getName())) clashes.add(p.getName());
        }
        for (String name : clashes) {
            issues.warn(MEMBER_NAME_CLASH,
                    "Attribute '" + name + "' of class '" + c.getName() + "' has the same name as an association end.",
                    ctx("class", c.getName(), "member", name));
        }
    }

    // --- helpers -------------------------------------------------------------

    private static boolean isKnown(Type type, Set<Type> types) {
        return PrimitiveDataTypes.isPrimitive(type) || types.contains(type);
    }

    private static String qualified(Property p) {
        NamedElement owner = p.getOwner();
        return owner == null ? p.getName() : owner.getName() + "." + p.getName();
    }

    /** Every class reachable over parent edges, without failing on cycles. */
    private static Set<Class> ancestors(Class start) {
        Set<Class> seen = new LinkedHashSet<>();
        Deque<Class> todo = new ArrayDeque<>(start.parents());
        while (!todo.isEmpty()) {
            Class c = todo.pop();
            if (seen.add(c)) todo.addAll(c.parents());
        }
        return seen;
    }

    /** True when {@code c} or one of its ancestors lies on a cycle, inside the model or not. */
    private static boolean touchesCycle(Class c) {
        Set<Class> ancestors = ancestors(c);
        if (ancestors.contains(c)) return true;
        for (Class ancestor : ancestors) {
            if (ancestors(ancestor).contains(ancestor)) return true;
        }
        return false;
    }
}
