package info.isaksson.erland.buml.structural;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DomainModelTest {

    @SafeVarargs
    private static <T> Set<T> set(T... items) {
        return new LinkedHashSet<>(List.of(items));
    }

    @Test
    void primitiveTypesAreAlwaysPresent() {
        DomainModel model = new DomainModel("Library");
        assertTrue(model.getTypes().containsAll(PrimitiveDataTypes.all()));
        assertSame(PrimitiveDataTypes.INTEGER, model.getTypeByName("int").orElseThrow());

        model.setTypes(Set.of(new Class("Book")));
        assertTrue(model.getTypes().containsAll(PrimitiveDataTypes.all()));
        assertEquals(PrimitiveDataTypes.all().size() + 1, model.getTypes().size());
    }

    @Test
    void duplicateTypeNamesFailConstruction() {
        StructuralException ex = assertThrows(StructuralException.class,
                () -> new DomainModel("Library", set(new Class("Book"), new Class("Book")), null, null));
        assertEquals(StructuralException.Kind.DUPLICATE_NAME, ex.kind);
        assertTrue(ex.getMessage().contains("Book"));
    }

    @Test
    void userTypeCannotReusePrimitiveName() {
        DomainModel model = new DomainModel("M");
        StructuralException ex = assertThrows(StructuralException.class, () -> model.addType(new Class("int")));
        assertEquals(StructuralException.Kind.DUPLICATE_NAME, ex.kind);
    }

    @Test
    void rejectedTypeSetLeavesModelUnchanged() {
        Class book = new Class("Book");
        DomainModel model = new DomainModel("Library", Set.of(book), null, null);
        Set<Type> before = Set.copyOf(model.getTypes());

        assertThrows(StructuralException.class, () -> model.setTypes(set(new Class("Author"), new Class("Author"))));
        assertEquals(before, model.getTypes());

        assertThrows(StructuralException.class, () -> model.addType(new Class("Book")));
        assertEquals(before, model.getTypes());
        assertSame(book, model.getClassByName("Book").orElseThrow());
    }

    @Test
    void classesAndEnumerationsComeInCreationOrder() {
        Class b = new Class("B");
        Enumeration e1 = new Enumeration("E1");
        Class a = new Class("A");
        Enumeration e2 = new Enumeration("E2");
        DomainModel model = new DomainModel("M", set(a, e2, b, e1), null, null);

        assertEquals(List.of(b, a), List.copyOf(model.getClasses()));
        assertEquals(List.of(e1, e2), List.copyOf(model.getEnumerations()));
        assertTrue(model.getClassByName("E1").isEmpty());
        assertTrue(model.getClassByName("missing").isEmpty());
        assertSame(e1, model.getTypeByName("E1").orElseThrow());
    }

    @Test
    void duplicateAssociationPackageAndConstraintNames() {
        Class a = new Class("A");
        Class b = new Class("B");
        Association first = new Association("link", set(new Property("a", a), new Property("b", b)));
        Association second = new Association("link", set(new Property("a2", a), new Property("b2", b)));
        DomainModel model = new DomainModel("M", set(a, b), set(first), null);

        StructuralException assoc = assertThrows(StructuralException.class, () -> model.addAssociation(second));
        assertEquals(StructuralException.Kind.DUPLICATE_NAME, assoc.kind);
        assertEquals(Set.of(first), model.getAssociations());
        assertSame(first, model.getAssociationByName("link").orElseThrow());

        model.addPackage(new Package("core", Set.of(a)));
        assertThrows(StructuralException.class, () -> model.addPackage(new Package("core", Set.of(b))));
        assertEquals(1, model.getPackages().size());

        model.addConstraint(new Constraint("positive", a, "self.x > 0", "OCL"));
        StructuralException constraint = assertThrows(StructuralException.class,
                () -> model.addConstraint(new Constraint("positive", b, "true", "OCL")));
        assertEquals(StructuralException.Kind.DUPLICATE_NAME, constraint.kind);
        assertEquals(1, model.getConstraints().size());
    }

    @Test
    void generalizationsAreNotNameChecked() {
        Class a = new Class("A");
        Class b = new Class("B");
        Class c = new Class("C");
        DomainModel model = new DomainModel("M", set(a, b, c), null, null);
        model.addGeneralization(new Generalization(a, b));
        model.addGeneralization(new Generalization(a, c));
        assertEquals(2, model.getGeneralizations().size());
    }

    @Test
    void inheritanceOrderPutsParentsFirstRegardlessOfCreationOrder() {
        Class c = new Class("C");
        Class b = new Class("B");
        Class a = new Class("A");
        Class unrelated = new Class("Z");
        Generalization ab = new Generalization(a, b);
        Generalization bc = new Generalization(b, c);
        DomainModel model = new DomainModel("M", set(c, a, unrelated, b), null, set(ab, bc));

        List<Class> sorted = model.classesSortedByInheritance();
        assertEquals(4, sorted.size());
        assertTrue(sorted.indexOf(a) < sorted.indexOf(b));
        assertTrue(sorted.indexOf(b) < sorted.indexOf(c));
        assertTrue(sorted.contains(unrelated));
    }

    @Test
    void inheritanceOrderIsStableForUnrelatedClasses() {
        Class x = new Class("X");
        Class y = new Class("Y");
        Class z = new Class("Z");
        DomainModel model = new DomainModel("M", set(z, x, y), null, null);
        assertEquals(List.of(x, y, z), model.classesSortedByInheritance());
    }

    @Test
    void inheritanceOrderHandlesDiamond() {
        Class top = new Class("Top");
        Class left = new Class("Left");
        Class right = new Class("Right");
        Class bottom = new Class("Bottom");
        new Generalization(top, left);
        new Generalization(top, right);
        new Generalization(left, bottom);
        new Generalization(right, bottom);
        DomainModel model = new DomainModel("M", set(bottom, right, left, top), null, null);

        List<Class> sorted = model.classesSortedByInheritance();
        assertEquals(top, sorted.get(0));
        assertEquals(bottom, sorted.get(3));
    }

    @Test
    void inheritanceOrderFailsOnCycle() {
        Class a = new Class("A");
        Class b = new Class("B");
        new Generalization(a, b);
        new Generalization(b, a);
        DomainModel model = new DomainModel("M", set(a, b), null, null);

        StructuralException ex = assertThrows(StructuralException.class, model::classesSortedByInheritance);
        assertEquals(StructuralException.Kind.CYCLIC_GENERALIZATION, ex.kind);
    }

    @Test
    void packageLookupByName() {
        Class book = new Class("Book");
        Package pkg = new Package("catalog", Set.of(book));
        assertSame(book, pkg.getClassByName("Book").orElseThrow());
        assertTrue(pkg.getClassByName("Author").isEmpty());
    }

    @Test
    void builderValidatesOnceOnBuild() {
        Class book = new Class("Book");
        Class author = new Class("Author");
        Generalization g = new Generalization(new Class("Work"), book);
        DomainModel.Builder builder = DomainModel.builder("Library")
                .type(book)
                .generalization(g)
                .type(author)
                .pkg(new Package("core", Set.of(book, author)));

        DomainModel model = builder.build();
        assertEquals(List.of(book, author), List.copyOf(model.getClasses()));
        assertEquals(Set.of(g), model.getGeneralizations());
        assertEquals(1, model.getPackages().size());

        builder.type(new Class("Book"));
        StructuralException ex = assertThrows(StructuralException.class, builder::build);
        assertEquals(StructuralException.Kind.DUPLICATE_NAME, ex.kind);
        assertEquals(2, model.getClasses().size());
    }
}
