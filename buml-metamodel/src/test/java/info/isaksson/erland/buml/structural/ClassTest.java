package info.isaksson.erland.buml.structural;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ClassTest {

    @Test
    void addAttributeSetsOwnerAndRejectsDuplicateName() {
        Class book = new Class("Book");
        Property title = new Property("title", PrimitiveDataTypes.STRING);
        book.addAttribute(title);

        assertSame(book, title.getOwner());
        assertTrue(book.getAttributes().contains(title));

        Property otherTitle = new Property("title", PrimitiveDataTypes.INTEGER);
        StructuralException ex = assertThrows(StructuralException.class, () -> book.addAttribute(otherTitle));
        assertEquals(StructuralException.Kind.DUPLICATE_NAME, ex.kind);
        assertNull(otherTitle.getOwner());
        assertEquals(1, book.getAttributes().size());
    }

    @Test
    void bulkAttributeSetterRepointsOwnersAndValidatesWholeCandidate() {
        Property a = new Property("a", PrimitiveDataTypes.STRING);
        Property b = new Property("b", PrimitiveDataTypes.STRING);
        Class c = new Class("C", Set.of(a));

        Property dupA = new Property("a", PrimitiveDataTypes.INTEGER);
        StructuralException ex = assertThrows(StructuralException.class,
                () -> c.setAttributes(new LinkedHashSet<>(List.of(a, b, dupA))));
        assertEquals(StructuralException.Kind.DUPLICATE_NAME, ex.kind);
        assertEquals(Set.of(a), c.getAttributes());
        assertNull(b.getOwner());

        c.setAttributes(Set.of(a, b));
        assertSame(c, b.getOwner());
        assertEquals(2, c.getAttributes().size());
    }

    @Test
    void atMostOneIdentifierAttribute() {
        Property id1 = new Property("id", PrimitiveDataTypes.INTEGER);
        id1.setId(true);
        Property id2 = new Property("code", PrimitiveDataTypes.STRING);
        id2.setId(true);

        StructuralException ex = assertThrows(StructuralException.class, () -> new Class("Book", Set.of(id1, id2)));
        assertEquals(StructuralException.Kind.MULTIPLE_IDENTIFIERS, ex.kind);

        Class book = new Class("Book", Set.of(id1));
        assertSame(id1, book.idAttribute().orElseThrow());

        StructuralException addEx = assertThrows(StructuralException.class, () -> book.addAttribute(id2));
        assertEquals(StructuralException.Kind.MULTIPLE_IDENTIFIERS, addEx.kind);
        assertFalse(book.getAttributes().contains(id2));
    }

    @Test
    void idAttributeIsEmptyWithoutIdentifier() {
        Class c = new Class("C", Set.of(new Property("x", PrimitiveDataTypes.FLOAT)));
        assertTrue(c.idAttribute().isEmpty());
    }

    @Test
    void removingAttributeThroughBulkSetterLeavesOwnerPointingAtClass() {
        Class c = new Class("C");
        Property p = new Property("p", PrimitiveDataTypes.STRING);
        Property q = new Property("q", PrimitiveDataTypes.STRING);
        c.addAttribute(p);
        c.addAttribute(q);

        Set<Property> reduced = new LinkedHashSet<>(c.getAttributes());
        reduced.remove(p);
        c.setAttributes(reduced);

        assertFalse(c.getAttributes().contains(p));
        assertTrue(c.getAttributes().contains(q));
        assertSame(c, p.getOwner());
    }

    @Test
    void attributeCollectionIsNotModifiableDirectly() {
        Class c = new Class("C");
        assertThrows(UnsupportedOperationException.class,
                () -> c.getAttributes().add(new Property("x", PrimitiveDataTypes.STRING)));
    }

    @Test
    void methodsAreOwnedAndUniqueByName() {
        Class c = new Class("Library");
        Method open = new Method("open");
        c.addMethod(open);
        assertSame(c, open.getOwner());
        assertSame(open, c.getMethodByName("open").orElseThrow());

        StructuralException ex = assertThrows(StructuralException.class, () -> c.addMethod(new Method("open")));
        assertEquals(StructuralException.Kind.DUPLICATE_NAME, ex.kind);

        assertThrows(StructuralException.class,
                () -> c.setMethods(new LinkedHashSet<>(List.of(new Method("close"), new Method("close")))));
        assertEquals(Set.of(open), c.getMethods());
    }

    @Test
    void allAttributesIsOwnPlusEveryTransitiveParent() {
        Property name = new Property("name", PrimitiveDataTypes.STRING);
        Property salary = new Property("salary", PrimitiveDataTypes.FLOAT);
        Property team = new Property("team", PrimitiveDataTypes.STRING);
        Property otherName = new Property("name", PrimitiveDataTypes.STRING);

        Class person = new Class("Person", Set.of(name));
        Class employee = new Class("Employee", Set.of(salary));
        Class manager = new Class("Manager", new LinkedHashSet<>(List.of(team, otherName)));
        new Generalization(person, employee);
        new Generalization(employee, manager);

        assertEquals(Set.of(name, salary), manager.inheritedAttributes());

        Set<Property> all = manager.allAttributes();
        assertTrue(all.containsAll(manager.getAttributes()));
        Set<Property> expected = new LinkedHashSet<>(manager.getAttributes());
        for (Class parent : manager.allParents()) expected.addAll(parent.getAttributes());
        assertEquals(expected, all);
        // same-named attributes from different classes are both kept
        assertEquals(4, all.size());
        assertTrue(all.contains(name) && all.contains(otherName));

        assertEquals(Set.of(name), person.allAttributes());
    }

    @Test
    void dataTypesCannotOwnMembers() {
        Property p = new Property("p", PrimitiveDataTypes.STRING);
        StructuralException ex = assertThrows(StructuralException.class, () -> p.setOwner(new Enumeration("E")));
        assertEquals(StructuralException.Kind.INVALID_OWNER, ex.kind);
        assertThrows(StructuralException.class, () -> p.setOwner(PrimitiveDataTypes.INTEGER));
        assertNull(p.getOwner());

        Method m = new Method("m");
        assertThrows(StructuralException.class, () -> m.setOwner(new DataType("Money")));
    }

    @Test
    void rejectedConstructorLeavesMemberOwnersAlone() {
        Property p = new Property("p", PrimitiveDataTypes.STRING);
        Class owner = new Class("Owner", Set.of(p));

        Set<Method> duplicateMethods = new LinkedHashSet<>(List.of(new Method("m"), new Method("m")));
        StructuralException ex = assertThrows(StructuralException.class,
                () -> new Class("Other", Set.of(p), duplicateMethods));
        assertEquals(StructuralException.Kind.DUPLICATE_NAME, ex.kind);
        assertSame(owner, p.getOwner());
        for (Method m : duplicateMethods) assertNull(m.getOwner());

        Property q = new Property("q", PrimitiveDataTypes.STRING);
        assertThrows(NullPointerException.class, () -> new AssociationClass("Link", Set.of(q), null));
        assertNull(q.getOwner());
    }
}
