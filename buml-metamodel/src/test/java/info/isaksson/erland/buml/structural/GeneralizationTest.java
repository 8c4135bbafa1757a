package info.isaksson.erland.buml.structural;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GeneralizationTest {

    @Test
    void bothSidesHoldTheGeneralization() {
        Class animal = new Class("Animal");
        Class dog = new Class("Dog");
        Generalization g = new Generalization(animal, dog);

        assertEquals(Set.of(g), animal.getGeneralizations());
        assertEquals(Set.of(g), dog.getGeneralizations());
        assertEquals(Set.of(animal), dog.parents());
        assertEquals(Set.of(dog), animal.specializations());
        assertTrue(animal.parents().isEmpty());
        assertEquals("Generalization(Animal <- Dog)", g.toString());
    }

    @Test
    void selfGeneralizationIsRejected() {
        Class a = new Class("A");
        Class b = new Class("B");
        StructuralException ctor = assertThrows(StructuralException.class, () -> new Generalization(a, a));
        assertEquals(StructuralException.Kind.SELF_GENERALIZATION, ctor.kind);
        assertTrue(a.getGeneralizations().isEmpty());
        assertTrue(a.specializations().isEmpty());
        assertTrue(a.allSpecializations().isEmpty());

        Generalization g = new Generalization(a, b);
        StructuralException general = assertThrows(StructuralException.class, () -> g.setGeneral(b));
        assertEquals(StructuralException.Kind.SELF_GENERALIZATION, general.kind);
        StructuralException specific = assertThrows(StructuralException.class, () -> g.setSpecific(a));
        assertEquals(StructuralException.Kind.SELF_GENERALIZATION, specific.kind);

        assertSame(a, g.getGeneral());
        assertSame(b, g.getSpecific());
        assertTrue(a.getGeneralizations().contains(g));
        assertTrue(b.getGeneralizations().contains(g));
    }

    @Test
    void reassigningSidesMovesBackReferences() {
        Class a = new Class("A");
        Class b = new Class("B");
        Class c = new Class("C");
        Class d = new Class("D");
        Generalization g = new Generalization(a, b);

        g.setGeneral(c);
        assertFalse(a.getGeneralizations().contains(g));
        assertTrue(c.getGeneralizations().contains(g));

        g.setSpecific(d);
        assertFalse(b.getGeneralizations().contains(g));
        assertTrue(d.getGeneralizations().contains(g));
        assertEquals(Set.of(c), d.parents());
    }

    @Test
    void transitiveParentsAndChildren() {
        Class a = new Class("A");
        Class b = new Class("B");
        Class c = new Class("C");
        new Generalization(a, b);
        new Generalization(b, c);

        assertEquals(Set.of(a, b), c.allParents());
        assertEquals(Set.of(b, c), a.allSpecializations());
        assertTrue(a.allParents().isEmpty());
    }

    @Test
    void diamondIsNotACycle() {
        Class top = new Class("Top");
        Class left = new Class("Left");
        Class right = new Class("Right");
        Class bottom = new Class("Bottom");
        new Generalization(top, left);
        new Generalization(top, right);
        new Generalization(left, bottom);
        new Generalization(right, bottom);

        assertEquals(Set.of(top, left, right), bottom.allParents());
        assertEquals(Set.of(left, right, bottom), top.allSpecializations());
    }

    @Test
    void cycleFailsTransitiveQueries() {
        Class a = new Class("A");
        Class b = new Class("B");
        Class c = new Class("C");
        new Generalization(a, b);
        new Generalization(b, c);
        new Generalization(c, a);

        StructuralException ex = assertThrows(StructuralException.class, a::allParents);
        assertEquals(StructuralException.Kind.CYCLIC_GENERALIZATION, ex.kind);
        assertThrows(StructuralException.class, b::allSpecializations);
        assertThrows(StructuralException.class, c::allAttributes);
        // direct queries still work
        assertEquals(Set.of(b), c.parents());
    }

    @Test
    void generalizationSetGroupsEdges() {
        Class vehicle = new Class("Vehicle");
        Generalization car = new Generalization(vehicle, new Class("Car"));
        Generalization bike = new Generalization(vehicle, new Class("Bike"));
        GeneralizationSet set = new GeneralizationSet("kind", Set.of(car, bike), true, false);

        assertEquals(Set.of(car, bike), set.getGeneralizations());
        assertTrue(set.isDisjoint());
        assertFalse(set.isComplete());
        set.setComplete(true);
        assertTrue(set.isComplete());
    }
}
