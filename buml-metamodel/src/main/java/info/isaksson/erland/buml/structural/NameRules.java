package info.isaksson.erland.buml.structural;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/** Duplicate-name checks shared by every validated collection setter. */
final class NameRules {

    private NameRules() {}

    /**
     * Fails with {@code DUPLICATE_NAME} if two elements of {@code candidates} share a name.
     * Duplicates are listed in sorted order so the message is stable.
     */
    static void requireUniqueNames(Collection<? extends NamedElement> candidates, String what) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (NamedElement e : candidates) {
            if (!seen.add(e.getName())) duplicates.add(String.valueOf(e.getName()));
        }
        if (!duplicates.isEmpty()) {
            throw StructuralException.duplicateName(what + " with duplicate names: " + String.join(", ", duplicates) + ".");
        }
    }

    static boolean containsName(Collection<? extends NamedElement> elements, String name) {
        for (NamedElement e : elements) {
            if (Objects.equals(e.getName(), name)) return true;
        }
        return false;
    }

    /** Copies {@code in} without null entries; {@code null} means empty. */
    static <T> List<T> candidates(Collection<? extends T> in) {
        List<T> out = new ArrayList<>();
        if (in == null) return out;
        for (T t : in) {
            if (t == null) throw new NullPointerException("collection must not contain null");
            out.add(t);
        }
        return out;
    }
}
