package info.isaksson.erland.buml.structural;

/**
 * Cardinality bounds of a property or association end.
 *
 * <p>Invariant: {@code 0 <= min <= max}. An unbounded upper bound is stored as
 * {@link #UNLIMITED}. Both bounds are re-checked whenever either one is reassigned.</p>
 */
public final class Multiplicity {

    /** Upper bound value representing '*' (unbounded). */
    public static final int UNLIMITED = 9999;

    /** Textual form of the unbounded upper bound. */
    public static final String STAR = "*";

    private int min;
    private int max;

    public Multiplicity(int min, int max) {
        checkMin(min);
        checkMax(max, min);
        this.min = min;
        this.max = max;
    }

    /** @param max a non-negative integer literal or {@code "*"} */
    public Multiplicity(int min, String max) {
        this(min, parseMax(max));
    }

    public static Multiplicity one() {
        return new Multiplicity(1, 1);
    }

    public static Multiplicity optional() {
        return new Multiplicity(0, 1);
    }

    public static Multiplicity many() {
        return new Multiplicity(0, UNLIMITED);
    }

    public int getMin() {
        return min;
    }

    public void setMin(int min) {
        checkMin(min);
        if (max < min) {
            throw StructuralException.invalidValue("Invalid min multiplicity: " + min + " exceeds max " + max);
        }
        this.min = min;
    }

    public int getMax() {
        return max;
    }

    public void setMax(int max) {
        checkMax(max, this.min);
        this.max = max;
    }

    public void setMax(String max) {
        setMax(parseMax(max));
    }

    public boolean isUnbounded() {
        return max == UNLIMITED;
    }

    public boolean isMany() {
        return max > 1;
    }

    public boolean isOptional() {
        return min == 0;
    }

    private static void checkMin(int min) {
        if (min < 0) {
            throw StructuralException.invalidValue("Invalid min multiplicity: " + min);
        }
    }

    private static void checkMax(int max, int min) {
        if (max < 0) {
            throw StructuralException.invalidValue("Invalid max multiplicity: " + max);
        }
        if (max < min) {
            throw StructuralException.invalidValue("Invalid max multiplicity: " + max + " is below min " + min);
        }
    }

    private static int parseMax(String max) {
        if (STAR.equals(max)) return UNLIMITED;
        if (max == null) {
            throw StructuralException.invalidValue("Invalid max multiplicity: null");
        }
        try {
            return Integer.parseInt(max.trim());
        } catch (NumberFormatException e) {
            StructuralException ex = StructuralException.invalidValue("Invalid max multiplicity: " + max);
            ex.initCause(e);
            throw ex;
        }
    }

    /** {@code min..max}, with {@code *} for the unbounded sentinel. */
    public String label() {
        return min + ".." + (isUnbounded() ? STAR : Integer.toString(max));
    }

    @Override
    public String toString() {
        return "Multiplicity(" + label() + ")";
    }
}
