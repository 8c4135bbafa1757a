package info.isaksson.erland.buml.structural;

/**
 * Visibility of a named element.
 */
public enum Visibility {
    PUBLIC("public"),
    PRIVATE("private"),
    PROTECTED("protected"),
    PACKAGE("package");

    public final String value;

    Visibility(String value) {
        this.value = value;
    }

    /** Parse one of {@code public|private|protected|package}; anything else is rejected. */
    public static Visibility parse(String v) {
        if (v != null) {
            for (Visibility vis : values()) {
                if (vis.value.equals(v)) return vis;
            }
        }
        throw StructuralException.invalidValue("Invalid value of visibility: " + v
                + " (expected one of: public|private|protected|package)");
    }
}
