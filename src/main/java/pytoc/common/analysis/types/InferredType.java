package pytoc.common.analysis.types;

/**
 * The static type assigned to an expression or variable so that it can
 * be declared and printed in C.
 *
 * The numeric types are ordered by width: BOOLEAN &lt; INTEGER &lt;
 * FLOATING_POINT.  TEXT is not numeric.  UNKNOWN is transient and has no
 * C spelling.
 */
public enum InferredType {

    BOOLEAN("bool", 0),
    INTEGER("int", 1),
    FLOATING_POINT("double", 2),
    TEXT("const char *", -1),
    UNKNOWN(null, -1);

    /** The C type used to declare variables of this type. */
    private final String cName;
    /** Position in the widening order, or -1 if not numeric. */
    private final int rank;

    InferredType(String cName, int rank) {
        this.cName = cName;
        this.rank = rank;
    }

    /** Returns the C spelling of this type, or null for UNKNOWN. */
    public String getCName() {
        return cName;
    }

    /** Returns true iff arithmetic is defined on this type. */
    public boolean isNumeric() {
        return rank >= 0;
    }

    /** Returns the wider of A and B, both of which must be numeric. */
    public static InferredType wider(InferredType a, InferredType b) {
        if (!a.isNumeric() || !b.isNumeric()) {
            throw new IllegalArgumentException(
                String.format("no common numeric type for %s and %s", a, b));
        }
        return a.rank >= b.rank ? a : b;
    }

    /** Returns the declaration prefix for a variable of this type, e.g.
     *  "int " or "const char *". */
    public String declarator() {
        return cName.endsWith("*") ? cName : cName + " ";
    }

    /** Returns the name used in messages, e.g. "Integer". */
    public String displayName() {
        switch (this) {
        case BOOLEAN:
            return "Boolean";
        case INTEGER:
            return "Integer";
        case FLOATING_POINT:
            return "FloatingPoint";
        case TEXT:
            return "Text";
        default:
            return "Unknown";
        }
    }
}
