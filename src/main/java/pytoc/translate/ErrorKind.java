package pytoc.translate;

/** The reasons a translation can fail. */
public enum ErrorKind {

    /** Re-assignment with a different type, or operands of incompatible
     *  types. */
    TYPE_CONFLICT("TypeConflict"),
    /** Reference to a name that has not been assigned in scope. */
    UNKNOWN_IDENTIFIER("UnknownIdentifier"),
    UNSUPPORTED_STATEMENT("UnsupportedStatement"),
    UNSUPPORTED_EXPRESSION("UnsupportedExpression"),
    /** Call to a function that is not a recognized built-in, or to a
     *  built-in where it has no translation. */
    UNSUPPORTED_CALL("UnsupportedCall"),
    /** A for loop over anything but range(...) with integer bounds. */
    UNSUPPORTED_ITERABLE("UnsupportedIterable"),
    /** A declaration was about to be emitted for a variable whose type
     *  was never resolved. */
    UNRESOLVED_TYPE("UnresolvedType");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
