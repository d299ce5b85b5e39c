package pytoc.translate;

import java.util.HashMap;
import java.util.Map;

/**
 * The Python functions the translator recognizes, each mapped to a fixed
 * C construct.  Calls to any other name are rejected.
 */
public enum Builtin {

    /** print(...): printf with one conversion per argument. */
    PRINT("print", "stdio.h", false),
    /** range(...): only as the iterable of a for loop. */
    RANGE("range", null, false),
    /** len(text): strlen. */
    LEN("len", "string.h", true),
    /** abs(number): abs or fabs. */
    ABS("abs", "stdlib.h", true),
    /** int(number): a cast to int. */
    INT("int", null, true),
    /** float(number): a cast to double. */
    FLOAT("float", null, true);

    private static final Map<String, Builtin> BY_NAME = new HashMap<>();

    static {
        for (Builtin builtin : values()) {
            BY_NAME.put(builtin.pythonName, builtin);
        }
    }

    /** Name of the function in Python. */
    private final String pythonName;
    /** Header declaring the C function used, or null if none. */
    private final String header;
    /** True iff a call can appear where a value is needed. */
    private final boolean hasValue;

    Builtin(String pythonName, String header, boolean hasValue) {
        this.pythonName = pythonName;
        this.header = header;
        this.hasValue = hasValue;
    }

    /** Returns the built-in called NAME in Python, or null. */
    public static Builtin lookup(String name) {
        return BY_NAME.get(name);
    }

    public String getPythonName() {
        return pythonName;
    }

    public String getHeader() {
        return header;
    }

    public boolean hasValue() {
        return hasValue;
    }
}
