package pytoc.translate;

/**
 * Settings that shape the generated C text without changing its meaning.
 * Instances are immutable; the with* methods return modified copies.
 */
public final class TranslatorOptions {

    /** Four spaces per level, entry point main, %g for doubles. */
    private static final TranslatorOptions DEFAULTS =
        new TranslatorOptions("    ", "main", "%g");

    private final String indent;
    private final String entryPoint;
    private final String floatFormat;

    private TranslatorOptions(String indent, String entryPoint,
                              String floatFormat) {
        this.indent = indent;
        this.entryPoint = entryPoint;
        this.floatFormat = floatFormat;
    }

    public static TranslatorOptions defaults() {
        return DEFAULTS;
    }

    /** Returns options indenting each level with INDENT, which must
     *  consist of blanks or tabs only. */
    public TranslatorOptions withIndent(String indent) {
        if (!indent.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new IllegalArgumentException(
                "indent must be blanks or tabs: '" + indent + "'");
        }
        return new TranslatorOptions(indent, entryPoint, floatFormat);
    }

    /** Returns options naming the wrapper function ENTRYPOINT. */
    public TranslatorOptions withEntryPoint(String entryPoint) {
        if (!entryPoint.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException(
                "not a C identifier: '" + entryPoint + "'");
        }
        return new TranslatorOptions(indent, entryPoint, floatFormat);
    }

    /** Returns options printing doubles with the printf conversion
     *  FLOATFORMAT, e.g. "%f" or "%.3f". */
    public TranslatorOptions withFloatFormat(String floatFormat) {
        if (!floatFormat.matches("%[0-9]*(\\.[0-9]+)?[fFeEgGaA]")) {
            throw new IllegalArgumentException(
                "not a floating-point conversion: '" + floatFormat + "'");
        }
        return new TranslatorOptions(indent, entryPoint, floatFormat);
    }

    public String getIndent() {
        return indent;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public String getFloatFormat() {
        return floatFormat;
    }
}
