package pytoc.translate;

import pytoc.common.astnodes.Node;
import java_cup.runtime.ComplexSymbolFactory.Location;

/**
 * Raised on the first construct that cannot be translated.  Translation
 * stops there and produces no text.
 */
public class TranslationError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Why translation failed. */
    private final ErrorKind kind;
    /** Kind of the offending node, e.g. "CallExpr". */
    private final String nodeKind;
    /** Start of the offending node, or null if unknown. */
    private final transient Location location;
    /** The message without kind and location. */
    private final String detail;

    /** An error of KIND attributed to NODE, with detail
     *  String.format(MESSAGEFORM, ARGS). */
    public TranslationError(ErrorKind kind, Node node,
                            String messageForm, Object... args) {
        this(kind, node.getKind(), node.getLeft(),
             String.format(messageForm, args));
    }

    private TranslationError(ErrorKind kind, String nodeKind,
                             Location location, String detail) {
        super(format(kind, location, detail));
        this.kind = kind;
        this.nodeKind = nodeKind;
        this.location = location;
        this.detail = detail;
    }

    private static String format(ErrorKind kind, Location location,
                                 String detail) {
        if (location == null) {
            return String.format("%s: %s", kind, detail);
        }
        return String.format("%d:%d: %s: %s", location.getLine(),
                             location.getColumn(), kind, detail);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    /** Returns the source position of the offending node, or null. */
    public Location getLocation() {
        return location;
    }

    public String getDetail() {
        return detail;
    }
}
