package pytoc.common.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Accumulates the lines of C code produced for one program body, together
 * with the headers that code needs.
 *
 * Lines are only ever appended.  The indentation of each line is the
 * current block depth, which changes only through {@link #openBlock},
 * {@link #continueBlock} and {@link #closeBlock}, so braces and
 * indentation always agree.
 */
public class CBackend {

    /** Emitted lines, already indented. */
    protected final List<String> lines = new ArrayList<>();

    /** Headers the emitted code refers to, e.g. "stdio.h". */
    protected final Set<String> headers = new TreeSet<>();

    /** Text inserted once per level of nesting. */
    protected final String indentUnit;

    /** Depth of the block currently being emitted. */
    protected int depth;

    /** The depth at which emission started and must end. */
    private final int baseDepth;

    /**
     * Creates a backend whose lines start at depth BASEDEPTH and are
     * indented by INDENTUNIT per level.
     *
     * @param indentUnit the indentation for one level
     * @param baseDepth the depth of top-level lines
     */
    public CBackend(String indentUnit, int baseDepth) {
        if (baseDepth < 0) {
            throw new IllegalArgumentException("negative depth: " + baseDepth);
        }
        this.indentUnit = indentUnit;
        this.depth = baseDepth;
        this.baseDepth = baseDepth;
    }

    /**
     * Emits a line of text at the current depth.
     *
     * @param text the line, without indentation or newline
     */
    public void emitLine(String text) {
        lines.add(indentUnit.repeat(depth) + text);
    }

    /**
     * Emits a simple statement, terminated with a semicolon.
     *
     * @param statement the statement text without the semicolon
     */
    public void emitStatement(String statement) {
        emitLine(statement + ";");
    }

    /**
     * Emits HEADER followed by an opening brace and enters the block.
     *
     * @param header e.g. "if (x)" or "for (int i = 0; i < n; i++)"
     */
    public void openBlock(String header) {
        emitLine(header + " {");
        depth += 1;
    }

    /**
     * Closes the current block and opens the next branch of the same
     * statement on the same line, e.g. "} else {".
     *
     * @param header the branch header, e.g. "else" or "else if (x)"
     */
    public void continueBlock(String header) {
        leaveBlock();
        emitLine("} " + header + " {");
        depth += 1;
    }

    /** Emits the closing brace of the current block. */
    public void closeBlock() {
        leaveBlock();
        emitLine("}");
    }

    private void leaveBlock() {
        if (depth <= baseDepth) {
            throw new IllegalStateException("no open block to close");
        }
        depth -= 1;
    }

    /** Returns the current depth. */
    public int getDepth() {
        return depth;
    }

    /**
     * Records that the emitted code uses a declaration from HEADER.
     *
     * @param header a standard header name such as "stdio.h"
     */
    public void require(String header) {
        headers.add(header);
    }

    /** Returns the required headers in sorted order. */
    public Set<String> getHeaders() {
        return Collections.unmodifiableSet(headers);
    }

    /**
     * Returns the lines emitted so far.
     *
     * @throws IllegalStateException if a block is still open
     */
    public List<String> getLines() {
        if (depth != baseDepth) {
            throw new IllegalStateException(
                String.format("%d block(s) left open", depth - baseDepth));
        }
        return Collections.unmodifiableList(lines);
    }

    /**
     * Returns VALUE as a C string literal, quotes included.
     *
     * Backslashes, double quotes and the usual control characters are
     * escaped; any other character below 0x20 becomes an octal escape.
     * Question marks are escaped so that no trigraph can form.
     *
     * @param value the characters of the string
     * @return the literal text
     */
    public static String quote(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2);
        out.append('"');
        for (int i = 0; i < value.length(); i += 1) {
            char c = value.charAt(i);
            switch (c) {
            case '\\': out.append("\\\\"); break;
            case '"': out.append("\\\""); break;
            case '\n': out.append("\\n"); break;
            case '\r': out.append("\\r"); break;
            case '\t': out.append("\\t"); break;
            case '?': out.append("\\?"); break;
            default:
                if (c < 0x20 || c == 0x7f) {
                    out.append(String.format("\\%03o", (int) c));
                } else {
                    out.append(c);
                }
            }
        }
        out.append('"');
        return out.toString();
    }
}
