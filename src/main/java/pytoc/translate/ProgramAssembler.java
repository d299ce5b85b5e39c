package pytoc.translate;

import java.util.List;

import pytoc.common.codegen.CBackend;

/**
 * Produces the final C text: the includes the body needs, then the body
 * wrapped in the entry-point function.
 *
 * The assembler owns the backend the translators emit into, and the
 * backend's contents are consumed exactly once.
 */
public class ProgramAssembler {

    /** Body lines sit one level inside the entry point. */
    private static final int BODY_DEPTH = 1;

    protected final TranslatorOptions options;
    protected final CBackend backend;
    private boolean assembled;

    public ProgramAssembler(TranslatorOptions options) {
        this.options = options;
        this.backend = new CBackend(options.getIndent(), BODY_DEPTH);
    }

    /** Returns the backend statements are emitted into. */
    public CBackend getBackend() {
        return backend;
    }

    /**
     * Returns the complete program.  Only headers recorded in the backend
     * are included.
     *
     * @throws IllegalStateException if called twice, or if a block is
     *         still open
     */
    public String assemble() {
        if (assembled) {
            throw new IllegalStateException("program already assembled");
        }
        assembled = true;
        List<String> body = backend.getLines();

        StringBuilder out = new StringBuilder();
        for (String header : backend.getHeaders()) {
            out.append("#include <").append(header).append(">\n");
        }
        if (!backend.getHeaders().isEmpty()) {
            out.append('\n');
        }
        out.append("int ").append(options.getEntryPoint()).append("(void) {\n");
        for (String line : body) {
            out.append(line).append('\n');
        }
        out.append(options.getIndent().repeat(BODY_DEPTH)).append("return 0;\n");
        out.append("}\n");
        return out.toString();
    }
}
