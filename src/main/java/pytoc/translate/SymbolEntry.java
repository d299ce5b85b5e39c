package pytoc.translate;

import pytoc.common.analysis.types.InferredType;

/** Information about a variable assigned in the translated program. */
public class SymbolEntry {

    /** Name of the variable, used unchanged in C. */
    protected final String name;
    /** Static type fixed by the variable's first assignment. */
    protected final InferredType type;
    /** Depth of the scope that owns the variable; 0 is the top level. */
    protected final int scopeDepth;
    /** True once a C declaration has been emitted for the variable. */
    protected boolean declared;
    /** True for the counter of a for loop, which cannot be assigned. */
    protected boolean loopCounter;

    /**
     * A variable NAME of TYPE owned by the scope at SCOPEDEPTH, not yet
     * declared in the output.
     */
    public SymbolEntry(String name, InferredType type, int scopeDepth) {
        this.name = name;
        this.type = type;
        this.scopeDepth = scopeDepth;
    }

    public String getName() {
        return name;
    }

    public InferredType getType() {
        return type;
    }

    public int getScopeDepth() {
        return scopeDepth;
    }

    public boolean isDeclared() {
        return declared;
    }

    /** Records that the declaration of this variable has been emitted. */
    public void markDeclared() {
        declared = true;
    }

    public boolean isLoopCounter() {
        return loopCounter;
    }

    /** Records that this variable is the counter of a for loop. */
    public void markLoopCounter() {
        loopCounter = true;
    }

    @Override
    public String toString() {
        return String.format("%s: %s@%d%s", name, type.displayName(),
                             scopeDepth, declared ? "" : " (undeclared)");
    }
}
