package pytoc.translate;

import pytoc.common.analysis.SymbolTable;
import pytoc.common.analysis.types.InferredType;

/**
 * The scopes of one translation run.  A scope is entered for each block
 * body (if and else branches, loops) and discarded when the block ends,
 * taking the variables first assigned in it along.
 */
public class Environment {

    /** The innermost scope. */
    private SymbolTable<SymbolEntry> scope = new SymbolTable<>();

    /** Pushes a new, empty scope. */
    public void enterScope() {
        scope = new SymbolTable<>(scope);
    }

    /** Pops the innermost scope.  The top-level scope cannot be popped. */
    public void exitScope() {
        if (scope.getParent() == null) {
            throw new IllegalStateException("cannot exit the top-level scope");
        }
        scope = scope.getParent();
    }

    /**
     * Returns the entry for NAME in the innermost scope, creating it with
     * TYPE if absent.  A fresh entry is not yet declared.
     */
    public SymbolEntry declare(String name, InferredType type) {
        if (scope.declares(name)) {
            SymbolEntry existing = scope.get(name);
            if (existing.getType() != type) {
                throw new IllegalStateException(
                    String.format("%s redeclared as %s", existing, type));
            }
            return existing;
        }
        SymbolEntry entry = new SymbolEntry(name, type, scope.getDepth());
        scope.put(name, entry);
        return entry;
    }

    /** Returns the innermost entry for NAME, or null if none is visible. */
    public SymbolEntry lookup(String name) {
        return scope.get(name);
    }

    /** Records that the declaration of the visible variable NAME has been
     *  emitted. */
    public void markDeclared(String name) {
        SymbolEntry entry = lookup(name);
        if (entry == null) {
            throw new IllegalStateException("no variable " + name + " in scope");
        }
        entry.markDeclared();
    }

    /** Returns the depth of the innermost scope; the top level is 0. */
    public int getDepth() {
        return scope.getDepth();
    }
}
