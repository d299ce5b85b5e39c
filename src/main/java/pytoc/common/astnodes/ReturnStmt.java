package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Return from function. */
public class ReturnStmt extends Stmt {

    /** Returned value, or null for a bare return. */
    public final Expr value;

    /** The AST for
     *     return VALUE
     */
    @JsonCreator
    public ReturnStmt(Expr value) {
        this.value = value;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
