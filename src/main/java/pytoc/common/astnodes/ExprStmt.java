package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Statement consisting of an expression. */
public final class ExprStmt extends Stmt {

    /** The expression I evaluate. */
    public final Expr expr;

    /** The AST for EXPR as a statement. */
    @JsonCreator
    public ExprStmt(Expr expr) {
        this.expr = expr;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
