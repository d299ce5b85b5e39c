package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Conditional expressions. */
public class IfExpr extends Expr {
    /** Boolean condition. */
    public final Expr condition;
    /** True branch. */
    public final Expr thenExpr;
    /** False branch. */
    public final Expr elseExpr;

    /** The AST for
     *     THENEXPR if CONDITION else ELSEEXPR
     */
    @JsonCreator
    public IfExpr(Expr condition, Expr thenExpr, Expr elseExpr) {
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
