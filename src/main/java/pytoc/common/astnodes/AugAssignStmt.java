package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Augmented assignment, such as x += 1. */
public class AugAssignStmt extends Stmt {
    /** Variable updated in place. */
    public final Expr target;
    /** Arithmetic operator, without the trailing '='. */
    public final String operator;
    /** Right operand. */
    public final Expr value;

    /** AST for TARGET OPERATOR= VALUE. */
    @JsonCreator
    public AugAssignStmt(Expr target, String operator, Expr value) {
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
