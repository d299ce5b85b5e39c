package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** An expression applying a unary operator ("-" or "not"). */
public class UnaryExpr extends Expr {

    /** The text representation of the operator. */
    public final String operator;
    /** The operand to which it is applied. */
    public final Expr operand;

    /** The AST for OPERATOR OPERAND. */
    @JsonCreator
    public UnaryExpr(String operator, Expr operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
