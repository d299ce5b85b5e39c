package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** <operand> <operator> <operand>.  Arithmetic, comparisons and the
 *  boolean operators "and" and "or" all use this node. */
public class BinaryExpr extends Expr {

    /** Left operand. */
    public final Expr left;
    /** Operator name, as written in Python ("+", "<=", "and", ...). */
    public final String operator;
    /** Right operand. */
    public final Expr right;

    /** An AST for expressions of the form LEFTEXPR OP RIGHTEXPR. */
    @JsonCreator
    public BinaryExpr(Expr left, String operator, Expr right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
