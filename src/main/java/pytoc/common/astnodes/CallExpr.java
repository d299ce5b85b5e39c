package pytoc.common.astnodes;

import java.util.List;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** A function call. */
public class CallExpr extends Expr {

    /** The called function.  Only a plain Identifier can name a
     *  translatable built-in. */
    public final Expr function;
    /** The actual parameter expressions. */
    public final List<Expr> args;

    /** AST for FUNCTION(ARGS). */
    @JsonCreator
    public CallExpr(Expr function, List<Expr> args) {
        this.function = function;
        this.args = args;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
