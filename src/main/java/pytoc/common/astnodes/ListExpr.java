package pytoc.common.astnodes;

import java.util.List;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** List displays. */
public final class ListExpr extends Expr {

    /** List of element expressions. */
    public final List<Expr> elements;

    /** The AST for
     *      [ ELEMENTS ].
     */
    @JsonCreator
    public ListExpr(List<Expr> elements) {
        this.elements = elements;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
