package pytoc.common.astnodes;

import java.util.List;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** For statement. */
public class ForStmt extends Stmt {
    /** Control variable. */
    public final Identifier identifier;
    /** Source of values of control statement. */
    public final Expr iterable;
    /** Repeated statements. */
    public final List<Stmt> body;

    /** The AST for
     *      for IDENTIFIER in ITERABLE:
     *          BODY
     */
    @JsonCreator
    public ForStmt(Identifier identifier, Expr iterable, List<Stmt> body) {
        this.identifier = identifier;
        this.iterable = iterable;
        this.body = body;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
