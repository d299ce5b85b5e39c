package pytoc.common.astnodes;

import java.util.List;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Indefinite repetition construct. */
public class WhileStmt extends Stmt {
    /** Test for whether to continue. */
    public final Expr condition;
    /** Loop body. */
    public final List<Stmt> body;

    /** The AST for
     *      while CONDITION:
     *          BODY
     */
    @JsonCreator
    public WhileStmt(Expr condition, List<Stmt> body) {
        this.condition = condition;
        this.body = body;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
