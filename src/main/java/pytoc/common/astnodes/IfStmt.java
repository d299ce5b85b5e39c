package pytoc.common.astnodes;

import java.util.List;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Conditional statement.  An elif arrives as a lone IfStmt in the
 *  else body. */
public class IfStmt extends Stmt {
    /** Test condition. */
    public final Expr condition;
    /** "True" branch. */
    public final List<Stmt> thenBody;
    /** "False" branch, empty when there is no else. */
    public final List<Stmt> elseBody;

    /** The AST for
     *      if CONDITION:
     *          THENBODY
     *      else:
     *          ELSEBODY
     */
    @JsonCreator
    public IfStmt(Expr condition, List<Stmt> thenBody, List<Stmt> elseBody) {
        this.condition = condition;
        this.thenBody = thenBody;
        this.elseBody = elseBody == null ? List.of() : elseBody;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
