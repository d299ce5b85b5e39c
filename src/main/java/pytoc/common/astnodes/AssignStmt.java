package pytoc.common.astnodes;

import java.util.List;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Single and multiple assignments. */
public class AssignStmt extends Stmt {
    /** List of left-hand sides. */
    public final List<Expr> targets;
    /** Right-hand-side value to be assigned. */
    public final Expr value;

    /** AST for TARGETS[0] = TARGETS[1] = ... = VALUE. */
    @JsonCreator
    public AssignStmt(List<Expr> targets, Expr value) {
        this.targets = targets;
        this.value = value;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
