package pytoc.common.astnodes;

import java.util.List;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** An entire module: its top-level statements in source order. */
public class Program extends Node {

    /** Top-level statements. */
    public final List<Stmt> statements;

    /** A program consisting of STATEMENTS. */
    @JsonCreator
    public Program(List<Stmt> statements) {
        this.statements = statements;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
