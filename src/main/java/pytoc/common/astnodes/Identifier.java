package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** A simple identifier. */
public class Identifier extends Expr {

    /** Text of the identifier. */
    public final String name;

    /** An AST for the variable, method, or parameter named NAME. */
    @JsonCreator
    public Identifier(String name) {
        this.name = name;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
