package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** The expression None.  No C value corresponds to it. */
public final class NoneLiteral extends Literal {

    /** The AST for None. */
    @JsonCreator
    public NoneLiteral() {
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
