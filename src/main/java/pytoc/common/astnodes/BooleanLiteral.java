package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Literals True or False. */
public final class BooleanLiteral extends Literal {

    /** True iff I represent True. */
    public final boolean value;

    /** The AST for the literal VALUE (True or False). */
    @JsonCreator
    public BooleanLiteral(boolean value) {
        this.value = value;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
