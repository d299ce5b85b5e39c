package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Integer numerals: no fractional part and no exponent. */
public final class IntegerLiteral extends Literal {

    /** Value denoted. */
    public final int value;

    /** The AST for the literal VALUE. */
    @JsonCreator
    public IntegerLiteral(int value) {
        this.value = value;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
