package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Numerals written with a fractional part or an exponent. */
public final class FloatLiteral extends Literal {

    /** Value denoted. */
    public final double value;

    /** The AST for the literal VALUE. */
    @JsonCreator
    public FloatLiteral(double value) {
        this.value = value;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
