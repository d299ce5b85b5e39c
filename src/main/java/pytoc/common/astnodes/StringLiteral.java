package pytoc.common.astnodes;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** String constants. */
public final class StringLiteral extends Literal {

    /** Contents of the literal, not including quotation marks and with
     *  escapes already decoded. */
    public final String value;

    /** The AST for a string literal containing VALUE. */
    @JsonCreator
    public StringLiteral(String value) {
        this.value = value;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
