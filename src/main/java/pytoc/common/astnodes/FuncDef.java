package pytoc.common.astnodes;

import java.util.List;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonCreator;

/** Def statements.  Parsed but never translated. */
public class FuncDef extends Stmt {

    /** Defined name. */
    public final Identifier name;
    /** Formal parameters. */
    public final List<Identifier> params;
    /** Body of function. */
    public final List<Stmt> body;

    /** The AST for
     *     def NAME(PARAMS):
     *         BODY
     */
    @JsonCreator
    public FuncDef(Identifier name, List<Identifier> params, List<Stmt> body) {
        this.name = name;
        this.params = params;
        this.body = body;
    }

    public <T> T dispatch(NodeAnalyzer<T> analyzer) {
        return analyzer.analyze(this);
    }
}
