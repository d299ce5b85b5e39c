package pytoc.common.analysis;

import pytoc.common.astnodes.*;

/**
 * This interface can be used to separate logic for various concrete
 * classes in the AST class hierarchy.
 * <p>
 * The idea is that a phase of the analysis is encapsulated in a class
 * that implements this interface, and contains an overriding of the
 * analyze method for each concrete Node class that needs something
 * other than default processing.  Each concrete node class, C, implements
 * a generic dispatch method that takes a NodeAnalyzer&lt;T&gt; argument and
 * calls the overloading of analyze that takes an argument of type C.
 * The effect is that anode.dispatch(anAnalyzer) executes the method
 * anAnalyzer.analyze that is appropriate to aNode's dynamic type.
 * <p>
 * T is the type of value produced by the analysis: C text for the
 * translators, an inferred type for type inference, Void for passes
 * run only for their effect.
 */
public interface NodeAnalyzer<T> {

    T analyze(AssignStmt node);

    T analyze(AugAssignStmt node);

    T analyze(BinaryExpr node);

    T analyze(BooleanLiteral node);

    T analyze(CallExpr node);

    T analyze(ExprStmt node);

    T analyze(FloatLiteral node);

    T analyze(ForStmt node);

    T analyze(FuncDef node);

    T analyze(Identifier node);

    T analyze(IfExpr node);

    T analyze(IfStmt node);

    T analyze(IntegerLiteral node);

    T analyze(ListExpr node);

    T analyze(NoneLiteral node);

    T analyze(Program node);

    T analyze(ReturnStmt node);

    T analyze(StringLiteral node);

    T analyze(UnaryExpr node);

    T analyze(WhileStmt node);

    /** Set the default value returned by calls to analyze that are not
     *  overridden to VALUE. By default, this is null. */
    void setDefault(T value);
}
