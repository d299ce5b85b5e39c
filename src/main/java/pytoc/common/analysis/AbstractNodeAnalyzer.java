package pytoc.common.analysis;

import pytoc.common.astnodes.*;

/**
 * An empty implementation of the {@link NodeAnalyzer} that routes every
 * AST node type to {@link #defaultAction(Node)}, which returns the
 * default value.
 *
 * T is the type of analysis result.
 */
public class AbstractNodeAnalyzer<T> implements NodeAnalyzer<T> {
    @Override
    public T analyze(AssignStmt node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(AugAssignStmt node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(BinaryExpr node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(BooleanLiteral node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(CallExpr node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(ExprStmt node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(FloatLiteral node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(ForStmt node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(FuncDef node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(Identifier node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(IfExpr node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(IfStmt node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(IntegerLiteral node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(ListExpr node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(NoneLiteral node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(Program node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(ReturnStmt node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(StringLiteral node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(UnaryExpr node) {
        return defaultAction(node);
    }

    @Override
    public T analyze(WhileStmt node) {
        return defaultAction(node);
    }

    @Override
    public void setDefault(T value) {
        defaultValue = value;
    }

    /** The result for NODE when its analyze overload is not overridden.
     *  Subclasses that must reject unknown node kinds override this. */
    protected T defaultAction(Node node) {
        return defaultValue;
    }

    private T defaultValue = null;

}
