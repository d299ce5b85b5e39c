package pytoc.translate;

import java.util.ArrayList;
import java.util.List;

import pytoc.common.analysis.AbstractNodeAnalyzer;
import pytoc.common.analysis.types.InferredType;
import pytoc.common.astnodes.AssignStmt;
import pytoc.common.astnodes.AugAssignStmt;
import pytoc.common.astnodes.CallExpr;
import pytoc.common.astnodes.Expr;
import pytoc.common.astnodes.ExprStmt;
import pytoc.common.astnodes.ForStmt;
import pytoc.common.astnodes.Identifier;
import pytoc.common.astnodes.IfStmt;
import pytoc.common.astnodes.IntegerLiteral;
import pytoc.common.astnodes.Node;
import pytoc.common.astnodes.Program;
import pytoc.common.astnodes.Stmt;
import pytoc.common.astnodes.UnaryExpr;
import pytoc.common.astnodes.WhileStmt;
import pytoc.common.codegen.CBackend;

import static pytoc.common.analysis.types.InferredType.BOOLEAN;
import static pytoc.common.analysis.types.InferredType.INTEGER;
import static pytoc.translate.ErrorKind.UNRESOLVED_TYPE;
import static pytoc.translate.ErrorKind.UNSUPPORTED_ITERABLE;
import static pytoc.translate.ErrorKind.UNSUPPORTED_STATEMENT;

/**
 * Emits the C statements for a list of Python statements, in one pass
 * and in source order.
 *
 * A variable is declared where it is first assigned, in the scope of the
 * block containing that assignment; later assignments reuse the
 * declaration.  Every if, else, for and while body is emitted as a
 * braced block with a scope of its own.
 */
public class StatementTranslator extends AbstractNodeAnalyzer<Void> {

    protected final Environment environment;
    protected final TypeInferrer types;
    protected final ExpressionTranslator expressions;
    protected final CBackend backend;

    public StatementTranslator(Environment environment, TypeInferrer types,
                               ExpressionTranslator expressions,
                               CBackend backend) {
        this.environment = environment;
        this.types = types;
        this.expressions = expressions;
        this.backend = backend;
    }

    /** Emits STATEMENTS in order in the current block. */
    public void translate(List<Stmt> statements) {
        for (Stmt stmt : statements) {
            stmt.dispatch(this);
        }
    }

    @Override
    public Void analyze(Program node) {
        translate(node.statements);
        return null;
    }

    @Override
    public Void analyze(AssignStmt node) {
        types.inferAssignment(node);
        String value = expressions.translate(node.value);
        String first = null;
        for (Expr target : node.targets) {
            String name = ((Identifier) target).name;
            emitAssignment(target, name, first == null ? value : first);
            if (first == null) {
                first = name;
            }
        }
        return null;
    }

    @Override
    public Void analyze(AugAssignStmt node) {
        SymbolEntry entry = types.inferAugmentedAssignment(node);
        backend.emitStatement(String.format("%s %s= %s", entry.getName(),
                                            node.operator,
                                            expressions.translate(node.value)));
        return null;
    }

    @Override
    public Void analyze(IfStmt node) {
        backend.openBlock("if " + condition(node.condition));
        translateBlock(node.thenBody);
        List<Stmt> elseBody = node.elseBody;
        while (elseBody.size() == 1 && elseBody.get(0) instanceof IfStmt) {
            IfStmt elif = (IfStmt) elseBody.get(0);
            backend.continueBlock("else if " + condition(elif.condition));
            translateBlock(elif.thenBody);
            elseBody = elif.elseBody;
        }
        if (!elseBody.isEmpty()) {
            backend.continueBlock("else");
            translateBlock(elseBody);
        }
        backend.closeBlock();
        return null;
    }

    @Override
    public Void analyze(WhileStmt node) {
        backend.openBlock("while " + condition(node.condition));
        translateBlock(node.body);
        backend.closeBlock();
        return null;
    }

    /**
     * Translates a loop over range(stop), range(start, stop) or
     * range(start, stop, step) into a counting loop.  A constant step
     * decides the direction of the test; otherwise it is tested at run
     * time, as range does.  Bounds that are not integer constants are
     * evaluated once, into variables declared beside the counter.
     */
    @Override
    public Void analyze(ForStmt node) {
        List<Expr> args = rangeArguments(node);
        String counter = node.identifier.name;
        List<String> init = new ArrayList<>();
        init.add(String.format("%s = %s", counter,
                               args.size() == 1 ? "0"
                                                : expressions.translate(args.get(0))));
        String stop = evaluateOnce(counter, "stop",
                                   args.get(args.size() == 1 ? 0 : 1), init);
        Expr stepExpr = args.size() == 3 ? args.get(2) : null;
        Integer step = stepExpr == null ? Integer.valueOf(1)
                                        : constantValue(stepExpr);

        String test;
        String update;
        if (step == null) {
            String stepText = evaluateOnce(counter, "step", stepExpr, init);
            test = String.format("(%s > 0 ? %s < %s : %s > %s)", stepText,
                                 counter, stop, counter, stop);
            update = String.format("%s += %s", counter, stepText);
        } else if (step == 0) {
            throw new TranslationError(UNSUPPORTED_ITERABLE, stepExpr,
                                       "range() step must not be zero");
        } else if (step > 0) {
            test = String.format("%s < %s", counter, stop);
            update = step == 1 ? counter + "++"
                               : String.format("%s += %d", counter, step);
        } else {
            test = String.format("%s > %s", counter, stop);
            long decrement = -(long) step.intValue();
            update = step == -1 ? counter + "--"
                                : String.format("%s -= %d", counter, decrement);
        }

        environment.enterScope();
        types.declareLoopVariable(node.identifier);
        environment.markDeclared(counter);
        backend.openBlock(String.format("for (%s%s; %s; %s)",
                                        INTEGER.declarator(),
                                        String.join(", ", init), test, update));
        translate(node.body);
        backend.closeBlock();
        environment.exitScope();
        return null;
    }

    @Override
    public Void analyze(ExprStmt node) {
        if (!(node.expr instanceof CallExpr)) {
            throw new TranslationError(UNSUPPORTED_STATEMENT, node,
                                       "%s has no effect as a statement",
                                       node.expr.getKind());
        }
        backend.emitStatement(
            expressions.translateCallStatement((CallExpr) node.expr));
        return null;
    }

    /** Function definitions, returns and anything else without a rule. */
    @Override
    protected Void defaultAction(Node node) {
        throw new TranslationError(UNSUPPORTED_STATEMENT, node,
                                   "%s cannot be translated", node.getKind());
    }

    /** Emits BODY as the contents of the block just opened, in a new
     *  scope. */
    protected void translateBlock(List<Stmt> body) {
        environment.enterScope();
        translate(body);
        environment.exitScope();
    }

    /** Emits NAME = VALUE, declaring NAME if this is the first assignment
     *  in its scope. */
    protected void emitAssignment(Node target, String name, String value) {
        SymbolEntry entry = environment.lookup(name);
        if (entry.isDeclared()) {
            backend.emitStatement(String.format("%s = %s", name, value));
            return;
        }
        InferredType type = entry.getType();
        if (type == null || type == InferredType.UNKNOWN) {
            throw new TranslationError(UNRESOLVED_TYPE, target,
                                       "no type was inferred for '%s'", name);
        }
        if (type == BOOLEAN) {
            backend.require(ExpressionTranslator.STDBOOL);
        }
        backend.emitStatement(String.format("%s%s = %s", type.declarator(),
                                            name, value));
        environment.markDeclared(name);
    }

    /** Returns the parenthesized C text of the condition EXPR. */
    protected String condition(Expr expr) {
        types.inferCondition(expr);
        String text = expressions.translate(expr);
        return isParenthesized(text) ? text : "(" + text + ")";
    }

    /**
     * Returns the C text standing for the range bound EXPR of the loop
     * over COUNTER.  An integer constant stands for itself; any other
     * bound is stored in a fresh variable named after COUNTER and ROLE,
     * whose declarator is added to INIT.
     */
    private String evaluateOnce(String counter, String role, Expr expr,
                                List<String> init) {
        String text = expressions.translate(expr);
        if (constantValue(expr) != null) {
            return text;
        }
        String base = counter + "_" + role;
        String name = base;
        for (int suffix = 1; environment.lookup(name) != null; suffix += 1) {
            name = base + suffix;
        }
        init.add(String.format("%s = %s", name, text));
        return name;
    }

    /** Returns the arguments of the range call iterated by NODE. */
    private List<Expr> rangeArguments(ForStmt node) {
        Expr iterable = node.iterable;
        if (!(iterable instanceof CallExpr)
            || !(((CallExpr) iterable).function instanceof Identifier)
            || Builtin.lookup(((Identifier) ((CallExpr) iterable).function).name)
               != Builtin.RANGE) {
            throw new TranslationError(UNSUPPORTED_ITERABLE, iterable,
                                       "only range(...) can be iterated, not %s",
                                       iterable.getKind());
        }
        List<Expr> args = ((CallExpr) iterable).args;
        if (args.isEmpty() || args.size() > 3) {
            throw new TranslationError(UNSUPPORTED_ITERABLE, iterable,
                                       "range() takes 1 to 3 arguments, got %d",
                                       args.size());
        }
        for (Expr arg : args) {
            InferredType type = types.infer(arg);
            if (type != INTEGER && type != BOOLEAN) {
                throw new TranslationError(UNSUPPORTED_ITERABLE, arg,
                                           "range() argument is %s, not Integer",
                                           type.displayName());
            }
        }
        return args;
    }

    /** Returns the value of EXPR if it is an integer constant such as 2
     *  or -2, else null. */
    private static Integer constantValue(Expr expr) {
        if (expr instanceof IntegerLiteral) {
            return ((IntegerLiteral) expr).value;
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            Integer operand = constantValue(unary.operand);
            if (operand != null && unary.operator.equals("-")) {
                return -operand;
            } else if (operand != null && unary.operator.equals("+")) {
                return operand;
            }
        }
        return null;
    }

    /** Returns true iff TEXT is wrapped, as a whole, in one pair of
     *  parentheses.  Parentheses inside string literals do not count. */
    static boolean isParenthesized(String text) {
        if (!text.startsWith("(") || !text.endsWith(")")) {
            return false;
        }
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < text.length(); i += 1) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i += 1;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '(') {
                depth += 1;
            } else if (c == ')') {
                depth -= 1;
                if (depth == 0 && i < text.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }
}
