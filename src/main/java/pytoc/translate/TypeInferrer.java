package pytoc.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import pytoc.common.analysis.AbstractNodeAnalyzer;
import pytoc.common.analysis.types.InferredType;
import pytoc.common.astnodes.AssignStmt;
import pytoc.common.astnodes.AugAssignStmt;
import pytoc.common.astnodes.BinaryExpr;
import pytoc.common.astnodes.BooleanLiteral;
import pytoc.common.astnodes.CallExpr;
import pytoc.common.astnodes.Expr;
import pytoc.common.astnodes.FloatLiteral;
import pytoc.common.astnodes.Identifier;
import pytoc.common.astnodes.IfExpr;
import pytoc.common.astnodes.IntegerLiteral;
import pytoc.common.astnodes.Node;
import pytoc.common.astnodes.StringLiteral;
import pytoc.common.astnodes.UnaryExpr;

import static pytoc.common.analysis.types.InferredType.BOOLEAN;
import static pytoc.common.analysis.types.InferredType.FLOATING_POINT;
import static pytoc.common.analysis.types.InferredType.INTEGER;
import static pytoc.common.analysis.types.InferredType.TEXT;
import static pytoc.translate.ErrorKind.TYPE_CONFLICT;
import static pytoc.translate.ErrorKind.UNKNOWN_IDENTIFIER;
import static pytoc.translate.ErrorKind.UNSUPPORTED_CALL;
import static pytoc.translate.ErrorKind.UNSUPPORTED_EXPRESSION;
import static pytoc.translate.ErrorKind.UNSUPPORTED_STATEMENT;

/**
 * Assigns a static type to expressions and to the variables they are
 * assigned to.
 *
 * A variable's type is fixed by its first assignment; every later
 * assignment must produce the same type.  Inferring an expression has no
 * effect on the environment, only assignments do.
 */
public class TypeInferrer extends AbstractNodeAnalyzer<InferredType> {

    /** Operators whose result is the wider of their operand types, and
     *  at least INTEGER. */
    static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%");
    /** Operators yielding BOOLEAN from two comparable operands. */
    static final Set<String> COMPARISON =
        Set.of("==", "!=", "<", "<=", ">", ">=");
    /** Operators yielding BOOLEAN from two truth values. */
    static final Set<String> LOGICAL = Set.of("and", "or");

    /** The scopes of the current run. */
    protected final Environment environment;

    public TypeInferrer(Environment environment) {
        this.environment = environment;
    }

    /** Returns the type of EXPR in the current scope. */
    public InferredType infer(Expr expr) {
        return expr.dispatch(this);
    }

    /**
     * Infers the type of the value of NODE and binds each target to it.
     * Targets first assigned here get a new, undeclared entry in the
     * innermost scope.
     *
     * @return the type of the assigned value
     */
    public InferredType inferAssignment(AssignStmt node) {
        InferredType type = infer(node.value);
        for (Expr target : node.targets) {
            bind(assignedName(node, target), type);
        }
        return type;
    }

    /**
     * Checks that TARGET OP= VALUE keeps the type of its target, which
     * must already exist.
     *
     * @return the entry of the target
     */
    public SymbolEntry inferAugmentedAssignment(AugAssignStmt node) {
        Identifier target = assignedName(node, node.target);
        if (!ARITHMETIC.contains(node.operator)) {
            throw new TranslationError(UNSUPPORTED_STATEMENT, node,
                                       "operator '%s=' is not supported",
                                       node.operator);
        }
        SymbolEntry entry = resolve(target);
        requireAssignable(target, entry);
        InferredType result = arithmetic(node, node.operator,
                                         entry.getType(), infer(node.value));
        if (result != entry.getType()) {
            throw new TranslationError(TYPE_CONFLICT, node,
                                       "'%s %s= ...' would change %s from %s to %s",
                                       target.name, node.operator, target.name,
                                       entry.getType().displayName(),
                                       result.displayName());
        }
        return entry;
    }

    /**
     * Declares the counter of a for loop in the innermost scope.  The
     * counter may not hide a visible variable, since that variable would
     * keep its old value after the loop.
     */
    public SymbolEntry declareLoopVariable(Identifier counter) {
        if (environment.lookup(counter.name) != null) {
            throw new TranslationError(UNSUPPORTED_STATEMENT, counter,
                                       "loop counter '%s' hides a variable"
                                       + " of the same name", counter.name);
        }
        SymbolEntry entry = environment.declare(counter.name, INTEGER);
        entry.markLoopCounter();
        return entry;
    }

    /**
     * Returns the built-in named by the callee of NODE.
     *
     * @throws TranslationError UnsupportedCall if the callee is not the
     *         plain name of a built-in
     */
    public Builtin resolveCall(CallExpr node) {
        if (!(node.function instanceof Identifier)) {
            throw new TranslationError(UNSUPPORTED_CALL, node,
                                       "only named functions can be called, not %s",
                                       node.function.getKind());
        }
        String name = ((Identifier) node.function).name;
        Builtin builtin = Builtin.lookup(name);
        if (builtin == null) {
            throw new TranslationError(UNSUPPORTED_CALL, node,
                                       "unrecognized function '%s'", name);
        }
        return builtin;
    }

    /** Returns the types of the arguments of NODE, in order. */
    public List<InferredType> inferArguments(CallExpr node) {
        List<InferredType> types = new ArrayList<>(node.args.size());
        for (Expr arg : node.args) {
            types.add(infer(arg));
        }
        return types;
    }

    /** Returns the type of condition EXPR, which must not be TEXT. */
    public InferredType inferCondition(Expr expr) {
        InferredType type = infer(expr);
        if (type == TEXT) {
            throw new TranslationError(TYPE_CONFLICT, expr,
                                       "Text cannot be used as a condition");
        }
        return type;
    }

    @Override
    public InferredType analyze(IntegerLiteral node) {
        return INTEGER;
    }

    @Override
    public InferredType analyze(FloatLiteral node) {
        return FLOATING_POINT;
    }

    @Override
    public InferredType analyze(StringLiteral node) {
        return TEXT;
    }

    @Override
    public InferredType analyze(BooleanLiteral node) {
        return BOOLEAN;
    }

    @Override
    public InferredType analyze(Identifier node) {
        return resolve(node).getType();
    }

    @Override
    public InferredType analyze(BinaryExpr node) {
        InferredType left = infer(node.left);
        InferredType right = infer(node.right);
        String op = node.operator;
        if (ARITHMETIC.contains(op)) {
            return arithmetic(node, op, left, right);
        } else if (COMPARISON.contains(op)) {
            if ((left == TEXT) != (right == TEXT)) {
                throw new TranslationError(TYPE_CONFLICT, node,
                                           "cannot compare %s with %s",
                                           left.displayName(),
                                           right.displayName());
            }
            return BOOLEAN;
        } else if (LOGICAL.contains(op)) {
            if (left == TEXT || right == TEXT) {
                throw new TranslationError(TYPE_CONFLICT, node,
                                           "operator '%s' on %s and %s", op,
                                           left.displayName(),
                                           right.displayName());
            }
            return BOOLEAN;
        }
        throw new TranslationError(UNSUPPORTED_EXPRESSION, node,
                                   "operator '%s' is not supported", op);
    }

    @Override
    public InferredType analyze(UnaryExpr node) {
        InferredType operand = infer(node.operand);
        switch (node.operator) {
        case "not":
            if (operand == TEXT) {
                throw new TranslationError(TYPE_CONFLICT, node,
                                           "operator 'not' on Text");
            }
            return BOOLEAN;
        case "-":
        case "+":
            if (!operand.isNumeric()) {
                throw new TranslationError(TYPE_CONFLICT, node,
                                           "unary '%s' on %s", node.operator,
                                           operand.displayName());
            }
            return InferredType.wider(operand, INTEGER);
        default:
            throw new TranslationError(UNSUPPORTED_EXPRESSION, node,
                                       "operator '%s' is not supported",
                                       node.operator);
        }
    }

    @Override
    public InferredType analyze(IfExpr node) {
        inferCondition(node.condition);
        InferredType thenType = infer(node.thenExpr);
        InferredType elseType = infer(node.elseExpr);
        if (thenType == elseType) {
            return thenType;
        } else if (thenType.isNumeric() && elseType.isNumeric()) {
            return InferredType.wider(thenType, elseType);
        }
        throw new TranslationError(TYPE_CONFLICT, node,
                                   "branches have types %s and %s",
                                   thenType.displayName(),
                                   elseType.displayName());
    }

    @Override
    public InferredType analyze(CallExpr node) {
        Builtin builtin = resolveCall(node);
        if (!builtin.hasValue()) {
            throw new TranslationError(UNSUPPORTED_CALL, node,
                                       "%s() has no value here",
                                       builtin.getPythonName());
        }
        List<InferredType> args = inferArguments(node);
        if (args.size() != 1) {
            throw new TranslationError(TYPE_CONFLICT, node,
                                       "%s() takes 1 argument, got %d",
                                       builtin.getPythonName(), args.size());
        }
        InferredType arg = args.get(0);
        switch (builtin) {
        case LEN:
            if (arg != TEXT) {
                throw argumentConflict(node, builtin, "Text", arg);
            }
            return INTEGER;
        case ABS:
            requireNumeric(node, builtin, arg);
            return InferredType.wider(arg, INTEGER);
        case INT:
            requireNumeric(node, builtin, arg);
            return INTEGER;
        case FLOAT:
            requireNumeric(node, builtin, arg);
            return FLOATING_POINT;
        default:
            throw new IllegalStateException("no value rule for " + builtin);
        }
    }

    /** Everything else, including None and list displays, has no C
     *  type. */
    @Override
    protected InferredType defaultAction(Node node) {
        throw new TranslationError(UNSUPPORTED_EXPRESSION, node,
                                   "%s cannot be translated", node.getKind());
    }

    /** Returns the result type of LEFT OP RIGHT for an arithmetic OP.
     *  Booleans count as integers. */
    private InferredType arithmetic(Node node, String op,
                                    InferredType left, InferredType right) {
        if (left == TEXT || right == TEXT) {
            throw new TranslationError(TYPE_CONFLICT, node,
                                       "arithmetic '%s' on %s and %s", op,
                                       left.displayName(), right.displayName());
        }
        if (op.equals("%") && (left == FLOATING_POINT
                               || right == FLOATING_POINT)) {
            throw new TranslationError(TYPE_CONFLICT, node,
                                       "'%%' requires integer operands");
        }
        return InferredType.wider(InferredType.wider(left, right), INTEGER);
    }

    /** Binds NAME to TYPE, creating its entry on first assignment. */
    private void bind(Identifier name, InferredType type) {
        SymbolEntry entry = environment.lookup(name.name);
        if (entry == null) {
            environment.declare(name.name, type);
            return;
        }
        requireAssignable(name, entry);
        if (entry.getType() != type) {
            throw new TranslationError(TYPE_CONFLICT, name,
                                       "'%s' is %s but is assigned %s",
                                       name.name,
                                       entry.getType().displayName(),
                                       type.displayName());
        }
    }

    /** Rejects assignments to the counter of an enclosing for loop,
     *  whose C loop would then run a different number of times. */
    private void requireAssignable(Identifier name, SymbolEntry entry) {
        if (entry.isLoopCounter()) {
            throw new TranslationError(UNSUPPORTED_STATEMENT, name,
                                       "cannot assign to loop counter '%s'",
                                       name.name);
        }
    }

    /** Returns the entry visible for NAME. */
    private SymbolEntry resolve(Identifier name) {
        SymbolEntry entry = environment.lookup(name.name);
        if (entry == null) {
            throw new TranslationError(UNKNOWN_IDENTIFIER, name,
                                       "name '%s' is not defined", name.name);
        }
        return entry;
    }

    /** Returns TARGET as an identifier, the only assignable expression. */
    private Identifier assignedName(Node statement, Expr target) {
        if (!(target instanceof Identifier)) {
            throw new TranslationError(UNSUPPORTED_STATEMENT, statement,
                                       "cannot assign to %s", target.getKind());
        }
        return (Identifier) target;
    }

    private void requireNumeric(CallExpr node, Builtin builtin,
                                InferredType arg) {
        if (!arg.isNumeric()) {
            throw argumentConflict(node, builtin, "a number", arg);
        }
    }

    private TranslationError argumentConflict(CallExpr node, Builtin builtin,
                                              String expected,
                                              InferredType actual) {
        return new TranslationError(TYPE_CONFLICT, node,
                                    "%s() expects %s, got %s",
                                    builtin.getPythonName(), expected,
                                    actual.displayName());
    }
}
