package pytoc.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import pytoc.common.analysis.AbstractNodeAnalyzer;
import pytoc.common.analysis.types.InferredType;
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
import pytoc.common.codegen.CBackend;

import static pytoc.common.analysis.types.InferredType.BOOLEAN;
import static pytoc.common.analysis.types.InferredType.FLOATING_POINT;
import static pytoc.common.analysis.types.InferredType.TEXT;
import static pytoc.translate.ErrorKind.UNSUPPORTED_CALL;
import static pytoc.translate.ErrorKind.UNSUPPORTED_EXPRESSION;

/**
 * Rewrites expressions as C expression text.
 *
 * Every operator application is parenthesized, so the C text evaluates
 * in the order of the Python tree regardless of C precedence.  Headers
 * needed by the produced text are recorded in the backend.
 */
public class ExpressionTranslator extends AbstractNodeAnalyzer<String> {

    /** Header for bool, true and false. */
    static final String STDBOOL = "stdbool.h";
    static final String STRING = "string.h";

    protected final TypeInferrer types;
    protected final CBackend backend;
    protected final TranslatorOptions options;

    public ExpressionTranslator(TypeInferrer types, CBackend backend,
                                TranslatorOptions options) {
        this.types = types;
        this.backend = backend;
        this.options = options;
    }

    /** Returns the C text for EXPR, which must have a value. */
    public String translate(Expr expr) {
        types.infer(expr);
        return expr.dispatch(this);
    }

    /**
     * Returns the C text for NODE as a statement, without the semicolon.
     * A print call becomes a printf whose conversions follow the types of
     * the arguments; other built-ins are translated as values.
     */
    public String translateCallStatement(CallExpr node) {
        Builtin builtin = types.resolveCall(node);
        if (builtin != Builtin.PRINT) {
            return translate(node);
        }
        List<InferredType> argTypes = types.inferArguments(node);
        StringJoiner format = new StringJoiner(" ", "\"", "\\n\"");
        List<String> args = new ArrayList<>();
        for (int i = 0; i < node.args.size(); i += 1) {
            Expr arg = node.args.get(i);
            InferredType type = argTypes.get(i);
            format.add(conversion(arg, type));
            String text = arg.dispatch(this);
            if (type == BOOLEAN) {
                text = String.format("(%s ? \"True\" : \"False\")", text);
            }
            args.add(text);
        }
        backend.require(builtin.getHeader());
        StringBuilder call = new StringBuilder("printf(").append(format);
        for (String arg : args) {
            call.append(", ").append(arg);
        }
        return call.append(")").toString();
    }

    @Override
    public String analyze(Identifier node) {
        return node.name;
    }

    @Override
    public String analyze(IntegerLiteral node) {
        return Integer.toString(node.value);
    }

    @Override
    public String analyze(FloatLiteral node) {
        if (!Double.isFinite(node.value)) {
            throw new TranslationError(UNSUPPORTED_EXPRESSION, node,
                                       "%s has no C literal", node.value);
        }
        return Double.toString(node.value);
    }

    @Override
    public String analyze(StringLiteral node) {
        return CBackend.quote(node.value);
    }

    @Override
    public String analyze(BooleanLiteral node) {
        backend.require(STDBOOL);
        return node.value ? "true" : "false";
    }

    @Override
    public String analyze(BinaryExpr node) {
        String left = node.left.dispatch(this);
        String right = node.right.dispatch(this);
        String op = node.operator;
        if (TypeInferrer.COMPARISON.contains(op)
            && types.infer(node.left) == TEXT) {
            backend.require(STRING);
            return String.format("(strcmp(%s, %s) %s 0)", left, right, op);
        }
        switch (op) {
        case "and":
            return String.format("(%s && %s)", left, right);
        case "or":
            return String.format("(%s || %s)", left, right);
        default:
            return String.format("(%s %s %s)", left, op, right);
        }
    }

    @Override
    public String analyze(UnaryExpr node) {
        String operand = node.operand.dispatch(this);
        if (node.operator.equals("not")) {
            return String.format("(!%s)", operand);
        }
        return String.format("(%s%s)", node.operator, operand);
    }

    @Override
    public String analyze(IfExpr node) {
        return String.format("(%s ? %s : %s)",
                             node.condition.dispatch(this),
                             node.thenExpr.dispatch(this),
                             node.elseExpr.dispatch(this));
    }

    @Override
    public String analyze(CallExpr node) {
        Builtin builtin = types.resolveCall(node);
        Expr arg = node.args.get(0);
        String text = arg.dispatch(this);
        switch (builtin) {
        case LEN:
            backend.require(builtin.getHeader());
            return String.format("((int) strlen(%s))", text);
        case ABS:
            if (types.infer(arg) == FLOATING_POINT) {
                backend.require("math.h");
                return String.format("fabs(%s)", text);
            }
            backend.require(builtin.getHeader());
            return String.format("abs(%s)", text);
        case INT:
            return String.format("((int) %s)", text);
        case FLOAT:
            return String.format("((double) %s)", text);
        default:
            throw new TranslationError(UNSUPPORTED_CALL, node,
                                       "%s() has no value here",
                                       builtin.getPythonName());
        }
    }

    @Override
    protected String defaultAction(Node node) {
        throw new TranslationError(UNSUPPORTED_EXPRESSION, node,
                                   "%s cannot be translated", node.getKind());
    }

    /** Returns the printf conversion for ARG of TYPE. */
    private String conversion(Expr arg, InferredType type) {
        switch (type) {
        case INTEGER:
            return "%d";
        case FLOATING_POINT:
            return options.getFloatFormat();
        case TEXT:
        case BOOLEAN:
            return "%s";
        default:
            throw new TranslationError(ErrorKind.UNRESOLVED_TYPE, arg,
                                       "cannot print a value of unknown type");
        }
    }
}
