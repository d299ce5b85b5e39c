package pytoc.translate;

import java.util.List;

import org.junit.jupiter.api.Test;

import pytoc.common.astnodes.FuncDef;
import pytoc.common.astnodes.ListExpr;
import pytoc.common.astnodes.NoneLiteral;
import pytoc.common.astnodes.Program;
import pytoc.common.astnodes.ReturnStmt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static pytoc.translate.Ast.*;

public class TranslatorTest {

    private static String translate(Program program) {
        return new Translator().translate(program);
    }

    private static TranslationError fails(ErrorKind kind, Program program) {
        TranslationError error = assertThrows(TranslationError.class,
                                              () -> translate(program));
        assertEquals(kind, error.getKind(), error.getMessage());
        return error;
    }

    @Test
    void assignmentsOnlyNeedNoHeaders() {
        String c = translate(program(assign("x", num(1)),
                                     assign("ratio", num(2.5)),
                                     assign("name", str("ana"))));
        assertEquals("int main(void) {\n"
                     + "    int x = 1;\n"
                     + "    double ratio = 2.5;\n"
                     + "    const char *name = \"ana\";\n"
                     + "    return 0;\n"
                     + "}\n", c);
    }

    @Test
    void reassignmentDoesNotRedeclare() {
        String c = translate(program(assign("x", num(1)),
                                     assign("x", bin(id("x"), "+", num(1))),
                                     assign("x", num(7))));
        assertTrue(c.contains("    int x = 1;\n    x = (x + 1);\n    x = 7;\n"), c);
    }

    @Test
    void reassigningIntegerWithTextIsTypeConflict() {
        TranslationError error = fails(ErrorKind.TYPE_CONFLICT,
                                       program(assign("x", num(1)),
                                               assign("x", str("um"))));
        assertEquals("Identifier", error.getNodeKind());
        assertTrue(error.getDetail().contains("'x' is Integer"), error.getDetail());
    }

    @Test
    void reassigningIntegerWithFloatIsTypeConflict() {
        fails(ErrorKind.TYPE_CONFLICT,
              program(assign("n", num(1)), assign("n", num(1.5))));
    }

    @Test
    void unrecognizedFunctionIsUnsupportedCall() {
        TranslationError error = fails(ErrorKind.UNSUPPORTED_CALL,
                                       program(expr(call("input", str("?")))));
        assertEquals("CallExpr", error.getNodeKind());
    }

    @Test
    void printHasNoValue() {
        fails(ErrorKind.UNSUPPORTED_CALL,
              program(assign("x", call("print", num(1)))));
    }

    @Test
    void rangeOutsideForIsUnsupportedCall() {
        fails(ErrorKind.UNSUPPORTED_CALL,
              program(assign("r", call("range", num(3)))));
    }

    @Test
    void referenceBeforeAssignmentIsUnknownIdentifier() {
        fails(ErrorKind.UNKNOWN_IDENTIFIER, program(print(id("y"))));
        fails(ErrorKind.UNKNOWN_IDENTIFIER,
              program(assign("x", bin(id("x"), "+", num(1)))));
    }

    @Test
    void errorMessageCarriesSourcePosition() {
        Program program = program(
            assign("x", num(1)),
            expr(at(2, 1, call("foo"))));
        TranslationError error = fails(ErrorKind.UNSUPPORTED_CALL, program);
        assertEquals(2, error.getLocation().getLine());
        assertEquals("2:1: UnsupportedCall: unrecognized function 'foo'",
                     error.getMessage());
    }

    @Test
    void textArithmeticIsTypeConflict() {
        fails(ErrorKind.TYPE_CONFLICT,
              program(assign("s", bin(str("a"), "+", str("b")))));
        fails(ErrorKind.TYPE_CONFLICT,
              program(assign("s", bin(str("a"), "*", num(3)))));
    }

    @Test
    void arithmeticWidensToFloatingPoint() {
        String c = translate(program(assign("x", bin(num(1), "*", num(0.5))),
                                     assign("b", bin(bool(true), "+", num(2)))));
        assertTrue(c.contains("double x = (1 * 0.5);"), c);
        assertTrue(c.contains("int b = (true + 2);"), c);
        assertTrue(c.startsWith("#include <stdbool.h>\n\n"), c);
    }

    @Test
    void sumOfBooleansIsDeclaredAndPrintedAsInteger() {
        String c = translate(program(assign("x", bin(bool(true), "+", bool(true))),
                                     print(id("x"))));
        assertTrue(c.contains("    int x = (true + true);\n"
                              + "    printf(\"%d\\n\", x);\n"), c);
        assertFalse(c.contains("bool x"), c);
    }

    @Test
    void comparisonsAndBooleanOperatorsAreBoolean() {
        String c = translate(program(
            assign("a", num(3)),
            assign("ok", bin(bin(id("a"), ">=", num(1)), "and",
                             unary("not", bin(id("a"), "==", num(2)))))));
        assertTrue(c.contains("bool ok = ((a >= 1) && (!(a == 2)));"), c);
        assertTrue(c.contains("#include <stdbool.h>"), c);
    }

    @Test
    void unsupportedOperatorIsUnsupportedExpression() {
        fails(ErrorKind.UNSUPPORTED_EXPRESSION,
              program(assign("p", bin(num(2), "**", num(8)))));
    }

    @Test
    void moduloOnFloatingPointIsTypeConflict() {
        fails(ErrorKind.TYPE_CONFLICT,
              program(assign("m", bin(num(7.5), "%", num(2)))));
    }

    @Test
    void printChoosesConversionsFromArgumentTypes() {
        String c = translate(program(
            assign("n", num(4)),
            assign("f", num(0.25)),
            print(str("n ="), id("n"), id("f"), bin(id("n"), ">", num(3))),
            print()));
        assertTrue(c.contains("printf(\"%s %d %g %s\\n\", \"n =\", n, f,"
                              + " ((n > 3) ? \"True\" : \"False\"));"), c);
        assertTrue(c.contains("    printf(\"\\n\");\n"), c);
        assertTrue(c.startsWith("#include <stdio.h>\n\n"), c);
    }

    @Test
    void floatFormatIsConfigurable() {
        Translator translator = new Translator(
            TranslatorOptions.defaults().withFloatFormat("%.2f"));
        String c = translator.translate(program(print(num(1.5))));
        assertTrue(c.contains("printf(\"%.2f\\n\", 1.5);"), c);
    }

    @Test
    void textLiteralsAreQuotedAndEscaped() {
        String c = translate(program(assign("q", str("say \"hi\"\\now"))));
        assertTrue(c.contains("const char *q = \"say \\\"hi\\\"\\\\now\";"), c);
    }

    @Test
    void textComparisonUsesStrcmp() {
        String c = translate(program(
            assign("s", str("b")),
            ifStmt(bin(id("s"), "<", str("c")), block(print(id("s"))), block())));
        assertTrue(c.contains("if (strcmp(s, \"c\") < 0) {"), c);
        assertTrue(c.startsWith("#include <stdio.h>\n#include <string.h>\n\n"), c);
    }

    @Test
    void comparingTextWithNumberIsTypeConflict() {
        fails(ErrorKind.TYPE_CONFLICT,
              program(assign("t", bin(str("1"), "==", num(1)))));
    }

    @Test
    void textConditionIsTypeConflict() {
        fails(ErrorKind.TYPE_CONFLICT,
              program(ifStmt(str("yes"), block(print(num(1))), block())));
    }

    @Test
    void elifChainsStayFlat() {
        String c = translate(program(
            assign("n", num(5)),
            ifStmt(bin(id("n"), "<", num(0)), block(print(str("neg"))),
                   block(ifStmt(bin(id("n"), "==", num(0)),
                                block(print(str("zero"))),
                                block(print(str("pos"))))))));
        assertTrue(c.contains("    if (n < 0) {\n"
                              + "        printf(\"%s\\n\", \"neg\");\n"
                              + "    } else if (n == 0) {\n"
                              + "        printf(\"%s\\n\", \"zero\");\n"
                              + "    } else {\n"
                              + "        printf(\"%s\\n\", \"pos\");\n"
                              + "    }\n"), c);
    }

    @Test
    void eachBranchDeclaresItsOwnVariables() {
        String c = translate(program(
            assign("x", num(1)),
            ifStmt(bool(true), block(assign("z", num(1)), assign("z", num(2))),
                   block(assign("z", num(3))))));
        assertTrue(c.contains("        int z = 1;\n        z = 2;\n"), c);
        assertTrue(c.contains("    } else {\n        int z = 3;\n"), c);
    }

    @Test
    void variableFromClosedBlockIsUnknown() {
        fails(ErrorKind.UNKNOWN_IDENTIFIER,
              program(ifStmt(bool(true), block(assign("z", num(1))), block()),
                      print(id("z"))));
    }

    @Test
    void innerAssignmentToOuterVariableIsPlain() {
        String c = translate(program(
            assign("total", num(0)),
            forRange("i", block(augAssign("total", "+", id("i")),
                                assign("total", bin(id("total"), "*", num(2)))),
                     num(3))));
        assertTrue(c.contains("        total += i;\n        total = (total * 2);\n"), c);
        assertFalse(c.contains("int total = (total"), c);
    }

    @Test
    void innerBlockMustKeepOuterType() {
        fails(ErrorKind.TYPE_CONFLICT,
              program(assign("x", num(1)),
                      ifStmt(bool(true), block(assign("x", str("s"))), block())));
    }

    @Test
    void rangeWithStartStopAndStep() {
        String c = translate(program(
            forRange("i", block(print(id("i"))), num(2), num(10), num(3)),
            forRange("j", block(print(id("j"))), num(10), num(0), unary("-", num(1))),
            forRange("k", block(print(id("k"))), num(10), num(0), num(-4))));
        assertTrue(c.contains("for (int i = 2; i < 10; i += 3) {"), c);
        assertTrue(c.contains("for (int j = 10; j > 0; j--) {"), c);
        assertTrue(c.contains("for (int k = 10; k > 0; k -= 4) {"), c);
    }

    @Test
    void rangeWithVariableStepTestsDirectionAtRunTime() {
        String c = translate(program(
            assign("s", num(2)),
            forRange("i", block(print(id("i"))), num(0), num(9), id("s"))));
        assertTrue(c.contains("for (int i = 0, i_step = s;"
                              + " (i_step > 0 ? i < 9 : i > 9); i += i_step) {"), c);
    }

    @Test
    void rangeStopIsEvaluatedOnce() {
        String c = translate(program(
            assign("n", num(5)),
            forRange("i", block(assign("n", bin(id("n"), "-", num(1))),
                                print(id("i"))),
                     id("n"))));
        assertTrue(c.contains("    for (int i = 0, i_stop = n; i < i_stop; i++) {\n"
                              + "        n = (n - 1);\n"), c);
    }

    @Test
    void rangeBoundsAreEvaluatedInOrder() {
        String c = translate(program(
            assign("a", num(1)),
            assign("b", num(8)),
            forRange("k", block(print(id("k"))),
                     id("a"), bin(id("b"), "*", num(2)), unary("-", id("a")))));
        assertTrue(c.contains("for (int k = a, k_stop = (b * 2), k_step = (-a);"
                              + " (k_step > 0 ? k < k_stop : k > k_stop);"
                              + " k += k_step) {"), c);
    }

    @Test
    void boundVariablesAvoidVisibleNames() {
        String c = translate(program(
            assign("i_stop", num(1)),
            assign("n", num(4)),
            forRange("i", block(print(id("i"), id("i_stop"))), id("n"))));
        assertTrue(c.contains("for (int i = 0, i_stop1 = n; i < i_stop1; i++) {"), c);
        assertTrue(c.contains("printf(\"%d %d\\n\", i, i_stop);"), c);
    }

    @Test
    void constantBoundsNeedNoVariables() {
        String c = translate(program(
            forRange("i", block(print(id("i"))), num(5), unary("-", num(5)), num(-2))));
        assertTrue(c.contains("for (int i = 5; i > (-5); i -= 2) {"), c);
    }

    @Test
    void assigningTheLoopCounterIsUnsupported() {
        TranslationError error = fails(ErrorKind.UNSUPPORTED_STATEMENT, program(
            forRange("i", block(assign("i", bin(id("i"), "+", num(10))),
                                print(id("i"))),
                     num(3))));
        assertEquals("Identifier", error.getNodeKind());
        fails(ErrorKind.UNSUPPORTED_STATEMENT, program(
            forRange("i", block(ifStmt(bool(true),
                                       block(augAssign("i", "+", num(1))),
                                       block())),
                     num(3))));
    }

    @Test
    void loopCounterCannotHideAVariable() {
        fails(ErrorKind.UNSUPPORTED_STATEMENT, program(
            assign("i", num(2)),
            forRange("i", block(print(id("i"))), id("i"), num(5))));
        fails(ErrorKind.UNSUPPORTED_STATEMENT, program(
            forRange("i", block(forRange("i", block(print(id("i"))), num(2))),
                     num(3))));
    }

    @Test
    void loopCounterIsScopedToTheLoop() {
        fails(ErrorKind.UNKNOWN_IDENTIFIER,
              program(forRange("i", block(print(id("i"))), num(3)),
                      print(id("i"))));
    }

    @Test
    void zeroStepIsUnsupportedIterable() {
        fails(ErrorKind.UNSUPPORTED_ITERABLE,
              program(forRange("i", block(print(id("i"))), num(0), num(5), num(0))));
    }

    @Test
    void nonRangeIterablesAreRejected() {
        fails(ErrorKind.UNSUPPORTED_ITERABLE,
              program(new pytoc.common.astnodes.ForStmt(
                  id("c"), str("abc"), block(print(id("c"))))));
        fails(ErrorKind.UNSUPPORTED_ITERABLE,
              program(forRange("i", block(print(id("i"))), num(1.5))));
        fails(ErrorKind.UNSUPPORTED_ITERABLE,
              program(forRange("i", block(print(id("i"))),
                               num(1), num(2), num(3), num(4))));
        fails(ErrorKind.UNSUPPORTED_ITERABLE,
              program(forRange("i", block(print(id("i"))))));
    }

    @Test
    void whileLoopsGetTheirOwnScope() {
        String c = translate(program(
            assign("n", num(3)),
            whileStmt(bin(id("n"), ">", num(0)),
                      assign("half", bin(id("n"), "/", num(2))),
                      augAssign("n", "-", num(1)))));
        assertTrue(c.contains("    while (n > 0) {\n"
                              + "        int half = (n / 2);\n"
                              + "        n -= 1;\n"
                              + "    }\n"), c);
    }

    @Test
    void augmentedAssignmentMustKeepType() {
        fails(ErrorKind.TYPE_CONFLICT,
              program(assign("n", num(1)), augAssign("n", "+", num(0.5))));
        fails(ErrorKind.UNKNOWN_IDENTIFIER,
              program(augAssign("n", "+", num(1))));
    }

    @Test
    void chainedAssignmentDeclaresEveryTarget() {
        String c = translate(program(
            new pytoc.common.astnodes.AssignStmt(List.of(id("a"), id("b")),
                                                 bin(num(2), "*", num(3)))));
        assertTrue(c.contains("    int a = (2 * 3);\n    int b = a;\n"), c);
    }

    @Test
    void builtinsMapToCFunctions() {
        String c = translate(program(
            assign("s", str("hello")),
            assign("n", call("len", id("s"))),
            assign("d", call("abs", bin(id("n"), "-", num(10)))),
            assign("f", call("abs", num(-2.5))),
            assign("g", call("float", id("n"))),
            assign("h", call("int", id("g")))));
        assertTrue(c.contains("int n = ((int) strlen(s));"), c);
        assertTrue(c.contains("int d = abs((n - 10));"), c);
        assertTrue(c.contains("double f = fabs(-2.5);"), c);
        assertTrue(c.contains("double g = ((double) n);"), c);
        assertTrue(c.contains("int h = ((int) g);"), c);
        assertTrue(c.startsWith("#include <math.h>\n#include <stdlib.h>\n"
                                + "#include <string.h>\n\n"), c);
    }

    @Test
    void builtinArgumentsAreChecked() {
        fails(ErrorKind.TYPE_CONFLICT, program(assign("n", call("len", num(3)))));
        fails(ErrorKind.TYPE_CONFLICT, program(assign("n", call("abs", str("3")))));
        fails(ErrorKind.TYPE_CONFLICT, program(assign("n", call("int"))));
    }

    @Test
    void conditionalExpressionUnifiesNumericBranches() {
        String c = translate(program(
            assign("x", num(4)),
            assign("y", ifExpr(num(1), bin(id("x"), ">", num(2)), num(0.5)))));
        assertTrue(c.contains("double y = ((x > 2) ? 1 : 0.5);"), c);
        fails(ErrorKind.TYPE_CONFLICT,
              program(assign("y", ifExpr(num(1), bool(true), str("no")))));
    }

    @Test
    void unsupportedNodesAreRejectedByKind() {
        TranslationError def = fails(ErrorKind.UNSUPPORTED_STATEMENT, program(
            new FuncDef(id("f"), List.of(), block(new ReturnStmt(null)))));
        assertEquals("FuncDef", def.getNodeKind());
        fails(ErrorKind.UNSUPPORTED_STATEMENT, program(new ReturnStmt(num(1))));
        TranslationError none = fails(ErrorKind.UNSUPPORTED_EXPRESSION,
                                      program(assign("x", new NoneLiteral())));
        assertEquals("NoneLiteral", none.getNodeKind());
        fails(ErrorKind.UNSUPPORTED_EXPRESSION,
              program(assign("xs", new ListExpr(List.of(num(1), num(2))))));
        fails(ErrorKind.UNSUPPORTED_STATEMENT, program(expr(id("x"))));
    }

    @Test
    void assignmentToNonNameIsUnsupported() {
        fails(ErrorKind.UNSUPPORTED_STATEMENT, program(
            new pytoc.common.astnodes.AssignStmt(
                List.of(new ListExpr(List.of(id("a")))), num(1))));
    }

    @Test
    void nestedBlocksCloseEveryBraceAtTheRightDepth() {
        String c = translate(program(
            forRange("i", block(
                ifStmt(bin(id("i"), "%", num(2)),
                       block(whileStmt(bool(false), print(id("i")))),
                       block(print(str("even"))))), num(4))));
        int depth = 0;
        for (String line : c.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("}")) {
                depth -= 1;
            }
            if (!line.isEmpty() && !line.startsWith("#")) {
                int indent = line.length() - line.stripLeading().length();
                assertEquals(depth * 4, indent, "line: " + line);
            }
            if (trimmed.endsWith("{")) {
                depth += 1;
            }
        }
        assertEquals(0, depth);
        assertEquals(c.chars().filter(ch -> ch == '{').count(),
                     c.chars().filter(ch -> ch == '}').count());
    }

    @Test
    void translatorCanBeReused() {
        Translator translator = new Translator();
        Program first = program(assign("x", num(1)));
        assertEquals(translator.translate(first), translator.translate(first));
        String other = translator.translate(program(assign("x", str("s"))));
        assertTrue(other.contains("const char *x = \"s\";"), other);
    }

    @Test
    void entryPointAndIndentAreConfigurable() {
        Translator translator = new Translator(TranslatorOptions.defaults()
                                               .withIndent("\t")
                                               .withEntryPoint("run"));
        String c = translator.translate(program(assign("x", num(1))));
        assertEquals("int run(void) {\n\tint x = 1;\n\treturn 0;\n}\n", c);
    }
}
