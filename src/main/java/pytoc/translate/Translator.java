package pytoc.translate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pytoc.common.astnodes.AstReader;
import pytoc.common.astnodes.Program;
import pytoc.common.codegen.CBackend;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * The translator from a Python program to C.
 *
 * Each call to translate is an independent run: the scopes, the
 * backend and the component translators are created afresh, so one
 * Translator can be reused for any number of programs, one at a time.
 *
 * The components are created by protected factory methods, which
 * subclasses may override to substitute extended versions.
 */
public class Translator {

    private static final Logger LOG = LoggerFactory.getLogger(Translator.class);

    /** Settings shared by all runs. */
    protected final TranslatorOptions options;

    /** A translator with the default options. */
    public Translator() {
        this(TranslatorOptions.defaults());
    }

    public Translator(TranslatorOptions options) {
        this.options = options;
    }

    /**
     * Returns the C program equivalent to PROGRAM.
     *
     * @throws TranslationError on the first construct that cannot be
     *         translated; no text is produced in that case
     */
    public String translate(Program program) {
        Environment environment = makeEnvironment();
        ProgramAssembler assembler = makeProgramAssembler();
        TypeInferrer types = makeTypeInferrer(environment);
        ExpressionTranslator expressions =
            makeExpressionTranslator(types, assembler.getBackend());
        StatementTranslator statements =
            makeStatementTranslator(environment, types, expressions,
                                    assembler.getBackend());

        program.dispatch(statements);
        String text = assembler.assemble();
        LOG.debug("Translated {} top-level statement(s), headers {}",
                  program.statements.size(),
                  assembler.getBackend().getHeaders());
        return text;
    }

    /**
     * Returns the C program equivalent to the program whose tree is
     * described by the JSON text JSON.
     *
     * @throws JsonProcessingException if JSON does not describe a Program
     */
    public String translate(String json) throws JsonProcessingException {
        return translate(AstReader.read(json));
    }

    protected Environment makeEnvironment() {
        return new Environment();
    }

    protected ProgramAssembler makeProgramAssembler() {
        return new ProgramAssembler(options);
    }

    protected TypeInferrer makeTypeInferrer(Environment environment) {
        return new TypeInferrer(environment);
    }

    protected ExpressionTranslator makeExpressionTranslator(TypeInferrer types,
                                                            CBackend backend) {
        return new ExpressionTranslator(types, backend, options);
    }

    protected StatementTranslator makeStatementTranslator(
            Environment environment, TypeInferrer types,
            ExpressionTranslator expressions, CBackend backend) {
        return new StatementTranslator(environment, types, expressions,
                                       backend);
    }
}
