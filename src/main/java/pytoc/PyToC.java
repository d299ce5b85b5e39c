package pytoc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pytoc.common.astnodes.AstReader;
import pytoc.common.astnodes.Program;
import pytoc.translate.TranslationError;
import pytoc.translate.Translator;
import pytoc.translate.TranslatorOptions;

/**
 * Command-line driver: reads the JSON tree of a Python program and writes
 * the equivalent C program.
 *
 * <pre>
 * pytoc [--indent=N] [--float-format=FMT] [--entry=NAME] input.json [output.c]
 * </pre>
 *
 * Without an output file the C text goes to standard output.
 */
public final class PyToC {

    private static final Logger LOG = LoggerFactory.getLogger(PyToC.class);

    /** Exit status for translation errors. */
    static final int EXIT_TRANSLATION = 1;
    /** Exit status for bad arguments and I/O failures. */
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
        "Usage: pytoc [--indent=N] [--float-format=FMT] [--entry=NAME]"
        + " <input.json> [output.c]";

    private PyToC() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the driver on ARGS and returns its exit status. */
    static int run(String[] args) {
        TranslatorOptions options = TranslatorOptions.defaults();
        List<String> files = new ArrayList<>();
        try {
            for (String arg : args) {
                if (arg.startsWith("--indent=")) {
                    int width = Integer.parseInt(value(arg));
                    options = options.withIndent(" ".repeat(width));
                } else if (arg.startsWith("--float-format=")) {
                    options = options.withFloatFormat(value(arg));
                } else if (arg.startsWith("--entry=")) {
                    options = options.withEntryPoint(value(arg));
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("unknown option " + arg);
                } else {
                    files.add(arg);
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        if (files.isEmpty() || files.size() > 2) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        Path input = Path.of(files.get(0));
        try {
            Program program =
                AstReader.read(Files.readString(input, StandardCharsets.UTF_8));
            LOG.info("Read {} top-level statement(s) from {}",
                     program.statements.size(), input);
            String text = new Translator(options).translate(program);
            if (files.size() == 2) {
                Path output = Path.of(files.get(1));
                Files.writeString(output, text, StandardCharsets.UTF_8);
                LOG.info("Wrote {}", output);
            } else {
                System.out.print(text);
            }
            return 0;
        } catch (TranslationError e) {
            String separator = e.getLocation() == null ? ": " : ":";
            System.err.println(input + separator + e.getMessage());
            return EXIT_TRANSLATION;
        } catch (IOException e) {
            LOG.error("Cannot translate {}", input, e);
            return EXIT_USAGE;
        }
    }

    private static String value(String option) {
        return option.substring(option.indexOf('=') + 1);
    }
}
