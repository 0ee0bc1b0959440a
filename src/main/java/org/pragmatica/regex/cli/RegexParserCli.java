package org.pragmatica.regex.cli;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.regex.RegexParsers;
import org.pragmatica.regex.error.ParseError;
import org.pragmatica.regex.parser.ParseOutcome;
import org.pragmatica.regex.parser.Parser;
import org.pragmatica.regex.tree.TreePrinter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line front end: parses one expression and prints its derivation tree.
 *
 * <p>Exit code 1 only for invalid invocations; a syntax error in the expression is a
 * regular outcome and exits with 0.
 */
public final class RegexParserCli {
    private static final Logger log = LogManager.getLogger();

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;

    private final Parser parser;
    private final TreePrinter printer;

    RegexParserCli(Parser parser, TreePrinter printer) {
        this.parser = parser;
        this.printer = printer;
    }

    public static void main(String[] args) {
        System.exit(new RegexParserCli(RegexParsers.standard(), TreePrinter.standard()).run(args, System.out));
    }

    int run(String[] args, PrintStream out) {
        var arguments = new Arguments();
        var commander = JCommander.newBuilder()
                                  .programName("regex-parser")
                                  .addObject(arguments)
                                  .build();
        try {
            commander.parse(args);
        } catch (ParameterException e) {
            out.println(e.getMessage());
            usage(commander, out);
            return EXIT_USAGE;
        }

        if (arguments.help) {
            usage(commander, out);
            return EXIT_OK;
        }

        if (arguments.expression.size() != 1) {
            out.println("Wrong number of command-line arguments: "
                        + arguments.expression.size() + " arguments found, 1 expected");
            usage(commander, out);
            return EXIT_USAGE;
        }

        var expression = arguments.expression.get(0);
        var outcome = parser.parse(expression);

        if (outcome instanceof ParseOutcome.Accepted accepted) {
            var tree = accepted.tree();
            try {
                // The synthetic Root is not printed
                var top = tree.top().orElseThrow();
                printer.print(top, 0, out);
                if (arguments.output != null) {
                    printer.save(top, arguments.output, 0);
                }
            } catch (IOException e) {
                log.error("Cannot write tree to {}", arguments.output, e);
                return EXIT_USAGE;
            } finally {
                tree.release();
            }
            return EXIT_OK;
        }

        out.println("Syntax error");
        if (arguments.details) {
            outcome.rejection()
                   .ifPresent(error -> explain(expression, error, out));
        }
        return EXIT_OK;
    }

    private static void explain(String expression, ParseError error, PrintStream out) {
        out.println(error.kind() + ": " + error.message());
        out.println("  " + expression);
        out.println("  " + Strings.repeat(" ", error.location()) + "^");
    }

    private static void usage(JCommander commander, PrintStream out) {
        var sb = new StringBuilder();
        commander.getUsageFormatter()
                 .usage(sb);
        out.print(sb);
    }

    static final class Arguments {
        @Parameter(description = "<expression>")
        private List<String> expression = new ArrayList<>();

        @Parameter(names = {"-o", "--output"}, description = "Also save the tree to this file", arity = 1,
                converter = PathConverter.class, validateWith = WritableFile.class)
        private Path output;

        @Parameter(names = {"-d", "--details"}, description = "Explain syntax errors: position, found and expected input")
        private boolean details;

        @Parameter(names = {"-h", "--help"}, description = "Show this message", help = true)
        private boolean help;
    }

    public static class PathConverter implements IStringConverter<Path> {
        @Override
        public Path convert(String value) {
            return Paths.get(value);
        }
    }

    public static class WritableFile implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            var path = Paths.get(value).toAbsolutePath();
            var parent = path.getParent();
            if (Files.isDirectory(path) || parent == null || !Files.isDirectory(parent)) {
                throw new ParameterException("Cannot write to file " + name + " = " + value);
            }
        }
    }
}
