package org.pragmatica.regex.tree;

import com.google.common.base.Strings;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Textual dump of a derivation tree: one node per line, each line prefixed with the
 * marker repeated {@code step} times per level of depth.
 *
 * <p>Example for {@code a+b}, printed from the top node at indent 0:
 * <pre>
 * RE
 * -a
 * -RE'
 * --+
 * --RE
 * ---b
 * </pre>
 */
public final class TreePrinter {
    private static final TreePrinter STANDARD = new TreePrinter('-', 1);

    private final char marker;
    private final int step;

    private TreePrinter(char marker, int step) {
        this.marker = marker;
        this.step = step;
    }

    public static TreePrinter standard() {
        return STANDARD;
    }

    public static TreePrinter create(char marker, int step) {
        checkArgument(step >= 0, "step must not be negative: %s", step);
        return new TreePrinter(marker, step);
    }

    /**
     * Print to standard output.
     */
    public void print(ParseNode node, int indent) {
        print(node, indent, System.out);
    }

    public void print(ParseNode node, int indent, PrintStream out) {
        out.print(render(node, indent));
        out.flush();
    }

    /**
     * Write the dump to a character stream. The stream is not closed.
     */
    public void save(ParseNode node, Writer writer, int indent) throws IOException {
        try {
            visit(node, indent, line -> {
                try {
                    writer.write(line);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        writer.flush();
    }

    /**
     * Write the dump to a file, replacing any previous content.
     */
    public void save(ParseNode node, Path file, int indent) throws IOException {
        try (var writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            save(node, writer, indent);
        }
    }

    public String render(ParseNode node, int indent) {
        var sb = new StringBuilder();
        visit(node, indent, sb::append);
        return sb.toString();
    }

    private void visit(ParseNode node, int indent, LineSink sink) {
        if (node == null) {
            return;
        }
        sink.accept(Strings.repeat(String.valueOf(marker), indent) + node.label() + "\n");
        for (var child : node.children()) {
            visit(child, indent + step, sink);
        }
    }

    @FunctionalInterface
    private interface LineSink {
        void accept(String line);
    }
}
