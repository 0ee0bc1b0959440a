package org.pragmatica.regex.tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TreePrinterTest {

    private static final String STAR_TREE = """
        RE
        -a
        -RE'
        --*
        """;

    @TempDir
    Path tempDir;

    private static ParseNode starTree(ParseTree tree) {
        var re = tree.newNode("RE");
        var prime = tree.newNode("RE'");
        tree.attach(re, tree.newNode("a"));
        tree.attach(re, prime);
        tree.attach(prime, tree.newNode("*"));
        return re;
    }

    @Test
    void render_prefixesDepthMarkers() {
        var node = starTree(ParseTree.create());

        assertEquals(STAR_TREE, TreePrinter.standard().render(node, 0));
    }

    @Test
    void render_startsFromGivenIndent() {
        var node = starTree(ParseTree.create());

        assertEquals("--RE\n---a\n---RE'\n----*\n", TreePrinter.standard().render(node, 2));
    }

    @Test
    void render_customMarkerAndStep() {
        var node = starTree(ParseTree.create());

        assertEquals("RE\n..a\n..RE'\n....*\n", TreePrinter.create('.', 2).render(node, 0));
    }

    @Test
    void render_absentNode_isEmpty() {
        assertEquals("", TreePrinter.standard().render(null, 0));
    }

    @Test
    void print_writesToStream() {
        var node = starTree(ParseTree.create());
        var buffer = new ByteArrayOutputStream();

        TreePrinter.standard().print(node, 0, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertEquals(STAR_TREE, buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void save_writesToWriter() throws IOException {
        var node = starTree(ParseTree.create());
        var writer = new StringWriter();

        TreePrinter.standard().save(node, writer, 0);

        assertEquals(STAR_TREE, writer.toString());
    }

    @Test
    void save_writesToFile() throws IOException {
        var node = starTree(ParseTree.create());
        var file = tempDir.resolve("tree.txt");

        TreePrinter.standard().save(node, file, 0);

        assertEquals(STAR_TREE, Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void create_negativeStep_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> TreePrinter.create('-', -1));
    }
}
