package org.pragmatica.regex.parser;

import org.pragmatica.regex.tree.ParseTree;

/**
 * Parser interface - parses input text into a derivation tree.
 *
 * <p>Input must be consumed entirely for the parse to be accepted.
 */
public interface Parser {

    /**
     * Parse input from the grammar's start rule into a fresh tree.
     */
    ParseOutcome parse(String input);

    /**
     * Parse input starting from a specific rule.
     */
    ParseOutcome parse(String input, String startRule);

    /**
     * Parse input into a caller-supplied empty tree. On rejection the tree is left
     * empty, with no live nodes.
     */
    ParseOutcome parseInto(String input, ParseTree tree);

    /**
     * Parse input starting from a specific rule into a caller-supplied empty tree.
     */
    ParseOutcome parseInto(String input, String startRule, ParseTree tree);
}
