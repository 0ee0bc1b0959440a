package org.pragmatica.regex.error;

/**
 * Parse error with position and context information.
 * Positions are zero-based offsets into the parsed text.
 */
public sealed interface ParseError {
    int location();

    String message();

    /**
     * Short name of the error category, for user-facing output.
     */
    String kind();

    /**
     * No terminal matches at the furthest position reached: the character there is
     * outside the alphabet, or the input ended.
     */
    record LexicalReject(
    int location,
    String found,
    String expected) implements ParseError {
        @Override
        public String kind() {
            return "lexical error";
        }

        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected " + expected;
        }
    }

    /**
     * Every alternative of the start rule failed although the input is lexically valid.
     */
    record GrammarExhausted(
    int location,
    String rule,
    String found,
    String expected) implements ParseError {
        @Override
        public String kind() {
            return "no matching alternative";
        }

        @Override
        public String message() {
            return "No alternative of " + rule + " matches " + found + " at " + location + ", expected " + expected;
        }
    }

    /**
     * A complete expression matched, but input remains after it.
     */
    record IncompleteConsumption(
    int location,
    String found) implements ParseError {
        @Override
        public String kind() {
            return "trailing input";
        }

        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected end of input";
        }
    }

    /**
     * Tree capacity violated while building the derivation.
     */
    record CapacityExceeded(
    int location,
    String reason) implements ParseError {
        @Override
        public String kind() {
            return "capacity exceeded";
        }

        @Override
        public String message() {
            return reason + " at " + location;
        }
    }
}
