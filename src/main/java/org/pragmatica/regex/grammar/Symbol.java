package org.pragmatica.regex.grammar;

import java.util.Locale;

/**
 * Element of an alternative: a terminal class or a reference to a rule.
 */
public sealed interface Symbol {

    String name();

    record Terminal(TokenKind kind) implements Symbol {
        @Override
        public String name() {
            return kind.name()
                       .toLowerCase(Locale.ROOT);
        }
    }

    record Reference(String ruleName) implements Symbol {
        @Override
        public String name() {
            return ruleName;
        }
    }

    static Symbol terminal(TokenKind kind) {
        return new Terminal(kind);
    }

    static Symbol ref(String ruleName) {
        return new Reference(ruleName);
    }
}
