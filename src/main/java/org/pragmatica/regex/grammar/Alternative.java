package org.pragmatica.regex.grammar;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One candidate right-hand side of a rule: symbols matched in sequence.
 */
public record Alternative(List<Symbol> symbols) {

    public Alternative {
        symbols = List.copyOf(symbols);
    }

    public static Alternative of(Symbol... symbols) {
        return new Alternative(List.of(symbols));
    }

    public int arity() {
        return symbols.size();
    }

    @Override
    public String toString() {
        return symbols.stream()
                      .map(Symbol::name)
                      .collect(Collectors.joining(" "));
    }
}
