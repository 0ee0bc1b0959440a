package org.pragmatica.regex.grammar;

import java.util.List;

/**
 * A grammar rule: Name &lt;- A1 / A2 / ... with ordered-choice semantics.
 * Alternatives are tried in list order and the first one that succeeds wins.
 */
public record Rule(String name, List<Alternative> alternatives) {

    public Rule {
        alternatives = List.copyOf(alternatives);
    }

    public static Rule of(String name, Alternative... alternatives) {
        return new Rule(name, List.of(alternatives));
    }
}
