package org.pragmatica.regex.grammar;

import org.pragmatica.regex.error.GrammarException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered-choice grammar: a list of rules and the rule parsing starts from.
 */
public record Grammar(List<Rule> rules, String startRule) {

    public Grammar {
        rules = List.copyOf(rules);
    }

    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name()
                                  .equals(name))
                    .findFirst();
    }

    /**
     * Build a lookup map for efficient rule access.
     */
    public Map<String, Rule> ruleMap() {
        return rules.stream()
                    .collect(Collectors.toMap(Rule::name, r -> r, (first, second) -> first));
    }

    /**
     * The start rule. Valid grammars always have one.
     */
    public Rule effectiveStartRule() {
        return rule(startRule).orElseThrow(() -> new GrammarException("Undefined start rule: '" + startRule + "'"));
    }

    /**
     * Check that the grammar can be built into trees with the given bounds: every
     * reference resolves, rule names fit into a node label, and no alternative has more
     * symbols than a node can hold children.
     *
     * @return this grammar
     * @throws GrammarException describing the first problem found
     */
    public Grammar validate(int maxLabelLength, int maxChildren) {
        if (rules.isEmpty()) {
            throw new GrammarException("Grammar has no rules");
        }
        var ruleNames = new HashSet<String>();
        for (var rule : rules) {
            if (!ruleNames.add(rule.name())) {
                throw new GrammarException("Duplicate rule: '" + rule.name() + "'");
            }
        }
        effectiveStartRule();
        for (var rule : rules) {
            validateRule(rule, ruleNames, maxLabelLength, maxChildren);
        }
        return this;
    }

    private static void validateRule(Rule rule, Set<String> ruleNames, int maxLabelLength, int maxChildren) {
        if (rule.name().length() > maxLabelLength) {
            throw new GrammarException("Rule name '" + rule.name() + "' is longer than " + maxLabelLength + " characters");
        }
        if (rule.alternatives().isEmpty()) {
            throw new GrammarException("Rule '" + rule.name() + "' has no alternatives");
        }
        for (var alternative : rule.alternatives()) {
            if (alternative.symbols().isEmpty()) {
                throw new GrammarException("Rule '" + rule.name() + "' has an empty alternative");
            }
            if (alternative.arity() > maxChildren) {
                throw new GrammarException("Alternative '" + alternative + "' of rule '" + rule.name()
                                           + "' has " + alternative.arity() + " symbols, at most "
                                           + maxChildren + " allowed");
            }
            for (var symbol : alternative.symbols()) {
                if (symbol instanceof Symbol.Reference ref && !ruleNames.contains(ref.ruleName())) {
                    throw new GrammarException("Undefined rule reference: '" + ref.ruleName() + "'");
                }
            }
        }
    }

    @Override
    public String toString() {
        return rules.stream()
                    .map(r -> r.name() + " <- " + r.alternatives()
                                                   .stream()
                                                   .map(Alternative::toString)
                                                   .collect(Collectors.joining(" / ")))
                    .collect(Collectors.joining("\n"));
    }
}
