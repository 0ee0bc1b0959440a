package org.pragmatica.regex.grammar;

import java.util.List;

import static org.pragmatica.regex.grammar.Symbol.ref;
import static org.pragmatica.regex.grammar.Symbol.terminal;
import static org.pragmatica.regex.grammar.TokenKind.EMPTY_MARKER;
import static org.pragmatica.regex.grammar.TokenKind.LEFT_PAREN;
import static org.pragmatica.regex.grammar.TokenKind.PLUS;
import static org.pragmatica.regex.grammar.TokenKind.RIGHT_PAREN;
import static org.pragmatica.regex.grammar.TokenKind.STAR;
import static org.pragmatica.regex.grammar.TokenKind.SYMBOL;

/**
 * The regular expression grammar after left-recursion removal.
 *
 * <pre>
 * RE  ::= # | symbol | RE + RE | RE RE | RE * | ( RE )
 * </pre>
 * becomes
 * <pre>
 * RE  &lt;- # RE' / symbol RE' / ( RE ) RE' / ( RE ) / # / symbol
 * RE' &lt;- + RE RE' / + RE / * RE' / RE RE' / RE / *
 * </pre>
 *
 * <p>The grammar is ambiguous. The alternative order is the disambiguation policy:
 * longer continuations are preferred, and parsing commits to the first alternative
 * that succeeds. Do not reorder.
 */
public final class RegexGrammar {
    public static final String RE = "RE";
    public static final String RE_PRIME = "RE'";

    private static final Grammar STANDARD = new Grammar(
        List.of(
            Rule.of(RE,
                    Alternative.of(terminal(EMPTY_MARKER), ref(RE_PRIME)),
                    Alternative.of(terminal(SYMBOL), ref(RE_PRIME)),
                    Alternative.of(terminal(LEFT_PAREN), ref(RE), terminal(RIGHT_PAREN), ref(RE_PRIME)),
                    Alternative.of(terminal(LEFT_PAREN), ref(RE), terminal(RIGHT_PAREN)),
                    Alternative.of(terminal(EMPTY_MARKER)),
                    Alternative.of(terminal(SYMBOL))),
            Rule.of(RE_PRIME,
                    Alternative.of(terminal(PLUS), ref(RE), ref(RE_PRIME)),
                    Alternative.of(terminal(PLUS), ref(RE)),
                    Alternative.of(terminal(STAR), ref(RE_PRIME)),
                    Alternative.of(ref(RE), ref(RE_PRIME)),
                    Alternative.of(ref(RE)),
                    Alternative.of(terminal(STAR)))),
        RE);

    private RegexGrammar() {}

    public static Grammar standard() {
        return STANDARD;
    }
}
