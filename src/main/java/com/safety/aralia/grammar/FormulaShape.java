package com.safety.aralia.grammar;

import com.safety.aralia.api.Operator;
import com.safety.aralia.exception.FaultTreeException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The supported gate formula shapes, declared in recognition priority order.
 *
 * <p>
 * Each shape pairs a pattern that must match the <b>entire</b> formula with an
 * extractor that turns the match into a {@link Formula}. There is no operator
 * precedence: a formula mixing two operators at one level matches no shape and
 * has to be split into named sub-gates.
 *
 * <pre>
 * OR           a | b | ...
 * XOR          a ^ b
 * AND          a &amp; b &amp; ...
 * ATLEAST      @(k, [a, b, c, ...])       2 &lt;= k &lt;= 9, k &lt; n
 * NOT          ~(a)
 * NULL         a
 * IMPLY        a =&gt; b
 * IFF          a &lt;=&gt; b
 * CARDINALITY  #(l, h, [a, b, c, ...])    l &lt;= h &lt;= n
 * </pre>
 *
 * Every argument may be complemented with {@code ~}.
 */
public enum FormulaShape {
    OR(Fragments.joined("\\|"), (m, text) -> new Formula(Operator.OR, split(text, "|"))),

    XOR(Fragments.pair("\\^"), (m, text) -> new Formula(Operator.XOR, split(text, "^"))),

    AND(Fragments.joined("&"), (m, text) -> new Formula(Operator.AND, split(text, "&"))),

    ATLEAST("@\\(\\s*([2-9])\\s*,\\s*" + Fragments.ARGS_LIST + "\\s*\\)\\s*", (m, text) -> {
        List<String> arguments = split(m.group(2), ",");
        int min = Integer.parseInt(m.group(1));
        if (min >= arguments.size())
            throw new FaultTreeException("Invalid k/n for the combination formula:\n" + text);
        return new Formula(Operator.ATLEAST, arguments, min, null);
    }),

    NOT("~\\(\\s*(" + NameValidator.LITERAL_SIGNATURE + ")\\s*\\)",
            (m, text) -> new Formula(Operator.NOT, List.of(m.group(1)))),

    NULL(NameValidator.LITERAL_SIGNATURE, (m, text) -> new Formula(Operator.NULL, List.of(text))),

    IMPLY(Fragments.pair("=>"), (m, text) -> new Formula(Operator.IMPLY, split(text, "=>"))),

    IFF(Fragments.pair("<=>"), (m, text) -> new Formula(Operator.IFF, split(text, "<=>"))),

    CARDINALITY("#\\(\\s*(\\d)\\s*,\\s*(\\d)\\s*,\\s*" + Fragments.ARGS_LIST + "\\s*\\)\\s*", (m, text) -> {
        List<String> arguments = split(m.group(3), ",");
        int min = Integer.parseInt(m.group(1));
        int max = Integer.parseInt(m.group(2));
        if (min > max || max > arguments.size())
            throw new FaultTreeException("Invalid l/h for the cardinality formula:\n" + text);
        return new Formula(Operator.CARDINALITY, arguments, min, max);
    });

    private final Pattern pattern;
    private final Extractor extractor;

    FormulaShape(String regex, Extractor extractor) {
        this.pattern = Pattern.compile(regex);
        this.extractor = extractor;
    }

    /** Returns true if this shape matches the whole (trimmed) formula text. */
    public boolean matches(String text) {
        return pattern.matcher(text).matches();
    }

    /**
     * Extracts the formula from text accepted by {@link #matches(String)}.
     *
     * @throws IllegalArgumentException if the text does not have this shape.
     * @throws FaultTreeException       on repeated arguments or invalid vote
     *                                  and cardinality bounds.
     */
    public Formula extract(String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.matches())
            throw new IllegalArgumentException("Formula does not have the " + name() + " shape: " + text);
        return extractor.extract(matcher, text);
    }

    /**
     * Splits an argument string on the operator separator and trims each token.
     *
     * @throws FaultTreeException if two tokens are textually identical.
     */
    static List<String> split(String arguments, String separator) {
        List<String> tokens = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String raw : arguments.strip().split(Pattern.quote(separator))) {
            String token = raw.strip();
            if (!seen.add(token))
                throw new FaultTreeException("Repeated arguments:\n" + arguments);
            tokens.add(token);
        }
        return tokens;
    }

    /** Turns a full match of one shape into a formula. */
    @FunctionalInterface
    interface Extractor {
        Formula extract(Matcher matcher, String text);
    }

    private static final class Fragments {
        private static final String L = NameValidator.LITERAL_SIGNATURE;

        // Bracketed list of three or more literals; capture group holds the list body.
        static final String ARGS_LIST = "\\[(\\s*" + L + "(?:\\s*,\\s*" + L + "\\s*){2,})\\]";

        static String joined(String separator) {
            return L + "(?:\\s*" + separator + "\\s*" + L + "\\s*)+";
        }

        static String pair(String separator) {
            return L + "\\s*" + separator + "\\s*" + L;
        }
    }
}
