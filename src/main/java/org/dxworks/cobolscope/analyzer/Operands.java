package org.dxworks.cobolscope.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers for statement operands: literal detection, data-name normalization and token splitting of
 * condition / expression text.
 */
public final class Operands {

    private static final Set<String> FIGURATIVE_CONSTANTS = Set.of(
            "ZERO", "ZEROS", "ZEROES", "SPACE", "SPACES", "HIGH-VALUE", "HIGH-VALUES",
            "LOW-VALUE", "LOW-VALUES", "QUOTE", "QUOTES", "NULL", "NULLS", "ALL", "TRUE", "FALSE");

    private static final Set<String> CONDITION_WORDS = Set.of(
            "AND", "OR", "NOT", "IS", "EQUAL", "EQUALS", "TO", "GREATER", "LESS", "THAN", "OR-EQUAL",
            "NUMERIC", "ALPHABETIC", "POSITIVE", "NEGATIVE", "FUNCTION", "OF", "IN");

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final Pattern TOKEN = Pattern.compile(
            "'[^']*'|\"[^\"]*\"|[A-Za-z0-9][A-Za-z0-9-]*[A-Za-z0-9]|[A-Za-z0-9]|\\*\\*|>=|<=|<>|[-+*/=<>()]");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9-]*");

    private Operands() {
    }

    public static boolean isLiteral(String operand) {
        String text = operand.trim();
        if (text.isEmpty()) {
            return true;
        }
        char first = text.charAt(0);
        if (first == '\'' || first == '"') {
            return true;
        }
        if (NUMERIC.matcher(text).matches()) {
            return true;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        return FIGURATIVE_CONSTANTS.contains(upper) || upper.startsWith("ALL ");
    }

    /** Quoted literal without its quotes, or {@code null} when the operand is not a quoted literal. */
    public static String unquote(String operand) {
        String text = operand.trim();
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return text.substring(1, text.length() - 1).trim();
            }
        }
        return null;
    }

    /** Data name without subscripts, reference modification or qualification. */
    public static String dataName(String operand) {
        String text = operand.trim();
        int paren = text.indexOf('(');
        if (paren >= 0) {
            text = text.substring(0, paren);
        }
        String[] words = text.trim().split("\\s+");
        return words[0];
    }

    /** Data names referenced by a condition or arithmetic expression, in order of appearance. */
    public static List<String> identifiers(String text) {
        List<String> out = new ArrayList<>();
        for (String token : tokens(text)) {
            if (IDENTIFIER.matcher(token).matches() && !isLiteral(token)
                    && !CONDITION_WORDS.contains(token.toUpperCase(Locale.ROOT))) {
                out.add(token);
            }
        }
        return out;
    }

    /** Lexical tokens of a condition or expression: literals, words and operator symbols. */
    public static List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            out.add(matcher.group());
        }
        return out;
    }

    public static boolean isOperatorSymbol(String token) {
        return !token.isEmpty() && !Character.isLetterOrDigit(token.charAt(0))
                && token.charAt(0) != '\'' && token.charAt(0) != '"';
    }

    public static boolean isConditionWord(String token) {
        return CONDITION_WORDS.contains(token.toUpperCase(Locale.ROOT));
    }
}
