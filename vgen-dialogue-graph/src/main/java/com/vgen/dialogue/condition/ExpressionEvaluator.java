package com.vgen.dialogue.condition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Evaluates routing conditions such as {@code user.streak >= 3 && user.name != 'Bob'} against a
 * variable mapping.
 * <p>
 * Precedence, lowest first: {@code ||}, {@code &&}, one comparison ({@code >= <= != == > <}), bare
 * truthiness. Operators inside single or double quotes are ignored. Operands are looked up in the
 * variables (flat key first, then nested maps by dotted segments); when absent they are literals.
 * An unquoted identifier that is not a variable evaluates to {@code null} on the left side of a
 * comparison and in a bare expression, and to its own text on the right side.
 * <p>
 * Evaluation never throws: blank or malformed expressions are {@code false}.
 */
public final class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private static final String[] COMPARISON_OPERATORS = {">=", "<=", "!=", "==", ">", "<"};
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Object MISSING = new Object();

    private ExpressionEvaluator() {
    }

    public static boolean evaluate(String expression, Map<String, ?> values) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        Map<String, ?> vars = values != null ? values : Map.of();
        try {
            boolean result = evaluateOr(expression.trim(), vars);
            log.debug("Condition '{}' -> {}", expression, result);
            return result;
        } catch (RuntimeException e) {
            log.debug("Condition '{}' could not be evaluated; treating as false", expression, e);
            return false;
        }
    }

    private static boolean evaluateOr(String expression, Map<String, ?> vars) {
        for (String part : splitOutsideQuotes(expression, "||")) {
            if (evaluateAnd(part.trim(), vars)) {
                return true;
            }
        }
        return false;
    }

    private static boolean evaluateAnd(String expression, Map<String, ?> vars) {
        for (String part : splitOutsideQuotes(expression, "&&")) {
            if (!evaluateComparison(part.trim(), vars)) {
                return false;
            }
        }
        return true;
    }

    private static boolean evaluateComparison(String expression, Map<String, ?> vars) {
        for (String op : COMPARISON_OPERATORS) {
            int at = indexOutsideQuotes(expression, op);
            if (at < 0) {
                continue;
            }
            Object left = leftOperand(expression.substring(0, at).trim(), vars);
            Object right = rightOperand(expression.substring(at + op.length()).trim(), vars);
            switch (op) {
                case "==":
                    return looselyEquals(left, right);
                case "!=":
                    return !looselyEquals(left, right);
                default:
                    return compareNumbers(left, right, op);
            }
        }
        return isTruthy(leftOperand(expression, vars));
    }

    private static Object leftOperand(String token, Map<String, ?> vars) {
        Object found = lookup(token, vars);
        if (found != MISSING) {
            return found;
        }
        if (isQuoted(token) || NUMBER.matcher(token).matches()
                || "true".equals(token) || "false".equals(token) || "null".equals(token)) {
            return literal(token);
        }
        return null;
    }

    private static Object rightOperand(String token, Map<String, ?> vars) {
        Object found = lookup(token, vars);
        return found != MISSING ? found : literal(token);
    }

    /** Flat key first, then nested maps segment by segment; {@link #MISSING} when absent. */
    private static Object lookup(String key, Map<String, ?> vars) {
        if (key.isEmpty() || isQuoted(key)) {
            return MISSING;
        }
        if (vars.containsKey(key)) {
            return vars.get(key);
        }
        if (!key.contains(".")) {
            return MISSING;
        }
        Object current = vars;
        for (String segment : key.split("\\.")) {
            if (!(current instanceof Map)) {
                return MISSING;
            }
            Map<?, ?> map = (Map<?, ?>) current;
            if (!map.containsKey(segment)) {
                return MISSING;
            }
            current = map.get(segment);
        }
        return current;
    }

    static Object literal(String token) {
        String t = token.trim();
        if ("null".equals(t)) return null;
        if ("true".equals(t)) return Boolean.TRUE;
        if ("false".equals(t)) return Boolean.FALSE;
        if (isQuoted(t)) return t.substring(1, t.length() - 1);
        if (INTEGER.matcher(t).matches()) {
            try {
                return Long.parseLong(t);
            } catch (NumberFormatException e) {
                return Double.parseDouble(t);
            }
        }
        if (NUMBER.matcher(t).matches()) return Double.parseDouble(t);
        return t;
    }

    static boolean looselyEquals(Object left, Object right) {
        if (Objects.equals(left, right)) return true;
        Double l = toNumber(left);
        Double r = toNumber(right);
        if (l != null && r != null) {
            return l.doubleValue() == r.doubleValue();
        }
        if (left != null && right != null) {
            return left.toString().equals(right.toString());
        }
        return false;
    }

    private static boolean compareNumbers(Object left, Object right, String op) {
        Double l = toNumber(left);
        Double r = toNumber(right);
        if (l == null || r == null) {
            return false;
        }
        switch (op) {
            case ">":
                return l > r;
            case "<":
                return l < r;
            case ">=":
                return l >= r;
            case "<=":
                return l <= r;
            default:
                return false;
        }
    }

    private static Double toNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && NUMBER.matcher(((String) value).trim()).matches()) {
            return Double.parseDouble(((String) value).trim());
        }
        return null;
    }

    /** null, false, 0, the empty string and empty collections or maps are falsy. */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number) return ((Number) value).doubleValue() != 0;
        if (value instanceof CharSequence) return ((CharSequence) value).length() > 0;
        if (value instanceof Collection) return !((Collection<?>) value).isEmpty();
        if (value instanceof Map) return !((Map<?, ?>) value).isEmpty();
        return true;
    }

    private static boolean isQuoted(String s) {
        return s.length() >= 2
                && ((s.startsWith("'") && s.endsWith("'")) || (s.startsWith("\"") && s.endsWith("\"")));
    }

    private static int indexOutsideQuotes(String text, String op) {
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i <= text.length() - op.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            }
            if (!inSingle && !inDouble && text.startsWith(op, i)) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> splitOutsideQuotes(String text, String op) {
        List<String> parts = new ArrayList<>();
        boolean inSingle = false;
        boolean inDouble = false;
        int last = 0;
        for (int i = 0; i <= text.length() - op.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            }
            if (!inSingle && !inDouble && text.startsWith(op, i)) {
                parts.add(text.substring(last, i));
                last = i + op.length();
                i += op.length() - 1;
            }
        }
        parts.add(text.substring(last));
        return parts;
    }
}
