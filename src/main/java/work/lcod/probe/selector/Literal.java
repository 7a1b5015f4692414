package work.lcod.probe.selector;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Constant written after {@code =} in a selector. Numbers compare numerically, everything else by string form.
 */
public record Literal(Object value) {
    public Literal {
        Objects.requireNonNull(value, "value");
    }

    /**
     * Interprets a bare selector word: integers and decimals become numbers,
     * {@code true}/{@code false} become booleans, anything else stays a string.
     */
    static Literal fromWord(String word) {
        if ("true".equals(word) || "false".equals(word)) {
            return new Literal(Boolean.valueOf(word));
        }
        if (word.matches("-?\\d+")) {
            try {
                return new Literal(Long.valueOf(word));
            } catch (NumberFormatException ex) {
                return new Literal(new BigDecimal(word));
            }
        }
        if (word.matches("-?\\d+\\.\\d+")) {
            return new Literal(new BigDecimal(word));
        }
        return new Literal(word);
    }

    public boolean matches(Object actual) {
        if (actual == null) {
            return false;
        }
        if (value instanceof Number expected && actual instanceof Number number) {
            return numericEquals(expected, number);
        }
        if (value instanceof Boolean expected && actual instanceof Boolean bool) {
            return expected.equals(bool);
        }
        return String.valueOf(value).equals(String.valueOf(actual));
    }

    private static boolean numericEquals(Number expected, Number actual) {
        if (!isFinite(expected) || !isFinite(actual)) {
            return Double.compare(expected.doubleValue(), actual.doubleValue()) == 0;
        }
        try {
            return toDecimal(expected).compareTo(toDecimal(actual)) == 0;
        } catch (NumberFormatException ex) {
            // Number types whose string form is not a decimal
            return Double.compare(expected.doubleValue(), actual.doubleValue()) == 0;
        }
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }

    String render() {
        if (value instanceof String text) {
            if (text.matches("[A-Za-z_][A-Za-z0-9_]*") && !"true".equals(text) && !"false".equals(text) && !"as".equals(text)) {
                return text;
            }
            return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(value);
    }
}
