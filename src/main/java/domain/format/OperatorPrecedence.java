package domain.format;

import domain.analyze.Node;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Binding strength of operators, tightest first. The merger glues runs of lines split at
 * looser operators only after everything tighter is merged.
 */
public enum OperatorPrecedence {
    DOUBLE_COLON,
    AS,
    SQUARE_BRACKETS,
    OTHER_TIGHT,
    EXPONENT,
    MULTIPLICATION,
    ADDITION,
    OTHER,
    MEMBERSHIP,
    COMPARATORS,
    PRESENCE,
    BOOL_NOT,
    BOOL_AND,
    BOOL_OR,
    ON;

    private static final List<OperatorPrecedence> TIERS = Collections.unmodifiableList(Arrays.asList(
            OTHER_TIGHT, MULTIPLICATION, OTHER, COMPARATORS, BOOL_NOT, BOOL_AND, ON));

    private static final Set<String> TIGHT_WORDS = set("over", "filter", "within group");

    private static final Set<String> PRESENCE_WORDS = set(
            "is", "is not", "isnull", "notnull", "is distinct from", "is not distinct from",
            "exists", "not exists");

    private static final Set<String> MEMBERSHIP_WORDS = set(
            "in", "not in", "global in", "global not in",
            "like", "not like", "like any", "like all", "not like any", "not like all",
            "ilike", "not ilike", "ilike any", "ilike all", "not ilike any", "not ilike all",
            "similar to", "not similar to", "regexp", "not regexp", "rlike", "not rlike",
            "between", "not between");

    private static final Set<String> COMPARATOR_SYMBOLS = set(
            "=", "==", "!=", "<>", "<", ">", "<=", ">=", "<=>", "~", "!~", "~*", "!~*",
            "@>", "<@", "@@", "<->", "!!", "&&", "?|", "?&", "-|-");

    /** Merge tiers, tightest first. */
    public static List<OperatorPrecedence> tiers() {
        return TIERS;
    }

    public static OperatorPrecedence of(Node node) {
        String value = node.getValue();
        switch (node.getType()) {
            case DOUBLE_COLON:
                return DOUBLE_COLON;
            case ON:
                return ON;
            case BOOLEAN_OPERATOR:
                if ("and".equals(value)) return BOOL_AND;
                if ("or".equals(value)) return BOOL_OR;
                if ("not".equals(value)) return BOOL_NOT;
                return OTHER;
            case WORD_OPERATOR:
                return ofWord(value);
            case OPERATOR:
                return ofSymbol(value);
            default:
                if (node.isBracketOperator()) return SQUARE_BRACKETS;
                if (node.isMultiplicationStar()) return MULTIPLICATION;
                return OTHER;
        }
    }

    private static OperatorPrecedence ofWord(String value) {
        if ("as".equals(value)) return AS;
        if (TIGHT_WORDS.contains(value)) return OTHER_TIGHT;
        if (PRESENCE_WORDS.contains(value)) return PRESENCE;
        if (MEMBERSHIP_WORDS.contains(value)) return MEMBERSHIP;
        return OTHER;
    }

    private static OperatorPrecedence ofSymbol(String value) {
        switch (value) {
            case "**":
                return EXPONENT;
            case "*":
            case "/":
            case "%":
            case "||":
                return MULTIPLICATION;
            case "+":
            case "-":
                return ADDITION;
            default:
                return COMPARATOR_SYMBOLS.contains(value) ? COMPARATORS : OTHER;
        }
    }

    /** Whether this binds at least as tightly as {@code other}. */
    public boolean isAtMost(OperatorPrecedence other) {
        return compareTo(other) <= 0;
    }

    private static Set<String> set(String... values) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(values)));
    }
}
