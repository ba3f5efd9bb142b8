package domain.safety;

import domain.analyze.Node;
import domain.config.Dialect;
import domain.model.EquivalenceException;
import domain.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Re-lexes formatted output and compares it token by token with the source.
 *
 * <p>Kinds must match exactly. Text is compared lower-cased with whitespace collapsed; template
 * tags are further reduced to their payload with quote style, operator spacing and bracket
 * spacing normalized, so a reflowed tag still matches its one-line original.</p>
 */
public final class EquivalenceChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(EquivalenceChecker.class);

    private final Dialect dialect;
    private final int lineLength;

    public EquivalenceChecker(Dialect dialect, int lineLength) {
        this.dialect = dialect;
        this.lineLength = lineLength;
    }

    /**
     * @throws EquivalenceException on the first token that differs
     */
    public void check(String original, String formatted) {
        if (original.equals(formatted)) return;
        if (original.equalsIgnoreCase(formatted)) return;

        List<Node> before = significantNodes(original);
        List<Node> after = significantNodes(formatted);
        if (before.size() != after.size()) {
            throw EquivalenceException.countMismatch(before.size(), after.size());
        }
        for (int i = 0; i < before.size(); i++) {
            Node a = before.get(i);
            Node b = after.get(i);
            String textA = a.getToken().getText();
            String textB = b.getToken().getText();
            if (a.getType() != b.getType()) {
                throw EquivalenceException.typeMismatch(i, a.getType().name(), textA, b.getType().name(), textB);
            }
            if (!normalize(textA, a.getType()).equals(normalize(textB, b.getType()))) {
                throw EquivalenceException.textMismatch(i, textA, textB);
            }
        }
        LOGGER.debug("equivalence check passed for {} tokens", before.size());
    }

    private List<Node> significantNodes(String source) {
        List<Node> out = new ArrayList<>();
        for (Node node : dialect.newAnalyzer(lineLength).parseQuery(source).lineNodes()) {
            if (!node.isNewline()) out.add(node);
        }
        return out;
    }

    static String normalize(String text, TokenType type) {
        String lower = text.toLowerCase(Locale.ROOT);
        switch (type) {
            case JINJA_EXPRESSION:
                return "{{ " + normalizePayload(stripDelimiters(lower, "{{", "}}")) + " }}";
            case JINJA_STATEMENT:
            case JINJA_BLOCK_START:
            case JINJA_BLOCK_END:
            case JINJA_BLOCK_KEYWORD:
                return "{% " + normalizePayload(stripDelimiters(lower, "{%", "%}")) + " %}";
            default:
                return collapse(lower);
        }
    }

    private static String stripDelimiters(String text, String open, String close) {
        String s = text.trim();
        if (s.startsWith(open + "-")) {
            s = s.substring(open.length() + 1);
        } else if (s.startsWith(open)) {
            s = s.substring(open.length());
        }
        if (s.endsWith("-" + close)) {
            s = s.substring(0, s.length() - close.length() - 1);
        } else if (s.endsWith(close)) {
            s = s.substring(0, s.length() - close.length());
        }
        return s;
    }

    private static String normalizePayload(String inner) {
        String s = collapse(inner).replace('\'', '"');
        s = normalizeOperators(s);
        return normalizeStructure(s);
    }

    static String collapse(String s) {
        String t = s.trim();
        return t.isEmpty() ? "" : String.join(" ", t.split("\\s+"));
    }

    /** {@code + ~ |} and a lone {@code =} get exactly one space on each side. */
    static String normalizeOperators(String s) {
        StringBuilder out = new StringBuilder(s.length() + 16);
        int i = 0;
        int len = s.length();
        while (i < len) {
            char c = s.charAt(i);
            if (c == '"') {
                i = copyString(s, i, out);
                continue;
            }
            char next = (i + 1 < len) ? s.charAt(i + 1) : '\0';
            char prev = (i > 0) ? s.charAt(i - 1) : '\0';
            boolean loneEquals = c == '=' && next != '=' && prev != '=' && prev != '!' && prev != '>' && prev != '<';
            boolean pipe = c == '|' && next != '|' && prev != '|';
            if (c == '+' || c == '~' || loneEquals || pipe) {
                trimEnd(out);
                out.append(' ').append(c).append(' ');
                i++;
                while (i < len && s.charAt(i) == ' ') i++;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /** No space inside brackets or after commas, no trailing comma, no space before a call's {@code (}. */
    static String normalizeStructure(String s) {
        StringBuilder out = new StringBuilder(s.length());
        int i = 0;
        int len = s.length();
        while (i < len) {
            char c = s.charAt(i);
            if (c == '"') {
                i = copyString(s, i, out);
                continue;
            }
            if (c == '(' || c == '[' || c == ',') {
                if (c == '(') {
                    int end = trimmedLength(out);
                    if (end > 0) {
                        char last = out.charAt(end - 1);
                        if (Character.isLetterOrDigit(last) || last == '_' || last == '.') out.setLength(end);
                    }
                }
                out.append(c);
                i++;
                while (i < len && s.charAt(i) == ' ') i++;
                continue;
            }
            if (c == ')' || c == ']') {
                trimEnd(out);
                if (out.length() > 0 && out.charAt(out.length() - 1) == ',') {
                    out.setLength(out.length() - 1);
                }
                out.append(c);
                i++;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static int copyString(String s, int open, StringBuilder out) {
        char quote = s.charAt(open);
        int i = open + 1;
        while (i < s.length() && s.charAt(i) != quote) {
            if (s.charAt(i) == '\\') i++;
            i++;
        }
        int end = Math.min(i + 1, s.length());
        out.append(s, open, end);
        return end;
    }

    private static int trimmedLength(StringBuilder sb) {
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == ' ') end--;
        return end;
    }

    private static void trimEnd(StringBuilder sb) {
        sb.setLength(trimmedLength(sb));
    }
}
