package domain.format;

import domain.analyze.Line;
import domain.analyze.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes template tags in place and reflows the ones that do not fit.
 *
 * <p>Normalization collapses whitespace, prefers double quotes, and spaces operators and commas
 * the same way every time. Reflow writes a call as {@code name(} with one argument per line, a
 * list as one item per line, and anything else as the payload on its own indented line. Tags
 * holding a brace or a triple-quoted string are never touched.</p>
 */
public final class JinjaFormatter {

    private static final int INDENT = 4;
    private static final int SHORT_ARGUMENT = 40;

    private final int maxLength;

    public JinjaFormatter(int maxLength) {
        this.maxLength = maxLength;
    }

    public void formatLine(Line line) {
        int baseIndent = line.depth().indentSize();
        for (Node node : line.getNodes()) {
            String normalized = null;
            switch (node.getType()) {
                case JINJA_EXPRESSION:
                    normalized = normalizeTag(node.getValue(), "{{", "}}", false);
                    break;
                case JINJA_STATEMENT:
                case JINJA_BLOCK_START:
                case JINJA_BLOCK_END:
                case JINJA_BLOCK_KEYWORD:
                    normalized = normalizeTag(node.getValue(), "{%", "%}", true);
                    break;
                default:
                    break;
            }
            if (normalized != null) node.setValue(normalized);
        }

        for (Node node : line.getNodes()) {
            if (!node.isJinja()) continue;
            String value = node.getValue();
            boolean fits = baseIndent + value.length() <= maxLength;
            if ((fits && !hasMagicTrailingComma(value)) || value.indexOf('\n') >= 0) continue;
            String reflowed = node.getType() == domain.token.TokenType.JINJA_EXPRESSION
                    ? reflowExpression(value, baseIndent)
                    : reflowStatement(value, baseIndent);
            if (reflowed != null) node.setValue(reflowed);
        }
    }

    // ---- normalization ----

    private static final class Tag {
        final String open;
        final String inner;
        final String close;

        Tag(String open, String inner, String close) {
            this.open = open;
            this.inner = inner;
            this.close = close;
        }
    }

    /** Splits {@code {{- x -}}} style text into delimiters (with trim markers) and payload. */
    private static Tag parseTag(String value, String open, String close) {
        String trimmed = value.trim();
        if (!trimmed.startsWith(open) || !trimmed.endsWith(close) || trimmed.length() < open.length() + close.length()) {
            return null;
        }
        String inner = trimmed.substring(open.length(), trimmed.length() - close.length()).trim();
        String o = open;
        String c = close;
        if (inner.startsWith("-")) {
            o = open + "-";
            inner = inner.substring(1).trim();
        }
        if (inner.endsWith("-")) {
            c = "-" + close;
            inner = inner.substring(0, inner.length() - 1).trim();
        }
        return new Tag(o, inner, c);
    }

    String normalizeTag(String value, String open, String close, boolean statement) {
        Tag tag = parseTag(value, open, close);
        if (tag == null || hasComplexStructure(tag.inner)) return null;
        if (tag.inner.isEmpty()) return tag.open + " " + tag.close;

        if (statement && tag.inner.indexOf('\n') >= 0
                && findTopLevelParen(tag.inner) < 0 && findTopLevelBracket(tag.inner) < 0) {
            StringBuilder sb = new StringBuilder(tag.open).append('\n');
            for (String row : tag.inner.split("\n")) {
                String r = row.trim();
                if (!r.isEmpty()) sb.append(spaces(INDENT)).append(r).append('\n');
            }
            return sb.append(tag.close).toString();
        }
        return tag.open + " " + normalizeChain(tag.inner) + " " + tag.close;
    }

    static String normalizeChain(String inner) {
        String s = collapseWhitespace(inner);
        s = preferDoubleQuotes(s);
        s = spaceOperators(s);
        s = spaceCommas(s);
        return stripBracketSpaces(s);
    }

    static String collapseWhitespace(String content) {
        StringBuilder out = new StringBuilder(content.length());
        boolean inSpace = false;
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\'' || c == '"') {
                if (inSpace) {
                    out.append(' ');
                    inSpace = false;
                }
                i = copyString(content, i, out);
                continue;
            }
            if (Character.isWhitespace(c)) {
                inSpace = true;
                i++;
                continue;
            }
            if (inSpace) {
                out.append(' ');
                inSpace = false;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /** {@code 'x'} becomes {@code "x"} unless the literal itself contains a double quote. */
    static String preferDoubleQuotes(String content) {
        StringBuilder out = new StringBuilder(content.length());
        int i = 0;
        int len = content.length();
        while (i < len) {
            char c = content.charAt(i);
            if (c == '"') {
                if (content.startsWith("\"\"\"", i)) {
                    int end = content.indexOf("\"\"\"", i + 3);
                    int stop = (end < 0) ? len : end + 3;
                    out.append(content, i, stop);
                    i = stop;
                } else {
                    i = copyString(content, i, out);
                }
                continue;
            }
            if (c == '\'') {
                boolean triple = content.startsWith("'''", i);
                int quoteLen = triple ? 3 : 1;
                int end = triple ? content.indexOf("'''", i + 3) : closingQuote(content, i);
                if (end < 0) {
                    out.append(content, i, len);
                    break;
                }
                String body = content.substring(i + quoteLen, end);
                if (body.indexOf('"') >= 0) {
                    out.append(content, i, end + quoteLen);
                } else {
                    String q = triple ? "\"\"\"" : "\"";
                    out.append(q).append(body).append(q);
                }
                i = end + quoteLen;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static int closingQuote(String s, int open) {
        char quote = s.charAt(open);
        int i = open + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i;
            i++;
        }
        return -1;
    }

    /**
     * One space around {@code + ~ |} and comparison operators, and around {@code =} outside
     * call parentheses (keyword arguments stay tight).
     */
    static String spaceOperators(String content) {
        StringBuilder out = new StringBuilder(content.length() + 16);
        int depth = 0;
        int i = 0;
        int len = content.length();
        while (i < len) {
            char c = content.charAt(i);
            if (c == '\'' || c == '"') {
                i = copyString(content, i, out);
                continue;
            }
            if (c == '(' || c == '[') {
                depth++;
                out.append(c);
                i++;
                continue;
            }
            if (c == ')' || c == ']') {
                depth--;
                out.append(c);
                i++;
                continue;
            }
            char next = (i + 1 < len) ? content.charAt(i + 1) : '\0';
            if (next == '=' && (c == '=' || c == '!' || c == '>' || c == '<')) {
                trimEnd(out);
                if (out.length() > 0) out.append(' ');
                out.append(c).append('=');
                i = skipSpaces(content, i + 2);
                if (i < len && content.charAt(i) != ')' && content.charAt(i) != ']') out.append(' ');
                continue;
            }
            boolean operator;
            switch (c) {
                case '+':
                    operator = next != '=';
                    break;
                case '|':
                    operator = next != '|';
                    break;
                case '~':
                    operator = true;
                    break;
                case '=':
                    operator = depth == 0 && next != '=';
                    break;
                default:
                    operator = false;
                    break;
            }
            if (operator) {
                trimEnd(out);
                if (out.length() > 0) {
                    char last = out.charAt(out.length() - 1);
                    if (last != '(' && last != '[') out.append(' ');
                }
                out.append(c);
                i = skipSpaces(content, i + 1);
                if (i < len && content.charAt(i) != ')' && content.charAt(i) != ']') out.append(' ');
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    static String spaceCommas(String content) {
        StringBuilder out = new StringBuilder(content.length() + 16);
        int i = 0;
        int len = content.length();
        while (i < len) {
            char c = content.charAt(i);
            if (c == '\'' || c == '"') {
                i = copyString(content, i, out);
                continue;
            }
            if (c == ',') {
                out.append(',');
                i = skipSpaces(content, i + 1);
                if (i < len) {
                    char n = content.charAt(i);
                    if (n != ')' && n != ']' && n != '}') out.append(' ');
                }
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /** No space inside brackets, none between a callee and its {@code (}. */
    static String stripBracketSpaces(String content) {
        StringBuilder out = new StringBuilder(content.length());
        int i = 0;
        int len = content.length();
        while (i < len) {
            char c = content.charAt(i);
            if (c == '\'' || c == '"') {
                i = copyString(content, i, out);
                continue;
            }
            if (c == '(') {
                int end = trimmedLength(out);
                if (end > 0) {
                    char last = out.charAt(end - 1);
                    if (Character.isLetterOrDigit(last) || last == '_' || last == '.') out.setLength(end);
                }
                out.append('(');
                i = skipSpaces(content, i + 1);
                continue;
            }
            if (c == '[') {
                out.append('[');
                i = skipSpaces(content, i + 1);
                continue;
            }
            if (c == ')' || c == ']') {
                trimEnd(out);
                out.append(c);
                i++;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    // ---- reflow ----

    String reflowExpression(String value, int baseIndent) {
        Tag tag = parseTag(value, "{{", "}}");
        if (tag == null || hasComplexStructure(tag.inner)) return null;
        String inner = tag.inner;
        String indent1 = spaces(baseIndent + INDENT);
        String indent2 = spaces(baseIndent + 2 * INDENT);
        String closeIndent = spaces(baseIndent);

        int paren = findTopLevelParen(inner);
        if (paren >= 0 && inner.endsWith(")")) {
            String name = inner.substring(0, paren).trim();
            List<String> args = splitTopLevel(inner.substring(paren + 1, inner.length() - 1), ',');

            if (args.size() <= 1) {
                String single = args.isEmpty() ? "" : args.get(0).trim();
                if (single.startsWith("[") && single.endsWith("]")) {
                    List<String> items = splitTopLevel(single.substring(1, single.length() - 1), ',');
                    if (items.size() > 1) {
                        String indent3 = spaces(baseIndent + 3 * INDENT);
                        StringBuilder sb = new StringBuilder(tag.open).append('\n');
                        sb.append(indent1).append(name).append("(\n");
                        sb.append(indent2).append("[\n");
                        for (String item : items) {
                            String t = item.trim();
                            if (!t.isEmpty()) sb.append(indent3).append(t).append(",\n");
                        }
                        sb.append(indent2).append("]\n");
                        sb.append(indent1).append(")\n");
                        return sb.append(closeIndent).append(tag.close).toString();
                    }
                }
                if (single.length() < SHORT_ARGUMENT) return null;
            }

            StringBuilder sb = new StringBuilder(tag.open).append('\n');
            sb.append(indent1).append(name).append("(\n");
            List<String> kept = nonBlank(args);
            for (int i = 0; i < kept.size(); i++) {
                sb.append(indent2).append(kept.get(i));
                sb.append(kept.size() == 1 ? "\n" : ",\n");
            }
            sb.append(indent1).append(")\n");
            return sb.append(closeIndent).append(tag.close).toString();
        }
        return tag.open + "\n" + indent1 + inner + "\n" + closeIndent + tag.close;
    }

    String reflowStatement(String value, int baseIndent) {
        Tag tag = parseTag(value, "{%", "%}");
        if (tag == null || hasComplexStructure(tag.inner)) return null;
        String inner = tag.inner;
        String indent1 = spaces(baseIndent + INDENT);
        String closeIndent = spaces(baseIndent);

        int paren = findTopLevelParen(inner);
        int close = (paren >= 0) ? findMatchingParen(inner, paren) : -1;
        if (close > 0) {
            String before = inner.substring(0, paren);
            String argsText = inner.substring(paren + 1, close);
            String after = inner.substring(close + 1).trim();
            List<String> args = nonBlank(splitTopLevel(argsText, ','));
            boolean keepLastComma = args.size() > 1 && argsText.trim().endsWith(",");

            StringBuilder sb = new StringBuilder(tag.open).append(' ').append(before).append('(');
            for (int i = 0; i < args.size(); i++) {
                sb.append('\n').append(indent1).append(args.get(i));
                if (i < args.size() - 1 || keepLastComma) sb.append(',');
            }
            sb.append('\n').append(closeIndent).append(") ");
            if (!after.isEmpty()) sb.append(after).append(' ');
            return sb.append(tag.close).toString();
        }

        int bracket = findTopLevelBracket(inner);
        if (bracket >= 0 && inner.endsWith("]")) {
            String before = inner.substring(0, bracket);
            String listText = inner.substring(bracket + 1, inner.length() - 1);
            List<String> items = splitTopLevel(listText, ',');
            StringBuilder sb = new StringBuilder(tag.open).append(' ').append(before).append('[');
            if (items.size() <= 1) {
                List<String> parts = splitTopLevel(listText, '~');
                if (parts.size() <= 1) return null;
                for (int i = 0; i < parts.size(); i++) {
                    sb.append('\n').append(indent1);
                    if (i > 0) sb.append("~ ");
                    sb.append(parts.get(i).trim());
                }
            } else {
                for (String item : nonBlank(items)) {
                    sb.append('\n').append(indent1).append(item).append(',');
                }
            }
            return sb.append('\n').append(closeIndent).append("] ").append(tag.close).toString();
        }

        if (inner.length() + tag.open.length() + tag.close.length() + 4 > maxLength) {
            return tag.open + "\n" + indent1 + inner + "\n" + closeIndent + tag.close;
        }
        return null;
    }

    // ---- scanning helpers ----

    /** A comma directly before a closing bracket, outside strings. */
    static boolean hasMagicTrailingComma(String value) {
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(value, i);
                continue;
            }
            if (c == ',') {
                int j = skipWhitespace(value, i + 1);
                if (j < value.length() && (value.charAt(j) == ')' || value.charAt(j) == ']')) return true;
            }
            i++;
        }
        return false;
    }

    /** A brace or triple-quoted string outside string literals. */
    static boolean hasComplexStructure(String s) {
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') {
                if (i + 2 < s.length() && s.charAt(i + 1) == c && s.charAt(i + 2) == c) return true;
                i = skipString(s, i);
                continue;
            }
            if (c == '{' || c == '}') return true;
            i++;
        }
        return false;
    }

    /** First {@code (} at the top level whose contents are not blank, or -1. */
    static int findTopLevelParen(String s) {
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(s, i);
                continue;
            }
            if (c == '(') {
                int close = findMatchingParen(s, i);
                int end = (close < 0) ? s.length() : close;
                if (!s.substring(i + 1, end).trim().isEmpty()) return i;
                i = end + 1;
                continue;
            }
            i++;
        }
        return -1;
    }

    static int findTopLevelBracket(String s) {
        int depth = 0;
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(s, i);
                continue;
            }
            if (c == '(') depth++;
            if (c == ')') depth--;
            if (c == '[' && depth == 0) return i;
            i++;
        }
        return -1;
    }

    static int findMatchingParen(String s, int open) {
        int depth = 0;
        int i = open;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(s, i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
            i++;
        }
        return -1;
    }

    /** Splits on {@code separator} outside strings and brackets; a trailing empty part is dropped. */
    static List<String> splitTopLevel(String s, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(s, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        if (start < s.length() && !s.substring(start).trim().isEmpty()) {
            parts.add(s.substring(start));
        }
        return parts;
    }

    private static List<String> nonBlank(List<String> parts) {
        List<String> out = new ArrayList<>(parts.size());
        for (String p : parts) {
            String t = p.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    static int skipString(String s, int open) {
        char quote = s.charAt(open);
        int i = open + 1;
        while (i < s.length() && s.charAt(i) != quote) {
            if (s.charAt(i) == '\\') i++;
            i++;
        }
        return Math.min(i + 1, s.length());
    }

    private static int copyString(String s, int open, StringBuilder out) {
        int end = skipString(s, open);
        out.append(s, open, end);
        return end;
    }

    private static int skipSpaces(String s, int i) {
        while (i < s.length() && s.charAt(i) == ' ') i++;
        return i;
    }

    private static int skipWhitespace(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return i;
    }

    private static int trimmedLength(StringBuilder sb) {
        int end = sb.length();
        while (end > 0 && Character.isWhitespace(sb.charAt(end - 1))) end--;
        return end;
    }

    private static void trimEnd(StringBuilder sb) {
        sb.setLength(trimmedLength(sb));
    }

    private static String spaces(int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) sb.append(' ');
        return sb.toString();
    }
}
