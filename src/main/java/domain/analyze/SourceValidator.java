package domain.analyze;

import domain.model.BracketException;
import domain.token.TokenType;

import java.util.List;

/**
 * Structural checks around lexing: block comment markers before, bracket balance after.
 */
final class SourceValidator {

    private SourceValidator() {
    }

    /**
     * Rejects a stray {@code *}{@code /} or an unterminated {@code /*}. Strings, quoted names,
     * line comments and template tags are skipped; block comments do not nest.
     */
    static void validateCommentMarkers(String source) {
        if (source == null) return;
        int len = source.length();
        int i = 0;
        boolean inComment = false;
        while (i < len) {
            char c = source.charAt(i);
            char next = (i + 1 < len) ? source.charAt(i + 1) : '\0';
            if (inComment) {
                if (c == '*' && next == '/') {
                    inComment = false;
                    i += 2;
                } else {
                    i++;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                i = skipQuoted(source, i);
                continue;
            }
            if (c == '-' && next == '-') {
                while (i < len && source.charAt(i) != '\n') i++;
                continue;
            }
            if (c == '{' && (next == '{' || next == '%' || next == '#')) {
                i = skipTemplateTag(source, i);
                continue;
            }
            if (c == '/' && next == '*') {
                inComment = true;
                i += 2;
                continue;
            }
            if (c == '*' && next == '/') {
                throw BracketException.strayCommentClose();
            }
            i++;
        }
        if (inComment) {
            throw BracketException.unterminatedComment();
        }
    }

    /** Rejects a closing bracket (or {@code end}) when nothing is open. */
    static void validateBrackets(List<Node> nodes) {
        int depth = 0;
        for (Node node : nodes) {
            TokenType type = node.getType();
            if (type == TokenType.BRACKET_OPEN || type == TokenType.STATEMENT_START) {
                depth++;
            } else if (type == TokenType.BRACKET_CLOSE || type == TokenType.STATEMENT_END) {
                depth--;
                if (depth < 0) {
                    throw BracketException.unmatchedClose(node.getToken().getText());
                }
            }
        }
    }

    private static int skipQuoted(String s, int start) {
        char quote = s.charAt(start);
        int i = start + 1;
        while (i < s.length() && s.charAt(i) != quote) {
            if (s.charAt(i) == '\\') i++;
            i++;
        }
        return i + 1;
    }

    private static int skipTemplateTag(String s, int start) {
        char open = s.charAt(start + 1);
        char close = (open == '{') ? '}' : open;
        int len = s.length();
        int depth = 1;
        int i = start + 2;
        while (i + 1 < len && depth > 0) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(s, i);
                continue;
            }
            if (c == '{' && s.charAt(i + 1) == open) {
                depth++;
                i += 2;
            } else if (c == close && s.charAt(i + 1) == '}') {
                depth--;
                i += 2;
            } else {
                i++;
            }
        }
        return depth > 0 ? len : i;
    }
}
