package domain.lex;

/**
 * Forward-only cursor over SQL source used by the lexer.
 *
 * <p>Every {@code read*} method advances {@link #pos} past what it consumed. The
 * {@code try*} methods advance only on success.</p>
 */
final class SqlScan {
    final String s;
    int pos;

    SqlScan(String s, int pos) {
        this.s = (s == null) ? "" : s;
        this.pos = pos;
    }

    static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    static boolean isInlineSpace(char c) {
        return c != '\n' && isSpace(c);
    }

    static boolean isAsciiAlnum(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /** Identifier chars: ASCII letters, digits, underscore and anything non-ASCII. */
    static boolean isWordChar(char c) {
        return isAsciiAlnum(c) || c == '_' || c >= 0x80;
    }

    private static boolean isBoundaryChar(char c) {
        return isAsciiAlnum(c) || c == '_';
    }

    boolean hasNext() {
        return pos < s.length();
    }

    int remaining() {
        return s.length() - pos;
    }

    char peek() {
        return peek(0);
    }

    char peek(int ahead) {
        int i = pos + ahead;
        return (i >= 0 && i < s.length()) ? s.charAt(i) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    boolean startsWith(String lit) {
        return s.startsWith(lit, pos);
    }

    boolean startsWithIgnoreCase(String lit) {
        return s.regionMatches(true, pos, lit, 0, lit.length());
    }

    String textFrom(int start) {
        return s.substring(start, pos);
    }

    String readInlineSpaces() {
        int start = pos;
        while (pos < s.length() && isInlineSpace(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    void skipSpaces() {
        while (pos < s.length() && isSpace(s.charAt(pos))) pos++;
    }

    String readWord() {
        int start = pos;
        while (pos < s.length() && isWordChar(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    /** Case-insensitive keyword at the cursor, ending on a word boundary. Does not advance. */
    boolean peekWord(String kw) {
        int n = kw.length();
        if (pos + n > s.length()) return false;
        if (!s.regionMatches(true, pos, kw, 0, n)) return false;
        return pos + n >= s.length() || !isBoundaryChar(s.charAt(pos + n));
    }

    /**
     * Matches the words in order, each preceded by any whitespace (newlines included) and
     * followed by a word boundary.
     */
    boolean tryWords(String... words) {
        int save = pos;
        for (String w : words) {
            skipSpaces();
            if (!peekWord(w)) {
                pos = save;
                return false;
            }
            pos += w.length();
        }
        return true;
    }

    /** First matching sequence wins; the tables list longer sequences first. */
    boolean tryAnyWords(String[]... sequences) {
        for (String[] seq : sequences) {
            if (tryWords(seq)) return true;
        }
        return false;
    }

    boolean tryInlineWord(String kw) {
        int save = pos;
        readInlineSpaces();
        if (!peekWord(kw)) {
            pos = save;
            return false;
        }
        pos += kw.length();
        return true;
    }

    /** Single or double quoted string with backslash escapes; unterminated runs to the end. */
    void readString() {
        char quote = read();
        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (c == '\\' && pos + 1 < s.length()) {
                pos += 2;
                continue;
            }
            pos++;
            if (c == quote) return;
        }
    }

    /** Like {@link #readString()}, but a doubled quote ({@code 'it''s'}) stays inside the literal. */
    void readSqlString() {
        char quote = read();
        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (c == '\\' && pos + 1 < s.length()) {
                pos += 2;
                continue;
            }
            pos++;
            if (c == quote) {
                if (pos < s.length() && s.charAt(pos) == quote) {
                    pos++;
                    continue;
                }
                return;
            }
        }
    }

    void readTripleString() {
        char quote = s.charAt(pos);
        pos += 3;
        while (pos + 2 < s.length()) {
            if (s.charAt(pos) == quote && s.charAt(pos + 1) == quote && s.charAt(pos + 2) == quote) {
                pos += 3;
                return;
            }
            pos++;
        }
        pos = s.length();
    }

    boolean peekTripleQuote(char quote) {
        return peek() == quote && peek(1) == quote && peek(2) == quote;
    }

    /** Up to, not including, the next newline. */
    void readLineComment() {
        int nl = s.indexOf('\n', pos);
        pos = (nl < 0) ? s.length() : nl;
    }

    void readBlockComment() {
        int end = s.indexOf("*/", pos + 2);
        pos = (end < 0) ? s.length() : end + 2;
    }

    /** {@code $tag$ ... $tag$}; returns false without moving when the cursor is not on one. */
    boolean tryDollarString() {
        int tagEnd = pos + 1;
        while (tagEnd < s.length() && isBoundaryChar(s.charAt(tagEnd))) tagEnd++;
        if (tagEnd >= s.length() || s.charAt(tagEnd) != '$') return false;
        String tag = s.substring(pos, tagEnd + 1);
        int close = s.indexOf(tag, tagEnd + 1);
        pos = (close < 0) ? s.length() : close + tag.length();
        return true;
    }

    /**
     * Numeric literal: hex, binary and octal prefixes, digits with underscores, a fraction, an
     * exponent and the Spark type suffixes ({@code bd}, {@code d f l s k y}).
     */
    void readNumber() {
        if (peek() == '0') {
            char radix = Character.toLowerCase(peek(1));
            if (radix == 'x' || radix == 'b' || radix == 'o') {
                pos += 2;
                while (pos < s.length() && isRadixDigit(radix, s.charAt(pos))) pos++;
                return;
            }
        }
        readDigits();
        if (peek() == '.') {
            pos++;
            readDigits();
        }
        char e = peek();
        if (e == 'e' || e == 'E') {
            int j = pos + 1;
            if (j < s.length() && (s.charAt(j) == '+' || s.charAt(j) == '-')) j++;
            if (j < s.length() && isDigit(s.charAt(j))) {
                pos = j;
                readDigits();
            }
        }
        char c = Character.toLowerCase(peek());
        if (c == 'b' && Character.toLowerCase(peek(1)) == 'd') {
            pos += 2;
        } else if ("dflsky".indexOf(c) >= 0 && !isAsciiAlnum(peek(1))) {
            pos++;
        }
    }

    private void readDigits() {
        while (pos < s.length() && (isDigit(s.charAt(pos)) || s.charAt(pos) == '_')) pos++;
    }

    private static boolean isRadixDigit(char radix, char c) {
        if (c == '_') return true;
        switch (radix) {
            case 'x':
                return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            case 'b':
                return c == '0' || c == '1';
            default:
                return c >= '0' && c <= '7';
        }
    }

    /**
     * Jinja tag at the cursor ({@code {# #}}, {@code {{ }}} or {@code {% %}}). Quoted strings
     * inside the tag are skipped. Returns the kind char ({@code '#'}, {@code '{'}, {@code '%'})
     * or {@code '\0'} when the cursor is not on a tag.
     */
    char tryJinjaTag() {
        if (peek() != '{') return '\0';
        char kind = peek(1);
        if (kind == '#') {
            int end = s.indexOf("#}", pos + 2);
            pos = (end < 0) ? s.length() : end + 2;
            return kind;
        }
        if (kind != '{' && kind != '%') return '\0';
        char close = (kind == '{') ? '}' : '%';
        pos += 2;
        if (peek() == '-') pos++;
        while (pos + 1 < s.length()) {
            char c = s.charAt(pos);
            if (c == '\'' || c == '"') {
                readString();
                continue;
            }
            if (c == '-' && pos + 2 < s.length() && s.charAt(pos + 1) == close && s.charAt(pos + 2) == '}') {
                pos += 3;
                return kind;
            }
            if (c == close && s.charAt(pos + 1) == '}') {
                pos += 2;
                return kind;
            }
            pos++;
        }
        pos = s.length();
        return kind;
    }

    /**
     * End of a {@code {{ ... }}} expression counting nested {@code {{}} pairs and skipping
     * strings, or -1 when it never closes.
     */
    static int findJinjaExpressionEnd(String s, int from) {
        int len = s.length();
        if (from + 3 >= len || s.charAt(from) != '{' || s.charAt(from + 1) != '{') return -1;
        int i = from + 2;
        if (s.charAt(i) == '-') i++;
        int depth = 1;
        while (i < len) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') {
                i++;
                while (i < len && s.charAt(i) != c) {
                    if (s.charAt(i) == '\\') i++;
                    i++;
                }
                i++;
                continue;
            }
            if (c == '{' && i + 1 < len && s.charAt(i + 1) == '{') {
                depth++;
                i += 2;
                continue;
            }
            if (c == '-' && i + 2 < len && s.charAt(i + 1) == '}' && s.charAt(i + 2) == '}') {
                if (--depth == 0) return i + 3;
                i += 3;
                continue;
            }
            if (c == '}' && i + 1 < len && s.charAt(i + 1) == '}') {
                if (--depth == 0) return i + 2;
                i += 2;
                continue;
            }
            i++;
        }
        return -1;
    }
}
