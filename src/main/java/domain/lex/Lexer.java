package domain.lex;

import domain.token.TokenType;

import java.util.Locale;

/**
 * Byte-dispatch lexer. Stateless: every call looks at the source from {@code pos} under one
 * {@link LexState} and returns the single next match.
 *
 * <p>Word handling first extends the word greedily with continuation words (so
 * {@code left outer join} wins over {@code left join} and {@code left}), then classifies the
 * whitespace-collapsed lowercase form for the active state.</p>
 */
public final class Lexer {

    private static final LexAction NAME = LexAction.add(TokenType.NAME);
    private static final LexAction QUOTED_NAME = LexAction.add(TokenType.QUOTED_NAME);
    private static final LexAction NUMBER = LexAction.add(TokenType.NUMBER);
    private static final LexAction OPERATOR = LexAction.add(TokenType.OPERATOR);
    private static final LexAction STAR = LexAction.add(TokenType.STAR);
    private static final LexAction COMMA = LexAction.add(TokenType.COMMA);
    private static final LexAction DOT = LexAction.add(TokenType.DOT);
    private static final LexAction COLON = LexAction.add(TokenType.COLON);
    private static final LexAction DOUBLE_COLON = LexAction.add(TokenType.DOUBLE_COLON);
    private static final LexAction BRACKET_OPEN = LexAction.add(TokenType.BRACKET_OPEN);
    private static final LexAction BRACKET_CLOSE = LexAction.add(TokenType.BRACKET_CLOSE);
    private static final LexAction DATA = LexAction.add(TokenType.DATA);
    private static final LexAction FMT_OFF = LexAction.add(TokenType.FMT_OFF);
    private static final LexAction FMT_ON = LexAction.add(TokenType.FMT_ON);
    private static final LexAction NEWLINE = LexAction.of(LexAction.Kind.NEWLINE);
    private static final LexAction SEMICOLON = LexAction.of(LexAction.Kind.SEMICOLON);
    private static final LexAction COMMENT = LexAction.of(LexAction.Kind.ADD_COMMENT);
    private static final LexAction CLOSING_ANGLE = LexAction.of(LexAction.Kind.CLOSING_ANGLE);
    private static final LexAction ANGLE_TYPE_OPEN = LexAction.of(LexAction.Kind.ANGLE_TYPE_OPEN);
    private static final LexAction JINJA_EXPRESSION = LexAction.of(LexAction.Kind.JINJA_EXPRESSION);
    private static final LexAction JINJA_STATEMENT = LexAction.add(TokenType.JINJA_STATEMENT);
    private static final LexAction JINJA_BLOCK_KEYWORD = LexAction.of(LexAction.Kind.JINJA_BLOCK_KEYWORD);
    private static final LexAction JINJA_BLOCK_END = LexAction.of(LexAction.Kind.JINJA_BLOCK_END);

    private static final LexAction UNTERM = LexAction.add(TokenType.UNTERM_KEYWORD).reserved();
    private static final LexAction TOP_LEVEL_UNTERM = LexAction.add(TokenType.UNTERM_KEYWORD).reserved().topLevelOnly();
    private static final LexAction PLAIN_UNTERM = LexAction.add(TokenType.UNTERM_KEYWORD);
    private static final LexAction WORD_OPERATOR = LexAction.add(TokenType.WORD_OPERATOR).reserved();
    private static final LexAction BOOLEAN_OPERATOR = LexAction.add(TokenType.BOOLEAN_OPERATOR).reserved();
    private static final LexAction ON = LexAction.add(TokenType.ON).reserved();
    private static final LexAction SET_OPERATOR = LexAction.of(LexAction.Kind.SET_OPERATOR).reserved();
    private static final LexAction STATEMENT_START = LexAction.add(TokenType.STATEMENT_START).reserved();
    private static final LexAction STATEMENT_END = LexAction.of(LexAction.Kind.STATEMENT_END).reserved();
    private static final LexAction DDL_AS = LexAction.of(LexAction.Kind.DDL_AS).reserved();
    private static final LexAction STAR_MODIFIER = LexAction.beforeParen(TokenType.WORD_OPERATOR).reserved();

    private static final LexAction ENTER_GRANT = LexAction.ruleset(LexState.GRANT).reserved().topLevelOnly();
    private static final LexAction ENTER_FUNCTION = LexAction.ruleset(LexState.FUNCTION).reserved().topLevelOnly();
    private static final LexAction ENTER_WAREHOUSE = LexAction.ruleset(LexState.WAREHOUSE).reserved().topLevelOnly();
    private static final LexAction ENTER_CLONE = LexAction.ruleset(LexState.CLONE).reserved().topLevelOnly();
    private static final LexAction ENTER_UNSUPPORTED = LexAction.ruleset(LexState.UNSUPPORTED).reserved().topLevelOnly();

    private Lexer() {
    }

    /**
     * Next match at {@code pos}, or null when only inline whitespace (or nothing) remains.
     */
    public static LexResult lexOne(String source, int pos, LexState state) {
        SqlScan scan = new SqlScan(source, pos);
        String prefix = scan.readInlineSpaces();
        if (!scan.hasNext()) return null;

        switch (state) {
            case FMT_OFF:
                return lexFmtOff(scan, prefix);
            case JINJA_SET_BLOCK:
                return lexTemplateData(scan, prefix, "endset", null);
            case JINJA_CALL_BLOCK:
                return lexTemplateData(scan, prefix, "endcall", "call");
            case UNSUPPORTED:
                return lexUnsupported(scan, prefix);
            default:
                return lexCode(scan, prefix, state);
        }
    }

    private static LexResult lexCode(SqlScan scan, String prefix, LexState state) {
        int start = scan.pos;
        char c = scan.peek();
        switch (c) {
            case '\n':
                scan.read();
                return result(NEWLINE, prefix, scan, start);
            case '-':
                if (scan.peek(1) == '-') return lineComment(scan, prefix, start);
                return operator(scan, prefix, start);
            case '/':
                if (scan.peek(1) == '*') {
                    scan.readBlockComment();
                    return result(COMMENT, prefix, scan, start);
                }
                if (scan.peek(1) == '/') return lineComment(scan, prefix, start);
                scan.read();
                return result(OPERATOR, prefix, scan, start);
            case '#':
                if (compoundOperatorLength(scan) > 0) return operator(scan, prefix, start);
                return lineComment(scan, prefix, start);
            case '\'':
                if (scan.peekTripleQuote('\'')) {
                    scan.readTripleString();
                } else {
                    scan.readSqlString();
                }
                return result(NAME, prefix, scan, start);
            case '"':
                if (scan.peekTripleQuote('"')) {
                    scan.readTripleString();
                    return result(NAME, prefix, scan, start);
                }
                scan.readSqlString();
                return result(QUOTED_NAME, prefix, scan, start);
            case '`':
                scan.readSqlString();
                return result(QUOTED_NAME, prefix, scan, start);
            case '$':
                return dollar(scan, prefix, start);
            case '{': {
                LexResult tag = jinjaTag(scan, prefix, start);
                if (tag != null) return tag;
                scan.read();
                return result(BRACKET_OPEN, prefix, scan, start);
            }
            case ';':
                scan.read();
                return result(SEMICOLON, prefix, scan, start);
            case ',':
                scan.read();
                return result(COMMA, prefix, scan, start);
            case '.':
                if (SqlScan.isDigit(scan.peek(1))) {
                    scan.readNumber();
                    return result(NUMBER, prefix, scan, start);
                }
                scan.read();
                return result(DOT, prefix, scan, start);
            case ':':
                if (scan.peek(1) == ':') {
                    scan.pos += 2;
                    return result(DOUBLE_COLON, prefix, scan, start);
                }
                if (scan.peek(1) == '=') {
                    scan.pos += 2;
                    return result(OPERATOR, prefix, scan, start);
                }
                scan.read();
                return result(COLON, prefix, scan, start);
            case '*':
                if (compoundOperatorLength(scan) > 1) return operator(scan, prefix, start);
                scan.read();
                return result(STAR, prefix, scan, start);
            case '(':
            case '[':
                scan.read();
                return result(BRACKET_OPEN, prefix, scan, start);
            case ')':
            case ']':
            case '}':
                scan.read();
                return result(BRACKET_CLOSE, prefix, scan, start);
            case '>':
                if (compoundOperatorLength(scan) > 0) return operator(scan, prefix, start);
                scan.read();
                return result(CLOSING_ANGLE, prefix, scan, start);
            case '@':
                if (SqlScan.isAsciiAlnum(scan.peek(1)) || scan.peek(1) == '_') {
                    scan.read();
                    scan.readWord();
                    return result(NAME, prefix, scan, start);
                }
                return operator(scan, prefix, start);
            case '?':
                if (SqlScan.isDigit(scan.peek(1))) {
                    scan.read();
                    while (SqlScan.isDigit(scan.peek())) scan.read();
                    return result(NAME, prefix, scan, start);
                }
                return operator(scan, prefix, start);
            case '%':
                return percent(scan, prefix, start);
            case '<':
            case '=':
            case '!':
            case '~':
            case '+':
            case '^':
            case '&':
            case '|':
                return operator(scan, prefix, start);
            case 'r':
            case 'R':
                if (isRawTripleString(scan)) {
                    scan.read();
                    scan.readTripleString();
                    return result(NAME, prefix, scan, start);
                }
                return word(scan, prefix, state);
            default:
                if (SqlScan.isDigit(c)) {
                    scan.readNumber();
                    return result(NUMBER, prefix, scan, start);
                }
                if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_') {
                    return word(scan, prefix, state);
                }
                if (c >= 0x80) {
                    scan.readWord();
                    return result(NAME, prefix, scan, start);
                }
                scan.read();
                return result(NAME, prefix, scan, start);
        }
    }

    private static boolean isRawTripleString(SqlScan scan) {
        char q = scan.peek(1);
        return (q == '"' || q == '\'') && scan.peek(2) == q && scan.peek(3) == q;
    }

    private static LexResult result(LexAction action, String prefix, SqlScan scan, int start) {
        return new LexResult(action, prefix, scan.textFrom(start));
    }

    private static LexResult operator(SqlScan scan, String prefix, int start) {
        int n = compoundOperatorLength(scan);
        scan.pos += Math.max(n, 1);
        return result(OPERATOR, prefix, scan, start);
    }

    private static LexResult lineComment(SqlScan scan, String prefix, int start) {
        scan.readLineComment();
        String text = scan.textFrom(start);
        LexAction marker = fmtMarker(text);
        return new LexResult(marker != null ? marker : COMMENT, prefix, text);
    }

    private static LexResult dollar(SqlScan scan, String prefix, int start) {
        if (scan.tryDollarString()) return result(NAME, prefix, scan, start);
        scan.read();
        if (scan.readWord().isEmpty()) return result(OPERATOR, prefix, scan, start);
        return result(NAME, prefix, scan, start);
    }

    /** {@code %(name)s} and {@code %s} bind parameters, or the modulo operator. */
    private static LexResult percent(SqlScan scan, String prefix, int start) {
        if (scan.peek(1) == '(') {
            int close = scan.s.indexOf(')', scan.pos + 2);
            if (close >= 0 && close + 1 < scan.s.length() && scan.s.charAt(close + 1) == 's') {
                scan.pos = close + 2;
                return result(NAME, prefix, scan, start);
            }
        }
        if (scan.peek(1) == 's') {
            scan.pos += 2;
            return result(NAME, prefix, scan, start);
        }
        return operator(scan, prefix, start);
    }

    private static LexResult jinjaTag(SqlScan scan, String prefix, int start) {
        char kind = scan.tryJinjaTag();
        if (kind == '\0') return null;
        String text = scan.textFrom(start);
        switch (kind) {
            case '#':
                return new LexResult(COMMENT, prefix, text);
            case '{': {
                int end = SqlScan.findJinjaExpressionEnd(scan.s, start);
                if (end > 0) {
                    scan.pos = end;
                    text = scan.textFrom(start);
                }
                return new LexResult(JINJA_EXPRESSION, prefix, text);
            }
            default:
                return new LexResult(classifyJinjaStatement(text), prefix, text);
        }
    }

    /**
     * Length of a 2-4 char operator at the cursor ({@code >=}, {@code ->>}, {@code @>} ...), or 0.
     */
    static int compoundOperatorLength(SqlScan scan) {
        char a = scan.peek();
        char b = scan.peek(1);
        char c = scan.peek(2);
        switch (a) {
            case '>':
                return (b == '=' || b == '>') ? 2 : 0;
            case '<':
                if ((b == '=' || b == '-' || b == '#') && c == '>') return 3;
                return (b == '>' || b == '=' || b == '<' || b == '@') ? 2 : 0;
            case '=':
                return (b == '>' || b == '=') ? 2 : 0;
            case '!':
                if ((b == '!' && c == '=') || (b == '~' && c == '*')) return 3;
                return (b == '=' || b == '~') ? 2 : 0;
            case '-':
                if (b == '>' && c == '-' && scan.peek(3) == '>') return 4;
                if ((b == '>' && c == '>') || (b == '|' && c == '-')) return 3;
                return (b == '>') ? 2 : 0;
            case '|':
                if (b == '|' && c == '/') return 3;
                return (b == '|' || b == '/') ? 2 : 0;
            case '&':
                return (b == '&') ? 2 : 0;
            case '*':
                return (b == '*') ? 2 : 0;
            case '~':
                return (b == '*') ? 2 : 0;
            case '@':
                if (b == '-' && c == '@') return 3;
                return (b == '>' || b == '@') ? 2 : 0;
            case '?':
                return (b == '|' || b == '&') ? 2 : 0;
            case '#':
                if (b == '>' && c == '>') return 3;
                return (b == '>' || b == '-') ? 2 : 0;
            case '%':
                return (b == '%') ? 2 : 0;
            default:
                return 0;
        }
    }

    /** {@code -- fmt: off} / {@code # fmt:on} style markers. */
    static LexAction fmtMarker(String comment) {
        int i;
        if (comment.startsWith("--") || comment.startsWith("//")) {
            i = 2;
        } else if (comment.startsWith("#")) {
            i = 1;
        } else {
            return null;
        }
        String rest = comment.substring(i).trim().toLowerCase(Locale.ROOT);
        if (!rest.startsWith("fmt:")) return null;
        String value = rest.substring(4).trim();
        if (value.startsWith("off")) return FMT_OFF;
        if (value.startsWith("on")) return FMT_ON;
        return null;
    }

    /** Classifies a {@code {% ... %}} tag by its first word. */
    static LexAction classifyJinjaStatement(String tag) {
        String inner = stripTagOpen(tag);
        int end = 0;
        while (end < inner.length()) {
            char c = inner.charAt(end);
            if (SqlScan.isSpace(c) || c == '-' || c == '%') break;
            end++;
        }
        String keyword = inner.substring(0, end).toLowerCase(Locale.ROOT);
        switch (keyword) {
            case "if":
            case "for":
            case "macro":
            case "test":
            case "snapshot":
            case "materialization":
                return LexAction.blockStart(null);
            case "set":
                return tag.indexOf('=') < 0 ? LexAction.blockStart(LexState.JINJA_SET_BLOCK) : JINJA_STATEMENT;
            case "call":
                return inner.substring(end).trim().toLowerCase(Locale.ROOT).startsWith("statement")
                        ? JINJA_STATEMENT
                        : LexAction.blockStart(LexState.JINJA_CALL_BLOCK);
            case "elif":
            case "else":
                return JINJA_BLOCK_KEYWORD;
            case "endif":
            case "endfor":
            case "endmacro":
            case "endtest":
            case "endsnapshot":
            case "endmaterialization":
            case "endset":
            case "endcall":
                return JINJA_BLOCK_END;
            default:
                return JINJA_STATEMENT;
        }
    }

    private static String stripTagOpen(String tag) {
        int i = 0;
        while (i < tag.length() && (tag.charAt(i) == '{' || tag.charAt(i) == '%' || tag.charAt(i) == '-')) i++;
        while (i < tag.length() && SqlScan.isSpace(tag.charAt(i))) i++;
        return tag.substring(i);
    }

    private static String tagKeyword(String tag) {
        String inner = stripTagOpen(tag);
        int end = 0;
        while (end < inner.length() && SqlScan.isWordChar(inner.charAt(end))) end++;
        return inner.substring(0, end).toLowerCase(Locale.ROOT);
    }

    // ---- words ----

    private static LexResult word(SqlScan scan, String prefix, LexState state) {
        int start = scan.pos;
        String first = scan.readWord();
        String firstLower = first.toLowerCase(Locale.ROOT);
        Keywords.extend(scan, firstLower, state);
        String text = scan.textFrom(start);
        boolean extended = text.length() > first.length();
        String key = extended ? collapse(text) : firstLower;

        if (Keywords.ANGLE_TYPES.contains(firstLower) && !extended) {
            int save = scan.pos;
            scan.readInlineSpaces();
            if (scan.peek() == '<') {
                scan.read();
                return result(ANGLE_TYPE_OPEN, prefix, scan, start);
            }
            scan.pos = save;
        }

        switch (state) {
            case GRANT:
                return new LexResult(Keywords.isGrantUnterm(key) ? UNTERM : NAME, prefix, text);
            case FUNCTION:
                return new LexResult(classifyFunction(key), prefix, text);
            case WAREHOUSE:
                return new LexResult(Keywords.isWarehouseUnterm(key) ? UNTERM : NAME, prefix, text);
            case CLONE:
                return new LexResult(classifyClone(key), prefix, text);
            default:
                return classifyMain(scan, prefix, start, text, key, firstLower, extended);
        }
    }

    private static LexResult classifyMain(SqlScan scan, String prefix, int start, String text, String key,
                                          String firstLower, boolean extended) {
        boolean beforeParen = isFollowedByParen(scan);
        switch (key) {
            case "case":
                return new LexResult(STATEMENT_START, prefix, text);
            case "end":
                return new LexResult(STATEMENT_END, prefix, text);
            default:
                break;
        }
        if (beforeParen && !extended) {
            if (Keywords.NAME_BEFORE_PAREN.contains(key)) return new LexResult(NAME, prefix, text);
            if (Keywords.STAR_MODIFIERS.contains(key)) return new LexResult(STAR_MODIFIER, prefix, text);
        }
        if (key.equals("select into")) return new LexResult(TOP_LEVEL_UNTERM, prefix, text);
        if (key.equals("delete from")) return new LexResult(PLAIN_UNTERM, prefix, text);
        if (key.equals("from") || key.equals("using") || key.startsWith("select top ")) {
            return new LexResult(UNTERM, prefix, text);
        }
        if (key.equals("on")) return new LexResult(ON, prefix, text);
        if (Keywords.UNTERM.contains(key)) return new LexResult(UNTERM, prefix, text);
        if (Keywords.WORD_OPERATORS.contains(key)) return new LexResult(WORD_OPERATOR, prefix, text);
        if (key.equals("and") || key.equals("or") || key.equals("not")) {
            return new LexResult(BOOLEAN_OPERATOR, prefix, text);
        }
        if (!extended && (key.equals("rows") || key.equals("range") || key.equals("groups"))) {
            int end = frameClauseEnd(scan.s, start);
            if (end > 0) {
                scan.pos = end;
                return result(UNTERM, prefix, scan, start);
            }
        }
        if (key.equals("offset")) return new LexResult(UNTERM, prefix, text);
        if (Keywords.SET_OPERATORS.contains(key)) return new LexResult(SET_OPERATOR, prefix, text);
        if (Keywords.EXPLAIN.contains(key)) return new LexResult(TOP_LEVEL_UNTERM, prefix, text);
        if (firstLower.equals("grant") || firstLower.equals("revoke")) {
            return new LexResult(ENTER_GRANT, prefix, text);
        }
        if (firstLower.equals("create") || firstLower.equals("alter") || firstLower.equals("drop")) {
            return new LexResult(classifyDdl(scan, firstLower, key), prefix, text);
        }
        if (Keywords.UNSUPPORTED_FIRST_WORDS.contains(firstLower)) {
            return new LexResult(ENTER_UNSUPPORTED, prefix, text);
        }
        return new LexResult(NAME, prefix, text);
    }

    private static LexAction classifyDdl(SqlScan scan, String firstLower, String key) {
        if (firstLower.equals("create") && Keywords.looksLikeClone(scan.s, scan.pos)) return ENTER_CLONE;
        if (Keywords.isFunctionDdl(key)) return ENTER_FUNCTION;
        if (Keywords.isWarehouseDdl(key)) return ENTER_WAREHOUSE;
        if (Keywords.looksLikeFunction(scan.s, scan.pos)) return ENTER_FUNCTION;
        if (!firstLower.equals("drop") && Keywords.looksLikeWarehouse(scan.s, scan.pos)) return ENTER_WAREHOUSE;
        return ENTER_UNSUPPORTED;
    }

    private static LexAction classifyFunction(String key) {
        if (key.equals("as")) return DDL_AS;
        if (key.equals("to") || key.equals("from") || key.equals("runtime_version")) return WORD_OPERATOR;
        if (Keywords.isFunctionUnterm(key)) return UNTERM;
        return NAME;
    }

    private static LexAction classifyClone(String key) {
        if (key.equals("clone") || key.startsWith("create")) return UNTERM;
        if (key.equals("at") || key.equals("before")) return WORD_OPERATOR;
        return NAME;
    }

    private static boolean isFollowedByParen(SqlScan scan) {
        int i = scan.pos;
        while (i < scan.s.length() && SqlScan.isInlineSpace(scan.s.charAt(i))) i++;
        return i < scan.s.length() && scan.s.charAt(i) == '(';
    }

    static String collapse(String text) {
        return String.join(" ", text.trim().toLowerCase(Locale.ROOT).split("\\s+"));
    }

    /**
     * End of a window frame clause starting at the {@code rows|range|groups} word, for example
     * {@code rows between unbounded preceding and current row}, or -1.
     */
    static int frameClauseEnd(String s, int from) {
        SqlScan scan = new SqlScan(s, from);
        scan.readWord();
        int save = scan.pos;
        scan.readInlineSpaces();
        boolean between = scan.peekWord("between");
        if (between) {
            scan.pos += "between".length();
            scan.readInlineSpaces();
        }
        if (!frameBound(scan)) {
            scan.pos = save;
            return -1;
        }
        if (between) {
            int afterFirst = scan.pos;
            scan.readInlineSpaces();
            if (scan.peekWord("and")) {
                scan.pos += 3;
                scan.readInlineSpaces();
                if (!frameBound(scan)) return -1;
            } else {
                scan.pos = afterFirst;
            }
        }
        return scan.pos;
    }

    private static boolean frameBound(SqlScan scan) {
        if (scan.peekWord("current")) {
            scan.pos += "current".length();
            return scan.tryInlineWord("row");
        }
        if (scan.peekWord("unbounded")) {
            scan.pos += "unbounded".length();
        } else {
            int digits = scan.pos;
            while (SqlScan.isDigit(scan.peek())) scan.pos++;
            if (scan.pos == digits) return false;
        }
        return scan.tryInlineWord("preceding") || scan.tryInlineWord("following");
    }

    // ---- passthrough states ----

    private static LexResult lexFmtOff(SqlScan scan, String prefix) {
        int start = scan.pos;
        if (scan.peek() == '\n') {
            scan.read();
            return result(NEWLINE, prefix, scan, start);
        }
        if (scan.startsWith("--") || scan.peek() == '#' || scan.startsWith("//")) {
            scan.readLineComment();
            if (fmtMarker(scan.textFrom(start)) == FMT_ON) return result(FMT_ON, prefix, scan, start);
            scan.pos = start;
        }
        scan.readLineComment();
        return result(DATA, prefix, scan, start);
    }

    /**
     * Body of a {@code {% set %}} or {@code {% call %}} block: verbatim lines until the closing
     * tag. {@code nestedStart}, when non-null, opens another block of the same kind.
     */
    private static LexResult lexTemplateData(SqlScan scan, String prefix, String endKeyword, String nestedStart) {
        int start = scan.pos;
        if (scan.peek() == '\n') {
            scan.read();
            return result(NEWLINE, prefix, scan, start);
        }
        if (scan.startsWith("{%")) {
            char kind = scan.tryJinjaTag();
            if (kind == '%') {
                String tag = scan.textFrom(start);
                String keyword = tagKeyword(tag);
                if (keyword.equals(endKeyword)) return new LexResult(JINJA_BLOCK_END, prefix, tag);
                if (keyword.equals(nestedStart)) {
                    return new LexResult(LexAction.blockStart(LexState.JINJA_CALL_BLOCK), prefix, tag);
                }
            }
            scan.pos = start;
        }
        int nl = scan.s.indexOf('\n', start);
        int end = (nl < 0) ? scan.s.length() : nl;
        int tag = scan.s.indexOf("{%", start + 1);
        if (tag >= 0 && tag < end) end = tag;
        scan.pos = end;
        return result(DATA, prefix, scan, start);
    }

    private static LexResult lexUnsupported(SqlScan scan, String prefix) {
        int start = scan.pos;
        char c = scan.peek();
        if (c == '\n') {
            scan.read();
            return result(NEWLINE, prefix, scan, start);
        }
        if (c == ';') {
            scan.read();
            return result(SEMICOLON, prefix, scan, start);
        }
        if (scan.startsWith("--") || c == '#' || scan.startsWith("//")) {
            return lineComment(scan, prefix, start);
        }
        if (scan.startsWith("/*")) {
            scan.readBlockComment();
            return result(COMMENT, prefix, scan, start);
        }
        if (c == '{') {
            LexResult tag = jinjaTag(scan, prefix, start);
            if (tag != null) return tag;
        }
        if (c == '"' || c == '`') {
            scan.readSqlString();
            return result(DATA, prefix, scan, start);
        }
        if (c == '\'') {
            if (scan.peekTripleQuote('\'')) {
                scan.readTripleString();
            } else {
                scan.readSqlString();
            }
            return result(NAME, prefix, scan, start);
        }
        scan.read();
        while (scan.hasNext() && !isUnsupportedDataStop(scan)) scan.read();
        return result(DATA, prefix, scan, start);
    }

    private static boolean isUnsupportedDataStop(SqlScan scan) {
        switch (scan.peek()) {
            case ';':
            case '\n':
            case '\'':
            case '"':
            case '`':
            case '{':
                return true;
            case '-':
                return scan.peek(1) == '-';
            case '/':
                return scan.peek(1) == '*';
            default:
                return false;
        }
    }
}
