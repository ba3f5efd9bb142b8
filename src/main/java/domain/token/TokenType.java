package domain.token;

/**
 * Closed set of token kinds produced by the lexer.
 *
 * <p>All predicates are pure functions of the kind; they drive depth, spacing,
 * casing and split/merge decisions further down the pipeline.</p>
 */
public enum TokenType {

    /** {@code -- fmt: off} marker. */
    FMT_OFF,
    /** {@code -- fmt: on} marker. */
    FMT_ON,
    /** Opaque passthrough text (disabled formatting, unsupported DDL, jinja set/call bodies). */
    DATA,
    JINJA_STATEMENT,
    JINJA_EXPRESSION,
    JINJA_BLOCK_START,
    JINJA_BLOCK_END,
    JINJA_BLOCK_KEYWORD,
    QUOTED_NAME,
    COMMENT,
    COMMENT_START,
    COMMENT_END,
    SEMICOLON,
    /** {@code case}. */
    STATEMENT_START,
    /** {@code end} closing a {@code case}. */
    STATEMENT_END,
    STAR,
    NUMBER,
    BRACKET_OPEN,
    BRACKET_CLOSE,
    DOUBLE_COLON,
    COLON,
    OPERATOR,
    WORD_OPERATOR,
    /** Join condition keyword. */
    ON,
    BOOLEAN_OPERATOR,
    COMMA,
    DOT,
    NEWLINE,
    /** Unterminated clause keyword: select, from, where, left join ... */
    UNTERM_KEYWORD,
    SET_OPERATOR,
    NAME;

    public boolean isJinjaStatement() {
        return this == JINJA_STATEMENT || this == JINJA_EXPRESSION;
    }

    public boolean isJinja() {
        switch (this) {
            case JINJA_STATEMENT:
            case JINJA_EXPRESSION:
            case JINJA_BLOCK_START:
            case JINJA_BLOCK_END:
            case JINJA_BLOCK_KEYWORD:
                return true;
            default:
                return false;
        }
    }

    public boolean dividesQueries() {
        return this == SEMICOLON || this == SET_OPERATOR;
    }

    public boolean isOpeningBracket() {
        return this == BRACKET_OPEN || this == STATEMENT_START;
    }

    public boolean isClosingBracket() {
        return this == BRACKET_CLOSE || this == STATEMENT_END;
    }

    public boolean isAlwaysOperator() {
        switch (this) {
            case OPERATOR:
            case WORD_OPERATOR:
            case ON:
            case DOUBLE_COLON:
            case COLON:
                return true;
            default:
                return false;
        }
    }

    public boolean isAlwaysLowercased() {
        switch (this) {
            case UNTERM_KEYWORD:
            case SET_OPERATOR:
            case STATEMENT_START:
            case STATEMENT_END:
            case WORD_OPERATOR:
            case ON:
            case BOOLEAN_OPERATOR:
                return true;
            default:
                return false;
        }
    }

    public boolean isNeverPrecededBySpace() {
        switch (this) {
            case COMMA:
            case DOT:
            case SEMICOLON:
            case NEWLINE:
            case BRACKET_CLOSE:
            case COMMENT_END:
            case DOUBLE_COLON:
            case COLON:
                return true;
            default:
                return false;
        }
    }

    public boolean isPrecededBySpaceExceptAfterOpenBracket() {
        switch (this) {
            case OPERATOR:
            case WORD_OPERATOR:
            case ON:
            case BOOLEAN_OPERATOR:
            case SET_OPERATOR:
            case STAR:
            case NUMBER:
            case COMMENT:
            case COMMENT_START:
            case UNTERM_KEYWORD:
            case FMT_OFF:
            case FMT_ON:
            case DATA:
                return true;
            default:
                return false;
        }
    }

    public boolean isPossibleName() {
        return this == NAME || this == QUOTED_NAME || this == STAR;
    }

    /**
     * Kinds skipped when looking back for the token that decides spacing and operator context.
     */
    public boolean doesNotSetPrevSqlContext() {
        switch (this) {
            case NEWLINE:
            case JINJA_STATEMENT:
            case JINJA_BLOCK_START:
            case JINJA_BLOCK_KEYWORD:
            case JINJA_BLOCK_END:
                return true;
            default:
                return false;
        }
    }
}
