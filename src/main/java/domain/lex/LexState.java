package domain.lex;

/**
 * Active sub-grammar of the lexer.
 *
 * <p>SQL states share the main byte dispatch and differ only in keyword classification.
 * Data states copy text through until their terminator.</p>
 */
public enum LexState {
    MAIN,
    /** {@code -- fmt: off} region, copied verbatim until {@code -- fmt: on}. */
    FMT_OFF,
    /** Body of a {@code {% set x %}} block. */
    JINJA_SET_BLOCK,
    /** Body of a {@code {% call %}} block. */
    JINJA_CALL_BLOCK,
    /** DML/DDL statements that are passed through as data up to the next {@code ;}. */
    UNSUPPORTED,
    GRANT,
    FUNCTION,
    WAREHOUSE,
    CLONE;

    public boolean isDataState() {
        switch (this) {
            case FMT_OFF:
            case JINJA_SET_BLOCK:
            case JINJA_CALL_BLOCK:
            case UNSUPPORTED:
                return true;
            default:
                return false;
        }
    }
}
