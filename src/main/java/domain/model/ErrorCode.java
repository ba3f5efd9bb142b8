package domain.model;

/**
 * Categories of fatal formatting errors.
 *
 * <p>{@link #EQUIVALENCE} points at a formatter defect; the others point at the input or
 * the environment.</p>
 */
public enum ErrorCode {

    /**
     * Unknown dialect, unknown option or a malformed option value.
     */
    CONFIGURATION,

    /**
     * No lexer rule matched at some position.
     */
    PARSING,

    /**
     * Unbalanced block comment markers or a closing bracket without an opener.
     */
    BRACKET,

    /**
     * Formatted output does not re-lex to the same tokens as the source.
     */
    EQUIVALENCE,

    /**
     * A file could not be read or written.
     */
    IO
}
