package domain.model;

/**
 * Base of every error the formatter raises. Always carries an {@link ErrorCode}.
 */
public class SqlfmtException extends RuntimeException {

    private final ErrorCode code;

    public SqlfmtException(ErrorCode code, String message) {
        super(message);
        this.code = code == null ? ErrorCode.PARSING : code;
    }

    public SqlfmtException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code == null ? ErrorCode.PARSING : code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
