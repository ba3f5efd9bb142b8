package domain.model;

import java.nio.file.Path;

/**
 * A single file outcome row for reporting.
 */
public final class FileResult {

    private final Path path;
    private final FileStatus status;

    /**
     * null unless status is ERROR
     */
    private final ErrorCode errorCode;
    private final String message;

    private FileResult(Path path, FileStatus status, ErrorCode errorCode, String message) {
        this.path = path;
        this.status = status;
        this.errorCode = errorCode;
        this.message = message == null ? "" : message;
    }

    public static FileResult unchanged(Path path) {
        return new FileResult(path, FileStatus.UNCHANGED, null, "");
    }

    public static FileResult changed(Path path) {
        return new FileResult(path, FileStatus.CHANGED, null, "");
    }

    public static FileResult error(Path path, ErrorCode code, String message) {
        return new FileResult(path, FileStatus.ERROR, code == null ? ErrorCode.IO : code, message);
    }

    public static FileResult error(Path path, SqlfmtException e) {
        return error(path, e.getCode(), e.getMessage());
    }

    public Path getPath() {
        return path;
    }

    public FileStatus getStatus() {
        return status;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return status + " " + path + (message.isEmpty() ? "" : " (" + message + ")");
    }
}
