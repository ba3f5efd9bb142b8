package domain.model;

/**
 * Outcome of formatting one file.
 */
public enum FileStatus {

    /**
     * Already formatted.
     */
    UNCHANGED,

    /**
     * Reformatted (or, in check mode, would be).
     */
    CHANGED,

    /**
     * Reading, formatting or writing failed.
     */
    ERROR
}
