package domain.model;

/**
 * The formatted output lexes to different tokens than the source. Always a formatter bug.
 */
public class EquivalenceException extends SqlfmtException {

    private final int index;
    private final String originalText;
    private final String formattedText;

    public EquivalenceException(int index, String originalText, String formattedText, String message) {
        super(ErrorCode.EQUIVALENCE, message);
        this.index = index;
        this.originalText = originalText == null ? "" : originalText;
        this.formattedText = formattedText == null ? "" : formattedText;
    }

    public static EquivalenceException countMismatch(int original, int formatted) {
        return new EquivalenceException(-1, "", "",
                "Token count mismatch: original has " + original + " tokens, formatted has " + formatted);
    }

    public static EquivalenceException typeMismatch(int index, String originalType, String originalText,
                                                    String formattedType, String formattedText) {
        return new EquivalenceException(index, originalText, formattedText,
                "Token type mismatch at position " + index + ": original " + originalType + " '" + originalText
                        + "', formatted " + formattedType + " '" + formattedText + "'");
    }

    public static EquivalenceException textMismatch(int index, String originalText, String formattedText) {
        return new EquivalenceException(index, originalText, formattedText,
                "Token text mismatch at position " + index + ": original '" + originalText
                        + "', formatted '" + formattedText + "'");
    }

    /** Token index, or -1 for a count mismatch. */
    public int getIndex() {
        return index;
    }

    public String getOriginalText() {
        return originalText;
    }

    public String getFormattedText() {
        return formattedText;
    }
}
