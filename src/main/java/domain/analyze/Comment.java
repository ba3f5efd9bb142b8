package domain.analyze;

import domain.token.Token;

/**
 * A comment lifted out of the node stream and attached to a line.
 *
 * <p>A standalone comment sat on its own line in the source; an inline one trailed code.
 * {@code anchor} is the node the comment belongs after, or null at the start of a query.</p>
 */
public final class Comment {

    private static final String[] MARKERS = {"--", "#", "//", "/*", "{#"};

    private final Token token;
    private final boolean standalone;
    private final Node anchor;

    public Comment(Token token, boolean standalone, Node anchor) {
        this.token = token;
        this.standalone = standalone;
        this.anchor = anchor;
    }

    public Token getToken() {
        return token;
    }

    public String getText() {
        return token.getText();
    }

    public boolean isStandalone() {
        return standalone;
    }

    public Node getAnchor() {
        return anchor;
    }

    /** Same comment, forced onto its own line. */
    public Comment asStandalone() {
        return standalone ? this : new Comment(token, true, anchor);
    }

    public boolean isMultiline() {
        return getText().indexOf('\n') >= 0;
    }

    public boolean isCStyle() {
        return getText().startsWith("/*");
    }

    public boolean isJinjaComment() {
        return getText().startsWith("{#");
    }

    public boolean isInline() {
        return !standalone && !isMultiline();
    }

    String marker() {
        String text = getText();
        for (String marker : MARKERS) {
            if (text.startsWith(marker)) {
                if (marker.equals("{#") && text.length() > 2 && text.charAt(2) == '-') {
                    return "{#-";
                }
                return marker;
            }
        }
        return "--";
    }

    /** {@code //} is written as {@code --}; other markers are kept. */
    String outputMarker() {
        String m = marker();
        return m.equals("//") ? "--" : m;
    }

    String body() {
        return getText().substring(marker().length()).trim();
    }

    /** Two spaces, the marker, one space, the body. Block comments are kept verbatim. */
    public String renderInline() {
        if (isCStyle() || isJinjaComment()) {
            return "  " + getText().trim();
        }
        return "  " + outputMarker() + " " + body();
    }

    /**
     * Comment on its own line(s) at {@code prefix}. Plain single-line comments longer than the
     * room left are word-wrapped; block, multiline and template comments are kept as written.
     */
    public String renderStandalone(String prefix, int maxLineLength) {
        if (isMultiline() || isCStyle() || isJinjaComment()) {
            return prefix + getText().trim() + "\n";
        }
        String marker = outputMarker();
        String body = body();
        if (body.isEmpty()) {
            return prefix + marker + "\n";
        }
        int overhead = prefix.length() + marker.length() + 1;
        int room = (maxLineLength > overhead) ? maxLineLength - overhead : 40;
        if (body.length() <= room || body.contains("{{") || body.contains("{%") || body.contains("{#")) {
            return prefix + marker + " " + body + "\n";
        }

        StringBuilder out = new StringBuilder();
        StringBuilder current = new StringBuilder();
        for (String word : body.split("\\s+")) {
            if (current.length() == 0) {
                current.append(word);
            } else if (current.length() + 1 + word.length() <= room) {
                current.append(' ').append(word);
            } else {
                out.append(prefix).append(marker).append(' ').append(current).append('\n');
                current.setLength(0);
                current.append(word);
            }
        }
        if (current.length() > 0) {
            out.append(prefix).append(marker).append(' ').append(current).append('\n');
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return (standalone ? "standalone " : "inline ") + "Comment{" + getText() + "}";
    }
}
