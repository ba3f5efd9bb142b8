package domain.analyze;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One printable row: content nodes followed by exactly one newline node, plus attached comments.
 */
public final class Line {

    private final Node previous;
    private final List<Node> nodes;
    private final List<Comment> comments;
    private final boolean formattingDisabled;

    public Line(Node previous, List<Node> nodes, List<Comment> comments, boolean formattingDisabled) {
        this.previous = previous;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
        this.formattingDisabled = formattingDisabled;
    }

    /** The node before this line's first node, or null on the first line. */
    public Node getPrevious() {
        return previous;
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<Comment> getComments() {
        return comments;
    }

    public boolean isFormattingDisabled() {
        return formattingDisabled;
    }

    public Line withComments(List<Comment> newComments) {
        return new Line(previous, nodes, newComments, formattingDisabled);
    }

    // ---- shape ----

    public boolean isBlank() {
        return contentCount() == 0 && comments.isEmpty();
    }

    /** No code, only comments. */
    public boolean isStandaloneComment() {
        return contentCount() == 0 && !comments.isEmpty();
    }

    public int contentCount() {
        int n = 0;
        for (Node node : nodes) {
            if (!node.isNewline()) n++;
        }
        return n;
    }

    public List<Node> contentNodes() {
        List<Node> out = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (!node.isNewline()) out.add(node);
        }
        return out;
    }

    public Node firstContentNode() {
        for (Node node : nodes) {
            if (!node.isNewline()) return node;
        }
        return null;
    }

    public Node lastContentNode() {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            if (!nodes.get(i).isNewline()) return nodes.get(i);
        }
        return null;
    }

    /** Trailing newline node, or null if the line was built without one. */
    public Node newlineNode() {
        if (nodes.isEmpty()) return null;
        Node last = nodes.get(nodes.size() - 1);
        return last.isNewline() ? last : null;
    }

    /** Depth of the first content node; a line without content takes its predecessor's. */
    public Depth depth() {
        Node first = firstContentNode();
        if (first != null) return first.depth();
        if (previous != null) return previous.depth();
        Node newline = newlineNode();
        return newline != null ? newline.depth() : Depth.ZERO;
    }

    public String indentation() {
        return spaces(depth().indentSize());
    }

    // ---- rendering ----

    /** Code only, no comments, with its trailing newline. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        if (formattingDisabled) {
            for (Node node : nodes) {
                sb.append(node.getToken().getPrefix());
                if (!node.isNewline()) sb.append(node.getToken().getText());
            }
            return sb.append('\n').toString();
        }
        if (contentCount() == 0) return "\n";
        boolean first = true;
        for (Node node : nodes) {
            if (node.isNewline()) continue;
            if (first) {
                sb.append(indentation()).append(node.getValue());
                first = false;
            } else {
                sb.append(node.render());
            }
        }
        return sb.append('\n').toString();
    }

    /**
     * Full output of the line: comments that sit on their own lines first, then the code with
     * any inline comments appended. An inline comment that would push the line past
     * {@code maxLineLength} is moved above it.
     */
    public String renderWithComments(int maxLineLength) {
        return renderWithComments(maxLineLength, indentation());
    }

    /** As {@link #renderWithComments(int)}, with own-line comments at {@code commentIndent}. */
    public String renderWithComments(int maxLineLength, String commentIndent) {
        if (comments.isEmpty()) return render();
        String indent = commentIndent;
        String code = render();
        List<Comment> inline = new ArrayList<>();
        StringBuilder sb = new StringBuilder();

        int codeLength = code.length() - 1;
        for (Comment c : comments) {
            if (c.isInline() && contentCount() > 0) {
                inline.add(c);
            }
        }
        if (!inline.isEmpty() && !formattingDisabled) {
            int total = codeLength;
            for (Comment c : inline) total += c.renderInline().length();
            if (total > maxLineLength) inline.clear();
        }
        for (Comment c : comments) {
            if (!inline.contains(c)) {
                sb.append(c.renderStandalone(indent, maxLineLength));
            }
        }
        if (contentCount() == 0) return sb.toString();
        if (inline.isEmpty()) return sb.append(code).toString();
        sb.append(code, 0, codeLength);
        for (Comment c : inline) sb.append(c.renderInline());
        return sb.append('\n').toString();
    }

    /** Longest physical row of the rendered code (template tags may span several rows). */
    public int length() {
        int max = 0;
        for (String row : render().split("\n", -1)) {
            max = Math.max(max, row.length());
        }
        return max;
    }

    // ---- classification ----

    public boolean startsWithComma() {
        Node n = firstContentNode();
        return n != null && n.isComma();
    }

    public boolean startsWithOperator() {
        Node n = firstContentNode();
        return n != null && n.isOperator();
    }

    public boolean startsWithBracketOperator() {
        Node n = firstContentNode();
        return n != null && n.isBracketOperator();
    }

    public boolean startsWithSetOperator() {
        Node n = firstContentNode();
        return n != null && n.isSetOperator();
    }

    public boolean closesBracketFromPreviousLine() {
        Node n = firstContentNode();
        return n != null && n.isClosingBracket();
    }

    public boolean closesSimpleJinjaBlock() {
        Node n = firstContentNode();
        return n != null && n.isClosingJinjaBlock();
    }

    public boolean endsWithComma() {
        Node n = lastContentNode();
        return n != null && n.isComma();
    }

    public boolean containsMultilineJinja() {
        for (Node node : nodes) {
            if (node.isMultilineJinja()) return true;
        }
        return false;
    }

    /** A single operator on its own (index brackets excluded). */
    public boolean isStandaloneOperator() {
        return contentCount() == 1 && startsWithOperator() && !startsWithBracketOperator();
    }

    public boolean previousTokenIsComma() {
        Node n = previous;
        while (n != null && n.getType().doesNotSetPrevSqlContext()) {
            n = n.getPrevious();
        }
        return n != null && n.isComma();
    }

    /**
     * Whether this line begins a new merge segment after one at {@code prevDepth}: it is no deeper
     * or has left a template block. A line that only closes what was opened before, at the same
     * depth, stays in the segment.
     */
    public boolean startsNewSegmentAtDepth(Depth prevDepth) {
        Depth depth = depth();
        if (depth.compareTo(prevDepth) <= 0 || depth.getJinja() < prevDepth.getJinja()) {
            if ((closesBracketFromPreviousLine() || closesSimpleJinjaBlock() || isBlank())
                    && depth.equals(prevDepth)) {
                return false;
            }
            return true;
        }
        return false;
    }

    static String spaces(int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) sb.append(' ');
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Line{" + depth() + " '" + render().trim() + "'" + (comments.isEmpty() ? "" : " +" + comments.size() + " comments") + "}";
    }
}
