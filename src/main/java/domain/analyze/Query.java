package domain.analyze;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed source file: the original text, the target width, the lines, and every node created
 * while lexing (in creation order).
 */
public final class Query {

    private final String source;
    private final int lineLength;
    private final List<Node> nodes;
    private List<Line> lines;

    public Query(String source, int lineLength, List<Line> lines, List<Node> nodes) {
        this.source = source;
        this.lineLength = lineLength;
        this.lines = new ArrayList<>(lines);
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    public String getSource() {
        return source;
    }

    public int getLineLength() {
        return lineLength;
    }

    public List<Line> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public void setLines(List<Line> lines) {
        this.lines = new ArrayList<>(lines);
    }

    /** All nodes in creation order, including newline nodes. */
    public List<Node> getNodes() {
        return nodes;
    }

    /** Nodes of the current lines, in line order. */
    public List<Node> lineNodes() {
        List<Node> out = new ArrayList<>();
        for (Line line : lines) {
            out.addAll(line.getNodes());
        }
        return out;
    }

    public List<Comment> comments() {
        List<Comment> out = new ArrayList<>();
        for (Line line : lines) {
            out.addAll(line.getComments());
        }
        return out;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line.isStandaloneComment()) {
                String indent = nextContentIndent(i);
                sb.append(line.renderWithComments(lineLength, indent != null ? indent : line.indentation()));
            } else {
                sb.append(line.renderWithComments(lineLength));
            }
        }
        return sb.toString();
    }

    /** Comments sitting alone are indented like the code that follows them. */
    private String nextContentIndent(int from) {
        for (int j = from + 1; j < lines.size(); j++) {
            Line next = lines.get(j);
            if (next.isBlank() || next.isStandaloneComment()) continue;
            if (next.isFormattingDisabled()) {
                Node first = next.firstContentNode();
                if (first != null) return first.getToken().getPrefix();
            }
            return next.indentation();
        }
        return null;
    }

    @Override
    public String toString() {
        return "Query{" + lines.size() + " lines, width=" + lineLength + "}";
    }
}
