package domain.format;

import domain.analyze.Comment;
import domain.analyze.Depth;
import domain.analyze.Line;
import domain.analyze.Node;
import domain.analyze.Query;
import domain.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the whole-query passes in order: split, template reflow, re-split around multiline
 * tags, template block dedent, merge, blank-line cleanup. Each pass replaces the query's lines.
 */
public final class QueryFormatter {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryFormatter.class);

    private final int lineLength;
    private final boolean noJinjafmt;

    public QueryFormatter(int lineLength, boolean noJinjafmt) {
        this.lineLength = lineLength;
        this.noJinjafmt = noJinjafmt;
    }

    public void format(Query query) {
        LOGGER.debug("formatting {} lines", query.getLines().size());
        query.setLines(splitLines(query.getLines()));
        LOGGER.debug("split into {} lines", query.getLines().size());

        if (!noJinjafmt) {
            formatJinja(query.getLines());
        }
        query.setLines(splitMultilineJinja(query.getLines()));
        dedentJinjaBlocks(query.getLines());

        query.setLines(new LineMerger(lineLength).maybeMergeLines(query.getLines()));
        LOGGER.debug("merged into {} lines", query.getLines().size());

        query.setLines(removeExtraBlankLines(query.getLines()));
    }

    List<Line> splitLines(List<Line> lines) {
        LineSplitter splitter = new LineSplitter();
        List<Line> out = new ArrayList<>();
        for (Line line : lines) {
            out.addAll(splitter.maybeSplit(line));
        }
        return out;
    }

    private void formatJinja(List<Line> lines) {
        JinjaFormatter formatter = new JinjaFormatter(lineLength);
        for (Line line : lines) {
            if (!line.isFormattingDisabled()) {
                formatter.formatLine(line);
            }
        }
    }

    /**
     * Moves a reflowed tag to its own line when a line holds two of them, or holds one and is
     * now too long. A line led by {@code on} keeps a single tag.
     */
    List<Line> splitMultilineJinja(List<Line> lines) {
        List<Line> out = new ArrayList<>(lines.size());
        for (Line line : lines) {
            int splitAt = line.isFormattingDisabled() ? -1 : multilineSplitPosition(line);
            if (splitAt < 0) {
                out.add(line);
                continue;
            }
            List<Node> nodes = line.getNodes();
            Node before = nodes.get(splitAt - 1);
            List<Node> firstNodes = new ArrayList<>(nodes.subList(0, splitAt));
            firstNodes.add(Node.newlineAfter(before));

            List<Comment> firstComments = new ArrayList<>();
            List<Comment> secondComments = new ArrayList<>();
            for (Comment comment : line.getComments()) {
                if (comment.isStandalone()) {
                    secondComments.add(comment);
                } else {
                    firstComments.add(comment);
                }
            }
            out.add(new Line(line.getPrevious(), firstNodes, firstComments, false));
            out.add(new Line(before, nodes.subList(splitAt, nodes.size()), secondComments, false));
        }
        return out;
    }

    private int multilineSplitPosition(Line line) {
        List<Node> nodes = line.getNodes();
        int content = 0;
        int multiline = 0;
        int firstMultiline = -1;
        boolean startsWithOn = false;
        for (int pos = 0; pos < nodes.size(); pos++) {
            Node node = nodes.get(pos);
            if (node.isNewline()) continue;
            content++;
            if (content == 1) startsWithOn = node.is(TokenType.ON);
            if (node.isMultilineJinja()) {
                multiline++;
                if (firstMultiline < 0 && content >= 2) firstMultiline = pos;
            }
        }
        if (multiline == 0 || content < 2 || firstMultiline < 0) return -1;
        if (multiline > 1) return firstMultiline;
        if (startsWithOn) return -1;
        return line.length() > lineLength ? firstMultiline : -1;
    }

    /**
     * A template block whose body sits shallower than its start tag pulls the start and end
     * tags out to the body's depth.
     */
    void dedentJinjaBlocks(List<Line> lines) {
        for (int i = 0; i < lines.size(); i++) {
            Line start = lines.get(i);
            Node first = start.firstContentNode();
            if (first == null || !first.is(TokenType.JINJA_BLOCK_START) || start.isFormattingDisabled()) {
                continue;
            }
            Depth startDepth = start.depth();
            int minSql = Integer.MAX_VALUE;
            Line end = null;
            for (int j = i + 1; j < lines.size(); j++) {
                Line line = lines.get(j);
                if (line.isBlank()) continue;
                Depth d = line.depth();
                Node lead = line.firstContentNode();
                if (lead != null && lead.isClosingJinjaBlock() && d.getJinja() <= startDepth.getJinja()) {
                    end = line;
                    break;
                }
                minSql = Math.min(minSql, d.getSql());
            }
            if (minSql != Integer.MAX_VALUE && minSql < startDepth.getSql()) {
                first.dedentTo(minSql);
                if (end != null) {
                    end.firstContentNode().dedentTo(minSql);
                }
            }
        }
    }

    /**
     * At most two blank lines in a row at the top level and one elsewhere; none directly under
     * a standalone comment and none at the end. Blank lines in a disabled region are kept.
     */
    List<Line> removeExtraBlankLines(List<Line> lines) {
        List<Line> out = new ArrayList<>(lines.size());
        int blanks = 0;
        boolean afterStandaloneComment = false;
        for (Line line : lines) {
            if (line.isBlank()) {
                if (line.isFormattingDisabled()) {
                    blanks = 0;
                    out.add(line);
                    continue;
                }
                if (afterStandaloneComment) continue;
                blanks++;
                int max = Depth.ZERO.equals(line.depth()) ? 2 : 1;
                if (blanks <= max) out.add(line);
            } else {
                blanks = 0;
                afterStandaloneComment = line.isStandaloneComment();
                out.add(line);
            }
        }
        while (!out.isEmpty() && out.get(out.size() - 1).isBlank()) {
            out.remove(out.size() - 1);
        }
        return out;
    }
}
