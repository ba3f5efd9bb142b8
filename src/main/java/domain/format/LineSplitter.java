package domain.format;

import domain.analyze.Comment;
import domain.analyze.Line;
import domain.analyze.Node;
import domain.token.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cuts a line at every break point: before clause keywords, operators, closing brackets and
 * statement separators, and after commas, opening brackets and clause keywords.
 *
 * <p>The merger later joins back whatever fits, tightest operators first, so the breaks that
 * survive are the loosest ones.</p>
 */
public final class LineSplitter {

    public List<Line> maybeSplit(Line line) {
        if (line.isFormattingDisabled()) {
            return Collections.singletonList(line);
        }

        List<Node> nodes = line.getNodes();
        List<Line> out = new ArrayList<>();
        List<Comment> comments = new ArrayList<>(line.getComments());
        int head = 0;
        boolean alwaysSplitAfter = false;
        boolean neverSplitAfter = false;

        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node.isNewline()) {
                if (head == 0) {
                    out.add(line);
                } else {
                    out.add(cut(line, head, i, comments, true).line);
                }
                return out;
            }
            if (i > head && !neverSplitAfter && !node.isFormattingDisabled()
                    && (alwaysSplitAfter || splitBefore(node))) {
                Cut cut = cut(line, head, i, comments, false);
                comments = cut.remainingComments;
                out.add(cut.line);
                head = i;
            }
            Node next = (i + 1 < nodes.size()) ? nodes.get(i + 1) : null;
            alwaysSplitAfter = splitAfter(node, next);
            neverSplitAfter = node.isFormattingDisabled() && !alwaysSplitAfter;
        }

        out.add(cut(line, head, nodes.size(), comments, true).line);
        return out;
    }

    static boolean splitBefore(Node node) {
        if (node.isUntermKeyword() || node.isOpeningJinjaBlock()) return true;
        if (node.isOperator()) {
            return !node.isTheAndAfterBetween() && !node.is(TokenType.COLON);
        }
        if (node.isBooleanOperator()) {
            if (node.isTheAndAfterBetween()) return false;
            if ("not".equals(node.getValue())) {
                Node prev = node.previousSqlNode();
                return prev == null || !prev.isBooleanOperator();
            }
            return true;
        }
        if (node.isClosingBracket()) {
            return !">".equals(node.getValue());
        }
        if (node.isClosingJinjaBlock() || node.dividesQueries()) return true;
        return splitBetweenBrackets(node);
    }

    /** {@code )(} and {@code ] [}: an opening bracket right after a closing one. */
    private static boolean splitBetweenBrackets(Node node) {
        if (!node.isOpeningBracket() || node.getPrevious() == null) return false;
        if (node.getPrevious().isClosingBracket()) return true;
        Node prev = node.previousSqlNode();
        return prev != null && prev.isClosingBracket();
    }

    static boolean splitAfter(Node node, Node next) {
        if (node.isComma()) return true;
        if (node.isOpeningBracket()) return !"<".equals(node.getValue());
        if (node.isOpeningJinjaBlock()) return !node.is(TokenType.JINJA_BLOCK_KEYWORD);
        if (node.isUntermKeyword()) {
            return !("lateral".equals(node.getValue()) && next != null && next.isOpeningBracket());
        }
        return node.dividesQueries();
    }

    private static final class Cut {
        final Line line;
        final List<Comment> remainingComments;

        Cut(Line line, List<Comment> remainingComments) {
            this.line = line;
            this.remainingComments = remainingComments;
        }
    }

    /**
     * New line from {@code nodes[head, index)}. Comments anchored in the new line stay with it
     * if inline; the rest travel on to later pieces unless this is the last one.
     */
    private static Cut cut(Line line, int head, int index, List<Comment> comments, boolean last) {
        List<Node> all = line.getNodes();
        List<Node> nodes = new ArrayList<>(all.subList(head, Math.min(index, all.size())));
        if (nodes.isEmpty()) {
            return new Cut(new Line(line.getPrevious(), nodes, Collections.<Comment>emptyList(), false), comments);
        }

        List<Comment> headComments = new ArrayList<>();
        List<Comment> tailComments = new ArrayList<>();
        if (last) {
            headComments.addAll(comments);
        } else if (!comments.isEmpty() && !(nodes.size() == 1 && nodes.get(0).isComma())) {
            List<Node> remaining = index < all.size() ? all.subList(index, all.size()) : Collections.<Node>emptyList();
            for (Comment comment : comments) {
                Node anchor = comment.getAnchor();
                if (anchor != null && nodes.contains(anchor)) {
                    if (comment.isInline()) {
                        headComments.add(comment);
                    } else {
                        tailComments.add(comment);
                    }
                } else if (anchor != null && remaining.contains(anchor)) {
                    tailComments.add(comment);
                } else {
                    headComments.add(comment);
                }
            }
        } else {
            tailComments.addAll(comments);
        }

        Node lastNode = nodes.get(nodes.size() - 1);
        if (!lastNode.isNewline()) {
            nodes.add(Node.newlineAfter(lastNode));
        }
        Line cut = new Line(nodes.get(0).getPrevious(), nodes, headComments, false);
        return new Cut(cut, tailComments);
    }
}
