package domain.format;

import domain.analyze.Comment;
import domain.analyze.Line;
import domain.analyze.Node;
import domain.token.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Joins split lines back together wherever the result fits.
 *
 * <p>A run of lines is first merged whole. If that fails it is cut into segments; runs of
 * segments joined by operators are merged from the loosest tier down, tight operators and join
 * conditions are then glued on stubbornly, and each remaining segment is merged recursively.</p>
 */
public final class LineMerger {

    private final int maxLength;

    public LineMerger(int maxLength) {
        this.maxLength = maxLength;
    }

    /** Signals that a set of lines cannot become one line. */
    private static final class CannotMerge extends Exception {
        private static final long serialVersionUID = 1L;

        CannotMerge() {
            super(null, null, false, false);
        }
    }

    public List<Line> maybeMergeLines(List<Line> lines) {
        if (lines.isEmpty() || allDisabled(lines)) {
            return new ArrayList<>(lines);
        }
        try {
            return createMergedLine(lines);
        } catch (CannotMerge e) {
            List<Line> merged = new ArrayList<>();
            List<Segment> segments = Segment.build(lines);
            if (segments.size() > 1) {
                segments = fixStandaloneOperators(segments);
                segments = maybeMergeOperators(segments, new ArrayList<>(OperatorPrecedence.tiers()));
                segments = maybeStubbornlyMerge(segments);
                for (Segment segment : segments) {
                    merged.addAll(maybeMergeLines(segment.getLines()));
                }
            } else {
                mergeSingleSegment(segments.get(0), merged);
            }
            return merged;
        }
    }

    /** Keeps the head line, then works on what follows it. */
    private void mergeSingleSegment(Segment segment, List<Line> merged) {
        List<Line> lines = segment.getLines();
        int headIndex = segment.headIndex();
        if (headIndex < 0) {
            merged.addAll(lines);
            return;
        }
        int includeEnd = headIndex + 1;
        if (headIndex == 0 && startsWithPlainOperator(lines.get(0))) {
            includeEnd = Math.min(headIndex + 2, lines.size());
        }
        merged.addAll(lines.subList(0, includeEnd));
        if (includeEnd >= lines.size()) return;

        List<Line> remaining = lines.subList(includeEnd, lines.size());
        int tailIndex = segment.tailIndex();
        if (!segment.tailClosesHead() || includeEnd >= tailIndex) {
            merged.addAll(maybeMergeLines(remaining));
            return;
        }

        List<Line> inner = maybeMergeLines(lines.subList(includeEnd, tailIndex));
        Node headFirst = merged.get(merged.size() - 1).firstContentNode();
        int firstContent = firstNonBlank(inner);
        if (headFirst != null && headFirst.is(TokenType.JINJA_BLOCK_KEYWORD) && firstContent >= 0) {
            Line keyword = merged.remove(merged.size() - 1);
            try {
                merged.addAll(createMergedLine(Arrays.asList(keyword, inner.get(firstContent))));
                merged.addAll(inner.subList(firstContent + 1, inner.size()));
            } catch (CannotMerge e) {
                merged.add(keyword);
                merged.addAll(inner);
            }
        } else {
            merged.addAll(inner);
        }
        merged.addAll(lines.subList(tailIndex, lines.size()));
    }

    // ---- merging a run of lines into one ----

    /**
     * Merges the content lines of {@code lines} into a single line; leading and trailing blank
     * or comment-only lines are kept around it.
     */
    private List<Line> createMergedLine(List<Line> lines) throws CannotMerge {
        if (lines.size() <= 1) {
            return new ArrayList<>(lines);
        }
        int leading = 0;
        while (leading < lines.size() && isNonContent(lines.get(leading))) leading++;
        int contentEnd = lines.size();
        while (contentEnd > leading && isNonContent(lines.get(contentEnd - 1))) contentEnd--;
        List<Line> content = lines.subList(leading, contentEnd);
        if (content.size() <= 1) {
            return new ArrayList<>(lines);
        }

        List<Node> nodes = new ArrayList<>();
        List<Comment> comments = new ArrayList<>();
        extractComponents(content, nodes, comments);
        Line mergedLine = new Line(content.get(0).getPrevious(), nodes, comments, false);
        if (mergedLine.length() > maxLength) {
            throw new CannotMerge();
        }

        List<Line> result = new ArrayList<>(lines.subList(0, leading));
        result.add(mergedLine);
        result.addAll(lines.subList(contentEnd, lines.size()));
        return result;
    }

    private List<Line> safeCreateMergedLine(List<Line> lines) {
        try {
            return createMergedLine(lines);
        } catch (CannotMerge e) {
            return new ArrayList<>(lines);
        }
    }

    private static void extractComponents(List<Line> lines, List<Node> nodes, List<Comment> comments)
            throws CannotMerge {
        int lastNonBlank = -1;
        int firstCode = -1;
        int lastCode = -1;
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line.isBlank()) continue;
            lastNonBlank = i;
            if (!line.isStandaloneComment()) {
                if (firstCode < 0) firstCode = i;
                lastCode = i;
            }
        }
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (i != lastNonBlank && !line.isBlank() && hasInlineComment(line)) throw new CannotMerge();
            if (i > firstCode && i < lastCode && (line.isStandaloneComment() || line.isBlank())) {
                throw new CannotMerge();
            }
        }

        Node finalNewline = null;
        boolean previousHadMultiline = false;
        int blockDepth = 0;
        for (Line line : lines) {
            boolean multiline = line.containsMultilineJinja();
            Node first = line.firstContentNode();
            if (previousHadMultiline) {
                boolean continues = (first != null && first.isOperator()) || line.startsWithComma();
                if (!continues || multiline) throw new CannotMerge();
            }
            if (!nodes.isEmpty()) {
                if (!previousHadMultiline && multiline) throw new CannotMerge();
                if (first != null && first.is(TokenType.JINJA_BLOCK_END) && blockDepth <= 0) throw new CannotMerge();
                if (first != null && first.is(TokenType.ON) && multiline) throw new CannotMerge();
            }

            for (Node node : line.getNodes()) {
                if (node.isFormattingDisabled() || node.is(TokenType.FMT_OFF) || node.is(TokenType.FMT_ON)
                        || node.dividesQueries()) {
                    throw new CannotMerge();
                }
                if (node.is(TokenType.JINJA_BLOCK_START)) {
                    if (blockDepth > 0) throw new CannotMerge();
                    blockDepth++;
                } else if (node.is(TokenType.JINJA_BLOCK_END)) {
                    blockDepth--;
                }
                if (node.isNewline()) {
                    finalNewline = node;
                    continue;
                }
                nodes.add(node);
            }
            previousHadMultiline = multiline;
            comments.addAll(line.getComments());
        }
        if (nodes.isEmpty()) throw new CannotMerge();
        if (finalNewline != null) nodes.add(finalNewline);
    }

    // ---- segment passes ----

    private List<Segment> fixStandaloneOperators(List<Segment> segments) {
        List<Segment> out = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            int headIndex = segment.headIndex();
            List<Line> lines = segment.getLines();
            if (headIndex >= 0 && lines.get(headIndex).isStandaloneOperator() && lines.size() > headIndex + 1) {
                int mergeEnd = Math.min(headIndex + 2, lines.size());
                try {
                    List<Line> rebuilt = new ArrayList<>(lines.subList(0, headIndex));
                    rebuilt.addAll(createMergedLine(lines.subList(headIndex, mergeEnd)));
                    rebuilt.addAll(lines.subList(mergeEnd, lines.size()));
                    out.add(new Segment(rebuilt));
                    continue;
                } catch (CannotMerge e) {
                    // leave the operator on its own line
                }
            }
            out.add(segment);
        }
        return out;
    }

    private List<Segment> maybeMergeOperators(List<Segment> segments, List<OperatorPrecedence> tiers) {
        if (segments.size() <= 1 || tiers.isEmpty()) {
            return segments;
        }
        List<OperatorPrecedence> remainingTiers = new ArrayList<>(tiers);
        OperatorPrecedence precedence = remainingTiers.remove(remainingTiers.size() - 1);
        List<Segment> out = new ArrayList<>();
        int head = 0;
        for (int i = 1; i < segments.size(); i++) {
            if (!continuesOperatorSequence(segments.get(i), precedence)) {
                out.addAll(tryMergeOperatorSegments(segments.subList(head, i), remainingTiers));
                head = i;
            }
        }
        out.addAll(tryMergeOperatorSegments(segments.subList(head, segments.size()), remainingTiers));
        return out;
    }

    private List<Segment> tryMergeOperatorSegments(List<Segment> segments, List<OperatorPrecedence> tiers) {
        if (segments.size() <= 1) {
            return new ArrayList<>(segments);
        }
        List<Line> all = new ArrayList<>();
        for (Segment segment : segments) all.addAll(segment.getLines());
        try {
            return Collections.singletonList(new Segment(createMergedLine(all)));
        } catch (CannotMerge e) {
            return maybeMergeOperators(new ArrayList<>(segments), tiers);
        }
    }

    /**
     * A segment continues an operator run at {@code max} if it starts with a comma, or with an
     * operator no looser than {@code max} that does not follow a comma. {@code on} never does.
     */
    static boolean continuesOperatorSequence(Segment segment, OperatorPrecedence max) {
        Line head = segment.head();
        if (head == null) return true;
        if (head.startsWithComma()) return true;
        Node first = head.firstContentNode();
        return first != null
                && first.isOperator()
                && !head.previousTokenIsComma()
                && !first.is(TokenType.ON)
                && OperatorPrecedence.of(first).isAtMost(max);
    }

    private List<Segment> maybeStubbornlyMerge(List<Segment> segments) {
        if (segments.size() <= 1) {
            return segments;
        }

        List<Segment> pass = new ArrayList<>();
        pass.add(segments.get(0));
        for (int i = 1; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            if (continuesOperatorSequence(segment, OperatorPrecedence.OTHER_TIGHT)) {
                pass = stubbornlyMerge(pass, segment);
            } else {
                pass.add(segment);
            }
        }
        if (pass.size() <= 1) return pass;

        boolean[] comparator = new boolean[pass.size()];
        for (int i = 0; i < pass.size(); i++) {
            comparator[i] = continuesOperatorSequence(pass.get(i), OperatorPrecedence.COMPARATORS);
        }
        List<Segment> previous = pass;
        pass = new ArrayList<>();
        pass.add(previous.get(0));
        for (int i = 1; i < previous.size(); i++) {
            Segment segment = previous.get(i);
            if (!comparator[i - 1] && comparator[i]
                    && new Segment(safeCreateMergedLine(segment.getLines())).tailClosesHead()) {
                pass = stubbornlyMerge(pass, segment);
            } else {
                pass.add(segment);
            }
        }
        if (pass.size() <= 1) return pass;

        previous = pass;
        pass = new ArrayList<>();
        pass.add(previous.get(0));
        for (int i = 1; i < previous.size(); i++) {
            Segment segment = previous.get(i);
            Segment next = (i + 1 < previous.size()) ? previous.get(i + 1) : null;
            if (shouldStubbornlyMerge(segment, pass.get(pass.size() - 1), next)) {
                pass = stubbornlyMerge(pass, segment);
            } else {
                pass.add(segment);
            }
        }
        return pass;
    }

    /** Join conditions and {@code lateral} after a comma belong on the line before them. */
    private static boolean shouldStubbornlyMerge(Segment segment, Segment previous, Segment next) {
        Line head = segment.head();
        Node first = (head == null) ? null : head.firstContentNode();
        if (first == null) return false;

        if (first.is(TokenType.ON)) {
            if (next != null) {
                Line nextHead = next.head();
                Node nextFirst = (nextHead == null) ? null : nextHead.firstContentNode();
                if (nextFirst != null && (nextFirst.isBooleanOperator() || nextFirst.isOperator())) return false;
                if (next.containsMultilineJinja()) return false;
            }
            return !segment.containsMultilineJinja();
        }
        if (first.is(TokenType.UNTERM_KEYWORD) && "using".equals(first.getValue())) {
            for (Line line : segment.getLines()) {
                for (Node node : line.getNodes()) {
                    if (node.is(TokenType.BRACKET_OPEN)) return true;
                }
            }
            return false;
        }
        if (first.is(TokenType.UNTERM_KEYWORD) && "lateral".equals(first.getValue())) {
            Line tail = previous.tail();
            return tail != null && tail.endsWithComma();
        }
        return false;
    }

    /**
     * Tries, in order: the whole previous segment plus this head, the previous tail plus this
     * whole segment, the previous tail plus this head. Keeps both segments if none fits.
     */
    private List<Segment> stubbornlyMerge(List<Segment> previousSegments, Segment segment) {
        List<Segment> out = new ArrayList<>(previousSegments);
        if (out.isEmpty()) {
            out.add(segment);
            return out;
        }
        Segment previous = out.remove(out.size() - 1);
        int headIndex = segment.headIndex();
        if (headIndex < 0) {
            out.add(previous);
            out.add(segment);
            return out;
        }
        List<Line> segmentLines = segment.getLines();
        Line head = segmentLines.get(headIndex);
        List<Line> afterHead = segmentLines.subList(headIndex + 1, segmentLines.size());

        List<Line> attempt = new ArrayList<>(previous.getLines());
        attempt.add(head);
        try {
            List<Line> lines = createMergedLine(attempt);
            lines.addAll(afterHead);
            out.add(new Segment(lines));
            return out;
        } catch (CannotMerge e) {
            // try the previous tail next
        }

        int tailIndex = previous.tailIndex();
        if (tailIndex >= 0) {
            List<Line> before = previous.getLines().subList(0, tailIndex);
            Line tail = previous.getLines().get(tailIndex);

            attempt = new ArrayList<>();
            attempt.add(tail);
            attempt.addAll(segmentLines);
            try {
                List<Line> lines = new ArrayList<>(before);
                lines.addAll(createMergedLine(attempt));
                out.add(new Segment(lines));
                return out;
            } catch (CannotMerge e) {
                // and finally just the head
            }

            try {
                List<Line> lines = new ArrayList<>(before);
                lines.addAll(createMergedLine(Arrays.asList(tail, head)));
                lines.addAll(afterHead);
                out.add(new Segment(lines));
                return out;
            } catch (CannotMerge e) {
                // keep both
            }
        }
        out.add(previous);
        out.add(segment);
        return out;
    }

    // ---- helpers ----

    private static boolean allDisabled(List<Line> lines) {
        for (Line line : lines) {
            if (!line.isFormattingDisabled()) return false;
        }
        return true;
    }

    private static boolean isNonContent(Line line) {
        return line.isBlank() || line.isStandaloneComment();
    }

    private static boolean hasInlineComment(Line line) {
        for (Comment comment : line.getComments()) {
            if (comment.isInline()) return true;
        }
        return false;
    }

    private static boolean startsWithPlainOperator(Line line) {
        Node first = line.firstContentNode();
        return first != null && first.isOperator() && !first.isBracketOperator();
    }

    private static int firstNonBlank(List<Line> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) return i;
        }
        return -1;
    }
}
