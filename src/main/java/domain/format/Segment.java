package domain.format;

import domain.analyze.Depth;
import domain.analyze.Line;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A run of consecutive lines the merger treats as a unit. Built fresh for every merge pass.
 */
final class Segment {

    private final List<Line> lines;

    Segment(List<Line> lines) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    List<Line> getLines() {
        return lines;
    }

    /** Index of the first non-blank line, or -1. */
    int headIndex() {
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) return i;
        }
        return -1;
    }

    Line head() {
        int i = headIndex();
        return i < 0 ? null : lines.get(i);
    }

    /** Index of the last non-blank line, or -1. */
    int tailIndex() {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (!lines.get(i).isBlank()) return i;
        }
        return -1;
    }

    Line tail() {
        int i = tailIndex();
        return i < 0 ? null : lines.get(i);
    }

    boolean containsMultilineJinja() {
        for (Line line : lines) {
            if (line.containsMultilineJinja()) return true;
        }
        return false;
    }

    /**
     * The last line closes the bracket or template block the first line opened, and everything
     * in between sits deeper.
     */
    boolean tailClosesHead() {
        if (lines.size() <= 1) return false;
        int headIndex = headIndex();
        int tailIndex = tailIndex();
        if (headIndex < 0 || headIndex == tailIndex) return false;

        Depth headDepth = lines.get(headIndex).depth();
        Line tail = lines.get(tailIndex);
        if (!tail.depth().equals(headDepth)) return false;

        List<Line> between = lines.subList(headIndex + 1, tailIndex);
        if (tail.closesBracketFromPreviousLine() && allDeeper(between, headDepth, true)) {
            return true;
        }
        return tail.closesSimpleJinjaBlock() && allDeeper(between, headDepth, false);
    }

    private static boolean allDeeper(List<Line> lines, Depth depth, boolean sql) {
        for (Line line : lines) {
            Depth d = line.depth();
            if (sql ? d.getSql() <= depth.getSql() : d.getJinja() <= depth.getJinja()) return false;
        }
        return true;
    }

    /**
     * Cuts {@code lines} into segments: each runs until a later line starts a new segment
     * relative to its first line's depth. A leading standalone operator keeps its operand.
     */
    static List<Segment> build(List<Line> lines) {
        List<Segment> segments = new ArrayList<>();
        int j = 0;
        while (j < lines.size()) {
            Depth target = lines.get(j).depth();
            int start = lines.get(j).isStandaloneOperator() ? j + 2 : j + 1;
            int end = lines.size();
            for (int i = start; i < lines.size(); i++) {
                if (lines.get(i).startsNewSegmentAtDepth(target)) {
                    end = i;
                    break;
                }
            }
            segments.add(new Segment(lines.subList(j, end)));
            j = end;
        }
        return segments;
    }

    @Override
    public String toString() {
        return "Segment" + lines;
    }
}
