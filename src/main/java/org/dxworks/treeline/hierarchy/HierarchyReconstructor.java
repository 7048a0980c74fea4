package org.dxworks.treeline.hierarchy;

import org.dxworks.treeline.parser.LineParser;
import org.dxworks.treeline.parser.LineProblem;
import org.dxworks.treeline.parser.ParsedLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a stream of tree lines into nodes with full paths.
 * <p>
 * The only state is a stack of ancestors (level, name) with strictly increasing
 * levels. Each accepted line pops every entry at its own level or deeper, takes
 * the remaining names as its parent path and is then pushed itself.
 * <p>
 * Line policy:
 * <ul>
 *     <li>the first non-blank line of a stream that has no connector is the
 *     root (level 0), and connector lines then sit one level below their
 *     indentation depth;</li>
 *     <li>blank lines and guide-only spacer rows are ignored;</li>
 *     <li>when bare names are accepted, connector-less text that starts on a unit
 *     boundary (the file lines of {@code tree /F}) is a child of the entry at
 *     its indentation;</li>
 *     <li>every other invalid line is reported to the {@link SkippedLineListener}
 *     and leaves the stack untouched.</li>
 * </ul>
 * Level jumps of more than one are accepted as they are and only counted.
 * <p>
 * Not thread-safe: use one instance per stream.
 */
public class HierarchyReconstructor {

    private static final SkippedLineListener IGNORE_SKIPPED = (lineNumber, line, problem) -> { };

    private final LineParser parser;
    private final boolean acceptBareNames;
    private final List<Ancestor> stack = new ArrayList<>();
    private SkippedLineListener skippedLineListener = IGNORE_SKIPPED;

    private int lineNumber;
    private int linesFed;
    private boolean started;
    private boolean hasRoot;
    private int skippedLines;
    private int depthDiscontinuities;

    public HierarchyReconstructor() {
        this(new LineParser(), false);
    }

    public HierarchyReconstructor(LineParser parser, boolean acceptBareNames) {
        this.parser = parser;
        this.acceptBareNames = acceptBareNames;
    }

    public void setSkippedLineListener(SkippedLineListener listener) {
        this.skippedLineListener = listener != null ? listener : IGNORE_SKIPPED;
    }

    public Optional<HierarchyNode> feed(String line) {
        return feed(line, lineNumber + 1);
    }

    /**
     * Feeds a line whose number in the source is known, for callers that drop
     * some lines (such as listing headers) before they reach the reconstructor.
     */
    public Optional<HierarchyNode> feed(String line, int lineNumber) {
        this.lineNumber = lineNumber;
        linesFed++;
        ParsedLine parsed = parser.parse(line);
        int levelOffset = hasRoot ? 1 : 0;

        if (parsed.isValid()) {
            started = true;
            return Optional.of(place(parsed.getDepth() + levelOffset, parsed.getDepth(), parsed.getName(), parsed.isLastSibling()));
        }
        if (parsed.getProblem() == LineProblem.BLANK || parsed.getProblem() == LineProblem.SPACER) {
            return Optional.empty();
        }
        if (!started && parsed.getProblem() == LineProblem.NO_CONNECTOR) {
            started = true;
            hasRoot = true;
            return Optional.of(place(0, 0, line.strip(), true));
        }
        if (acceptBareNames && isBareName(parsed)) {
            String name = line.substring(parsed.getUnparsedOffset()).stripTrailing();
            return Optional.of(place(parsed.getDepth() - 1 + levelOffset, parsed.getDepth(), name, false));
        }

        skippedLines++;
        skippedLineListener.onSkipped(lineNumber, line, parsed.getProblem());
        return Optional.empty();
    }

    /** Current ancestor chain, root first. */
    public List<String> currentPath() {
        List<String> names = new ArrayList<>(stack.size());
        for (Ancestor ancestor : stack) {
            names.add(ancestor.name);
        }
        return names;
    }

    public boolean hasRoot() {
        return hasRoot;
    }

    public int getLinesFed() {
        return linesFed;
    }

    public int getSkippedLines() {
        return skippedLines;
    }

    public int getDepthDiscontinuities() {
        return depthDiscontinuities;
    }

    public void reset() {
        stack.clear();
        lineNumber = 0;
        linesFed = 0;
        started = false;
        hasRoot = false;
        skippedLines = 0;
        depthDiscontinuities = 0;
    }

    private boolean isBareName(ParsedLine parsed) {
        return parsed.getProblem() == LineProblem.NO_CONNECTOR
                && parsed.getUnparsedOffset() >= 0
                && parsed.getDepth() > 0;
    }

    private HierarchyNode place(int level, int indentDepth, String name, boolean lastSibling) {
        while (!stack.isEmpty() && stack.get(stack.size() - 1).level >= level) {
            stack.remove(stack.size() - 1);
        }

        int expectedMaxLevel = stack.isEmpty() ? 0 : stack.get(stack.size() - 1).level + 1;
        if (level > expectedMaxLevel) {
            depthDiscontinuities++;
        }

        HierarchyNode node = new HierarchyNode(name, level, indentDepth, lineNumber, lastSibling, currentPath());
        stack.add(new Ancestor(level, name));
        return node;
    }

    private static final class Ancestor {
        final int level;
        final String name;

        Ancestor(int level, String name) {
            this.level = level;
            this.name = name;
        }
    }
}
