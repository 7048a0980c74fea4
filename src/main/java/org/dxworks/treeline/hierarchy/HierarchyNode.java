package org.dxworks.treeline.hierarchy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node of a reconstructed tree, emitted once per accepted line.
 */
public final class HierarchyNode {

    private final String name;
    private final int depth;
    private final int indentDepth;
    private final int lineNumber;
    private final boolean lastSibling;
    private final List<String> fullPath;

    HierarchyNode(String name, int depth, int indentDepth, int lineNumber, boolean lastSibling,
                  List<String> parentPath) {
        this.name = name;
        this.depth = depth;
        this.indentDepth = indentDepth;
        this.lineNumber = lineNumber;
        this.lastSibling = lastSibling;
        List<String> path = new ArrayList<>(parentPath.size() + 1);
        path.addAll(parentPath);
        path.add(name);
        this.fullPath = Collections.unmodifiableList(path);
    }

    public String getName() {
        return name;
    }

    /** Tree level; the root line of a listing is level 0. */
    public int getDepth() {
        return depth;
    }

    /** Indentation units the parser counted before the name; 0 for the root line. */
    public int getIndentDepth() {
        return indentDepth;
    }

    /** 1-based line number within the stream fed to the reconstructor. */
    public int getLineNumber() {
        return lineNumber;
    }

    public boolean isLastSibling() {
        return lastSibling;
    }

    public List<String> getFullPath() {
        return fullPath;
    }

    public List<String> getParentPath() {
        return fullPath.subList(0, fullPath.size() - 1);
    }

    public String joinedPath(String separator) {
        return String.join(separator, fullPath);
    }

    @Override
    public String toString() {
        return "HierarchyNode{" + joinedPath("/") + " @" + depth + "}";
    }
}
