package org.dxworks.treeline.hierarchy;

import org.dxworks.treeline.parser.LineProblem;

@FunctionalInterface
public interface SkippedLineListener {
    void onSkipped(int lineNumber, String line, LineProblem problem);
}
