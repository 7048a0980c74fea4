package org.dxworks.treeline.model;

import org.dxworks.treeline.parser.LineProblem;

public class SkippedLine {
    public int lineNumber;
    public String line;
    public LineProblem reason;

    public SkippedLine() {
    }

    public SkippedLine(int lineNumber, String line, LineProblem reason) {
        this.lineNumber = lineNumber;
        this.line = line;
        this.reason = reason;
    }
}
