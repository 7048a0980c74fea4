package org.dxworks.treeline.parser;

import java.util.Objects;

/**
 * Outcome of parsing a single line. Valid lines carry the node name, the number
 * of indentation units before the connector and the connector itself; invalid
 * lines carry the reason and the depth scanned before giving up.
 */
public final class ParsedLine {

    private final int depth;
    private final String name;
    private final ConnectorKind connector;
    private final int connectorOffset;
    private final LineProblem problem;
    private final int unparsedOffset;

    private ParsedLine(int depth, String name, ConnectorKind connector, int connectorOffset,
                       LineProblem problem, int unparsedOffset) {
        this.depth = depth;
        this.name = name;
        this.connector = connector;
        this.connectorOffset = connectorOffset;
        this.problem = problem;
        this.unparsedOffset = unparsedOffset;
    }

    static ParsedLine valid(int depth, String name, ConnectorKind connector, int connectorOffset) {
        return new ParsedLine(depth, name, connector, connectorOffset, null, -1);
    }

    static ParsedLine invalid(int depth, LineProblem problem) {
        return new ParsedLine(depth, null, null, -1, problem, -1);
    }

    static ParsedLine invalid(int depth, LineProblem problem, int unparsedOffset) {
        return new ParsedLine(depth, null, null, -1, problem, unparsedOffset);
    }

    public boolean isValid() {
        return problem == null;
    }

    public int getDepth() {
        return depth;
    }

    /** Node name; {@code null} for invalid lines. */
    public String getName() {
        return name;
    }

    /** Connector kind; {@code null} for invalid lines. */
    public ConnectorKind getConnector() {
        return connector;
    }

    public boolean isLastSibling() {
        return connector == ConnectorKind.LAST;
    }

    /** Character offset of the connector glyph, or -1 for invalid lines. */
    public int getConnectorOffset() {
        return connectorOffset;
    }

    /** Reason the line was rejected; {@code null} for valid lines. */
    public LineProblem getProblem() {
        return problem;
    }

    /**
     * For {@link LineProblem#NO_CONNECTOR} lines whose text starts right on a unit
     * boundary (the way {@code tree /F} prints files), the offset of that text.
     * -1 otherwise.
     */
    public int getUnparsedOffset() {
        return unparsedOffset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParsedLine)) return false;
        ParsedLine that = (ParsedLine) o;
        return depth == that.depth
                && connectorOffset == that.connectorOffset
                && unparsedOffset == that.unparsedOffset
                && Objects.equals(name, that.name)
                && connector == that.connector
                && problem == that.problem;
    }

    @Override
    public int hashCode() {
        return Objects.hash(depth, name, connector, connectorOffset, problem, unparsedOffset);
    }

    @Override
    public String toString() {
        if (isValid()) {
            return "ParsedLine{depth=" + depth + ", name='" + name + "', connector=" + connector + "}";
        }
        return "ParsedLine{depth=" + depth + ", problem=" + problem + "}";
    }
}
