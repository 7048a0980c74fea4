package org.dxworks.treeline.parser;

public enum ConnectorKind {
    /** {@code ├} or {@code +}: more siblings follow. */
    BRANCH,
    /** {@code └} or {@code \}: last sibling. */
    LAST;

    static ConnectorKind of(char connector) {
        return Glyphs.isLastSiblingConnector(connector) ? LAST : BRANCH;
    }
}
