package org.dxworks.treeline.parser;

/**
 * Why a line was not recognized as a tree node.
 */
public enum LineProblem {
    /** Nothing but whitespace. */
    BLANK,
    /**
     * Only guide glyphs ending on a unit boundary or on a bar, the separator rows
     * of {@code tree /F}.
     */
    SPACER,
    /** Indentation was followed by name text without any connector. */
    NO_CONNECTOR,
    /** The line ends inside an indentation unit, on a space, before a connector appeared. */
    TRUNCATED_INDENTATION,
    /** A connector and its dash-fill with no name after them. */
    EMPTY_NAME
}
