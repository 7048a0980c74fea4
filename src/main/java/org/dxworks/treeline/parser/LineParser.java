package org.dxworks.treeline.parser;

/**
 * Splits one line of tree line-art into its indentation depth and node name.
 * <p>
 * The indentation region is walked in fixed-width units to count depth, but the
 * boundary between indentation and name is the exact offset of the connector
 * glyph, wherever it falls inside its unit. Characters that follow the
 * connector's dash-fill in the same unit belong to the name and are kept.
 * <p>
 * Instances are stateless and may be shared between threads.
 */
public class LineParser {

    public static final int DEFAULT_INDENT_WIDTH = 4;

    private final int indentWidth;

    public LineParser() {
        this(DEFAULT_INDENT_WIDTH);
    }

    public LineParser(int indentWidth) {
        if (indentWidth <= 0) {
            throw new IllegalArgumentException("Indent width must be positive: " + indentWidth);
        }
        this.indentWidth = indentWidth;
    }

    public ParsedLine parse(String line) {
        if (line == null) {
            throw new IllegalArgumentException("line must not be null");
        }
        String text = stripLineTerminator(line);
        if (text.isBlank()) {
            return ParsedLine.invalid(0, LineProblem.BLANK);
        }

        IndentScanner scanner = new IndentScanner(text, indentWidth);
        scanner.scan();
        if (scanner.problem != null) {
            return ParsedLine.invalid(scanner.depth, scanner.problem, scanner.unparsedOffset);
        }

        int nameStart = skipConnectorPrefix(text, scanner.connectorOffset);
        String name = text.substring(nameStart);
        if (name.isBlank()) {
            return ParsedLine.invalid(scanner.depth, LineProblem.EMPTY_NAME);
        }
        ConnectorKind kind = ConnectorKind.of(text.charAt(scanner.connectorOffset));
        return ParsedLine.valid(scanner.depth, name, kind, scanner.connectorOffset);
    }

    /**
     * Returns the offset of the first name character: one connector glyph, any
     * run of dash-fill, then at most one separator space.
     */
    static int skipConnectorPrefix(String text, int connectorOffset) {
        int pos = connectorOffset + 1;
        while (pos < text.length() && Glyphs.isDash(text.charAt(pos))) {
            pos++;
        }
        if (pos < text.length() && text.charAt(pos) == ' ') {
            pos++;
        }
        return pos;
    }

    private static String stripLineTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }

    /**
     * Cursor over the indentation region. Depth is counted per unit; the scan
     * stops on the connector glyph itself, never on the end of its unit.
     */
    private static class IndentScanner {
        private final String text;
        private final int width;

        int cursor = 0;
        int depth = 0;
        int connectorOffset = -1;
        int unparsedOffset = -1;
        LineProblem problem;

        IndentScanner(String text, int width) {
            this.text = text;
            this.width = width;
        }

        void scan() {
            while (connectorOffset < 0 && problem == null) {
                if (cursor >= text.length()) {
                    problem = LineProblem.SPACER;
                    return;
                }
                scanUnit();
            }
        }

        private void scanUnit() {
            int unitStart = cursor;
            int unitEnd = Math.min(unitStart + width, text.length());

            for (int i = unitStart; i < unitEnd; i++) {
                char c = text.charAt(i);
                if (Glyphs.isConnector(c)) {
                    // a guide fragment before the connector is a compressed unit of its own
                    if (i > unitStart) {
                        depth++;
                    }
                    connectorOffset = i;
                    return;
                }
                if (Glyphs.isBar(c) && i > unitStart) {
                    depth++;
                    cursor = i;
                    return;
                }
                if (!Glyphs.isGuide(c)) {
                    problem = LineProblem.NO_CONNECTOR;
                    if (i == unitStart) {
                        unparsedOffset = i;
                    }
                    return;
                }
            }

            if (unitEnd - unitStart < width) {
                // separator rows with their trailing spaces trimmed end on a bar
                problem = Glyphs.isBar(text.charAt(unitEnd - 1))
                        ? LineProblem.SPACER
                        : LineProblem.TRUNCATED_INDENTATION;
                return;
            }
            depth++;
            cursor = unitEnd;
        }
    }
}
