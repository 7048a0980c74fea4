package org.dxworks.treeline.parser;

/**
 * Character classes used by tree line-art, both the box-drawing set
 * ({@code ├── }, {@code └── }, {@code │   }) and the ASCII set printed by
 * {@code tree /A} ({@code +---}, {@code \---}, {@code |   }).
 */
public final class Glyphs {

    private Glyphs() {}

    public static boolean isConnector(char c) {
        return c == '├' || c == '└' || c == '+' || c == '\\';
    }

    public static boolean isLastSiblingConnector(char c) {
        return c == '└' || c == '\\';
    }

    public static boolean isBar(char c) {
        return c == '│' || c == '|';
    }

    public static boolean isGuide(char c) {
        return isBar(c) || c == ' ';
    }

    public static boolean isDash(char c) {
        return c == '─' || c == '-';
    }
}
