package org.psfront.syntax;

/**
 * Parser configuration.
 *
 * @param tabWidth      Column width of a tab stop when computing token columns
 * @param initialColumn Reference column in force before any layout block is entered
 */
public record ParserOptions(int tabWidth, int initialColumn) {

    public static final String TAB_WIDTH_PROPERTY = "psfront.tabWidth";
    public static final String INITIAL_COLUMN_PROPERTY = "psfront.initialColumn";

    private static final int DEFAULT_TAB_WIDTH = 8;
    private static final int DEFAULT_INITIAL_COLUMN = 0;

    public ParserOptions {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("Tab width must be positive, got: " + tabWidth);
        }
        if (initialColumn < 0) {
            throw new IllegalArgumentException("Initial column cannot be negative, got: " + initialColumn);
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(DEFAULT_TAB_WIDTH, DEFAULT_INITIAL_COLUMN);
    }

    /**
     * Reads {@value #TAB_WIDTH_PROPERTY} and {@value #INITIAL_COLUMN_PROPERTY},
     * falling back to the defaults for unset properties.
     */
    public static ParserOptions fromSystemProperties() {
        return new ParserOptions(
                intProperty(TAB_WIDTH_PROPERTY, DEFAULT_TAB_WIDTH),
                intProperty(INITIAL_COLUMN_PROPERTY, DEFAULT_INITIAL_COLUMN));
    }

    public ParserOptions withTabWidth(int width) {
        return new ParserOptions(width, initialColumn);
    }

    public ParserOptions withInitialColumn(int column) {
        return new ParserOptions(tabWidth, column);
    }

    private static int intProperty(String name, int fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + name + " must be an integer, got: " + raw, e);
        }
    }
}
