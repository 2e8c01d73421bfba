package com.circuitsync.core.sexpr;

/**
 * Thrown when a document cannot be parsed or is structurally invalid.
 *
 * <p>Carries the source name and the location of the problem so callers can
 * report it without guessing. A parse that throws never yields a partial tree.
 */
public class DocumentFormatException extends RuntimeException {

    private final String source;
    private final int offset;
    private final int line;
    private final int column;

    /**
     * Creates a format error at a known location.
     *
     * @param source name of the parsed document (file name or description)
     * @param offset zero-based byte offset in the UTF-8 input
     * @param line one-based line
     * @param column one-based column
     * @param message problem description
     */
    public DocumentFormatException(String source, int offset, int line, int column, String message) {
        super(source + ":" + line + ":" + column + ": " + message);
        this.source = source;
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    /**
     * Creates a format error that is not tied to a character position.
     *
     * @param source name of the document
     * @param message problem description
     */
    public DocumentFormatException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
        this.offset = -1;
        this.line = -1;
        this.column = -1;
    }

    public String getSource() {
        return source;
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
