package org.dxworks.mdast.converter;

/**
 * Raised when a syntax node lacks a child its grammar guarantees. This points at a mismatch
 * between grammar and converter, not at malformed Markdown, so it is never recovered from
 * inside the conversion.
 */
public class ConversionException extends RuntimeException {

    private final String nodeKind;
    private final int from;
    private final int to;

    public ConversionException(String message, String nodeKind, int from, int to) {
        super(message + " (" + nodeKind + " at [" + from + ", " + to + "))");
        this.nodeKind = nodeKind;
        this.from = from;
        this.to = to;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }
}
