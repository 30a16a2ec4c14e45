package org.unifi.petri.exceptions;

/**
 * Malformed construction input or net file text. {@link #getLine()} is 1-based,
 * or 0 when the text does not come from a file.
 */
public class NetParseException extends PetriNetException {

    private final int line;

    public NetParseException(String message) {
        super(message);
        this.line = 0;
    }

    public NetParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
    }

    public NetParseException(int line, String message, Throwable cause) {
        super("line " + line + ": " + message, cause);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
