package org.dxworks.pycscope.exception;

/**
 * The parser reported the source as syntactically invalid.
 */
public class SourceSyntaxException extends CrossReferenceException {
    public SourceSyntaxException(String message, int line) {
        super(message);
        atLine(line);
    }
}
