package org.dxworks.pycscope.exception;

/**
 * Thrown when a second mark is registered for an already marked node, or when
 * two symbols carrying different marks are merged.
 */
public class MarkConflictException extends CrossReferenceException {
    public MarkConflictException(String message) {
        super(message);
    }
}
