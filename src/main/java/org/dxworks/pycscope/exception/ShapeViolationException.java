package org.dxworks.pycscope.exception;

/**
 * A grammar shape was expected but the tree did not contain it, e.g. a
 * function definition without a name after {@code def}.
 */
public class ShapeViolationException extends CrossReferenceException {
    public ShapeViolationException(String message) {
        super(message);
    }
}
