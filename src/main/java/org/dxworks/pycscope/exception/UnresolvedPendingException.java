package org.dxworks.pycscope.exception;

/**
 * Assignment-target bookkeeping was left dangling: a target was never visited,
 * or a second resolution was requested while one was still outstanding.
 */
public class UnresolvedPendingException extends CrossReferenceException {
    public UnresolvedPendingException(String message) {
        super(message);
    }
}
