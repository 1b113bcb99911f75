package org.dxworks.pycscope.exception;

public class MissingMarkException extends CrossReferenceException {
    public MissingMarkException(String message) {
        super(message);
    }
}
