package org.dxworks.pycscope.exception;

/**
 * Base class for failures that abort indexing of a single source file.
 * The file path and the last terminal line seen are attached by the driver
 * once the failure leaves the tree walk.
 */
public abstract class CrossReferenceException extends RuntimeException {
    private String filePath;
    private int line;

    protected CrossReferenceException(String message) {
        super(message);
    }

    protected CrossReferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getFilePath() {
        return filePath;
    }

    public int getLine() {
        return line;
    }

    public CrossReferenceException inFile(String filePath) {
        if (this.filePath == null) {
            this.filePath = filePath;
        }
        return this;
    }

    public CrossReferenceException atLine(int line) {
        if (this.line == 0) {
            this.line = line;
        }
        return this;
    }

    /**
     * Formats the failure the way it is reported on the console:
     * {@code <path>: Line <n>: <message>}.
     */
    public String describe() {
        return filePath + ": Line " + line + ": " + getMessage();
    }
}
