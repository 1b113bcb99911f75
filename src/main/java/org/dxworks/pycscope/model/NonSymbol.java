package org.dxworks.pycscope.model;

import org.dxworks.pycscope.exception.ShapeViolationException;

public final class NonSymbol implements TextRun {
    public static final String SEPARATOR = " ";

    private final StringBuilder text;

    public NonSymbol(String text) {
        if (text == null || text.isEmpty()) {
            throw new ShapeViolationException("Non-symbol text must not be empty");
        }
        this.text = new StringBuilder(text);
    }

    public static NonSymbol separator() {
        return new NonSymbol(SEPARATOR);
    }

    public String getText() {
        return text.toString();
    }

    public NonSymbol merge(NonSymbol other) {
        text.append(' ').append(other.text);
        return this;
    }

    @Override
    public String format() {
        return text.toString();
    }

    @Override
    public String toString() {
        return "<NonSymbol:" + format() + ">";
    }
}
