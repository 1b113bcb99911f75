package org.dxworks.pycscope.model;

import org.dxworks.pycscope.exception.MarkConflictException;
import org.dxworks.pycscope.exception.ShapeViolationException;

public final class Symbol implements TextRun {
    private final Mark mark;
    private final StringBuilder text;

    public Symbol(String text) {
        this(text, Mark.NONE);
    }

    public Symbol(String text, Mark mark) {
        if (text == null || (text.isEmpty() && mark != Mark.FUNC_END)) {
            throw new ShapeViolationException("Symbol text may only be empty when marking a function end");
        }
        this.mark = mark == null ? Mark.NONE : mark;
        this.text = new StringBuilder(text);
    }

    public static Symbol functionEnd() {
        return new Symbol("", Mark.FUNC_END);
    }

    public Mark getMark() {
        return mark;
    }

    public String getText() {
        return text.toString();
    }

    public boolean hasMark(Mark other) {
        return mark == other;
    }

    /**
     * Appends the other symbol's text to this one; both must carry the same mark.
     */
    public Symbol merge(Symbol other) {
        if (other.mark != mark) {
            throw new MarkConflictException("Cannot merge symbol '" + other.getText() + "' marked " + other.mark
                    + " into '" + getText() + "' marked " + mark);
        }
        text.append(other.text);
        return this;
    }

    @Override
    public String format() {
        return mark.format() + text;
    }

    @Override
    public String toString() {
        return "<Symbol:" + format() + ">";
    }
}
