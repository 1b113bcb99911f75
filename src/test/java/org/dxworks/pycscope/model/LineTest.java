package org.dxworks.pycscope.model;

import org.dxworks.pycscope.exception.MarkConflictException;
import org.dxworks.pycscope.exception.ShapeViolationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LineTest {

    @Test
    void render_LineWithoutSymbolIsEmpty() {
        Line line = new Line(3).append(new NonSymbol("pass"));

        assertFalse(line.hasSymbol());
        assertEquals("", line.render());
    }

    @Test
    void render_LeadingSymbolSitsAfterLineNumber() {
        Line line = new Line(1)
                .append(new Symbol("x", Mark.ASSIGN))
                .append(new NonSymbol("="))
                .append(new NonSymbol("1"));

        assertEquals("1 \n\t=x\n = 1\n\n", line.render());
    }

    @Test
    void render_LeadingNonSymbolSharesLineNumber() {
        Line line = new Line(7)
                .append(new NonSymbol("return"))
                .append(new Symbol("value"));

        assertEquals("7 return \nvalue\n\n", line.render());
    }

    @Test
    void append_MergesSymbolsWithSameMark() {
        Line line = new Line(1)
                .append(new NonSymbol("import"))
                .append(new Symbol("os", Mark.INCLUDE))
                .append(new Symbol(".", Mark.INCLUDE))
                .append(new Symbol("path", Mark.INCLUDE));

        assertEquals(2, line.getRuns().size());
        assertEquals("1 import \n\t~os.path\n\n", line.render());
    }

    @Test
    void append_KeepsSymbolsWithDifferentMarksApart() {
        Line line = new Line(1)
                .append(new Symbol("a", Mark.ASSIGN))
                .append(new Symbol("b"));

        assertEquals(2, line.getRuns().size());
        assertEquals("1 \n\t=a \nb\n\n", line.render());
    }

    @Test
    void append_MergesNonSymbolsWithBlank() {
        Line line = new Line(1)
                .append(new NonSymbol("("))
                .append(new NonSymbol(")"));

        assertEquals(1, line.getRuns().size());
        assertEquals("( )", line.getRuns().get(0).format());
    }

    @Test
    void append_FunctionEndAfterSymbolGetsSeparator() {
        Line line = new Line(4)
                .append(new NonSymbol("return"))
                .append(new Symbol("inner"))
                .append(Symbol.functionEnd());

        assertEquals(4, line.getRuns().size());
        assertEquals("4 return \ninner\n \n\t}\n\n", line.render());
    }

    @Test
    void append_FunctionEndAfterNonSymbol() {
        Line line = new Line(3)
                .append(new NonSymbol("pass"))
                .append(Symbol.functionEnd());

        assertTrue(line.hasSymbol());
        assertEquals("3 pass \n\t}\n\n", line.render());
    }

    @Test
    void constructor_RejectsNonPositiveNumber() {
        assertThrows(IllegalArgumentException.class, () -> new Line(0));
    }

    @Test
    void symbol_EmptyTextOnlyForFunctionEnd() {
        assertThrows(ShapeViolationException.class, () -> new Symbol(""));
        assertEquals("\t}", Symbol.functionEnd().format());
    }

    @Test
    void nonSymbol_RejectsEmptyText() {
        assertThrows(ShapeViolationException.class, () -> new NonSymbol(""));
    }

    @Test
    void symbol_MergeWithOtherMarkFails() {
        Symbol symbol = new Symbol("a", Mark.CLASS);

        assertThrows(MarkConflictException.class, () -> symbol.merge(new Symbol("b", Mark.GLOBAL)));
    }
}
