package org.dxworks.pycscope.analyzer;

import org.dxworks.pycscope.cst.CstNode;
import org.dxworks.pycscope.exception.MarkConflictException;
import org.dxworks.pycscope.exception.MissingMarkException;
import org.dxworks.pycscope.exception.ShapeViolationException;
import org.dxworks.pycscope.model.Mark;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Marks decided for terminals that have not been visited yet.
 * Each node is annotated at most once, and reading an annotation removes it.
 */
public class MarkAnnotations {
    private final Map<CstNode, Mark> marks = new IdentityHashMap<>();

    public void register(CstNode node, Mark mark) {
        if (node == null) {
            throw new ShapeViolationException("Expected a token to mark " + mark + ", found nothing");
        }
        if (!PythonNames.isMarkable(node)) {
            throw new ShapeViolationException("Expected a name or '.' token to mark " + mark + ", found " + node);
        }
        Mark previous = marks.putIfAbsent(node, mark);
        if (previous != null) {
            throw new MarkConflictException("Token '" + node.getText() + "' on line " + node.getLine()
                    + " is already marked " + previous + ", cannot mark it " + mark);
        }
    }

    public boolean contains(CstNode node) {
        return marks.containsKey(node);
    }

    public Mark take(CstNode node) {
        Mark mark = marks.remove(node);
        if (mark == null) {
            throw new MissingMarkException("No mark registered for token '" + node.getText() + "'");
        }
        return mark;
    }

    public int size() {
        return marks.size();
    }
}
