package org.dxworks.pycscope.analyzer;

import org.dxworks.pycscope.cst.CstNode;
import org.dxworks.pycscope.exception.ShapeViolationException;
import org.dxworks.pycscope.exception.UnresolvedPendingException;
import org.dxworks.pycscope.model.Line;
import org.dxworks.pycscope.model.TextRun;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * State threaded through the single pass over one file's tree.
 *
 * Holds the rendered lines that carry at least one symbol, the line being
 * assembled, the lookahead marks and pending assignment targets, and the
 * counters needed to interpret the tree as it streams by. A context serves
 * exactly one file.
 */
public class TraversalContext {
    static final int NO_FUNCTION = -1;

    final boolean stringsAsSymbols;
    final MarkAnnotations marks = new MarkAnnotations();
    final PendingAssignments pending = new PendingAssignments();
    /** Call nodes that form a decorator and are classified by the decorator rule instead. */
    final Set<CstNode> decoratorCalls = Collections.newSetFromMap(new IdentityHashMap<>());

    int indentDepth;
    int functionDepth = NO_FUNCTION;
    int importCount;
    boolean importing;
    int lastLine = 1;

    private final List<String> lines = new ArrayList<>();
    private Line line = new Line(1);

    public TraversalContext(boolean stringsAsSymbols) {
        this.stringsAsSymbols = stringsAsSymbols;
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    int currentLineNumber() {
        return line == null ? 0 : line.getNumber();
    }

    Line currentLine() {
        return line;
    }

    void append(TextRun run) {
        if (line == null) {
            throw new ShapeViolationException("Token after end of input");
        }
        line.append(run);
    }

    /**
     * Saves the current line if it has a symbol and starts a new one.
     */
    void commit(int nextLine) {
        if (line != null) {
            String rendered = line.render();
            if (!rendered.isEmpty()) {
                lines.add(rendered);
            }
        }
        line = nextLine > 0 ? new Line(nextLine) : null;
    }

    /**
     * Saves the current line; no further tokens are expected.
     */
    void commit() {
        commit(0);
    }

    void verifySettled() {
        if (!pending.isSettled()) {
            throw new UnresolvedPendingException(pending.size() + " assignment target(s) left unresolved");
        }
    }
}
