package org.dxworks.pycscope.analyzer;

import org.dxworks.pycscope.cst.CstNode;
import org.dxworks.pycscope.exception.CrossReferenceException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Single depth-first, left-to-right pass over a tree, driven by an explicit
 * stack so deeply nested code cannot exhaust the call stack.
 */
public class CstWalker {
    private final ShapeRecognizer shapes;
    private final TerminalProcessor terminals;

    public CstWalker() {
        this(new ShapeRecognizer(), new TerminalProcessor());
    }

    public CstWalker(ShapeRecognizer shapes, TerminalProcessor terminals) {
        this.shapes = shapes;
        this.terminals = terminals;
    }

    public void walk(TraversalContext ctx, CstNode root) {
        Deque<CstNode> stack = new ArrayDeque<>();
        stack.push(root);
        try {
            while (!stack.isEmpty()) {
                CstNode node = stack.pop();
                shapes.visit(ctx, node);
                if (node.isTerminal()) {
                    ctx.lastLine = terminals.process(ctx, node);
                    continue;
                }
                List<CstNode> children = node.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
            ctx.verifySettled();
        } catch (CrossReferenceException e) {
            throw e.atLine(ctx.lastLine);
        }
    }
}
