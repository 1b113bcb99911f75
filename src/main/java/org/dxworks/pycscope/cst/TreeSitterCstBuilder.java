package org.dxworks.pycscope.cst;

import org.dxworks.pycscope.exception.SourceSyntaxException;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Converts a tree-sitter-python parse tree into the {@link CstNode} form the
 * indexer walks.
 *
 * Tree-sitter keeps indentation inside hidden scanner tokens, so the builder
 * restores it: every {@code block} that starts on a later line than the token
 * before it is wrapped in INDENT/DEDENT terminals, and the module ends with an
 * ENDMARKER. Comments and explicit line continuations are dropped, and string
 * literals are kept whole as single terminals.
 */
public final class TreeSitterCstBuilder {

    private static final Set<String> DROPPED = Set.of("comment", "line_continuation");
    private static final String BLOCK = "block";
    private static final String ERROR = "ERROR";

    private final byte[] sourceBytes;
    private final String source;
    private int lastLine;

    private TreeSitterCstBuilder(String source) {
        this.source = source;
        this.sourceBytes = source.getBytes(StandardCharsets.UTF_8);
    }

    public static CstNode build(String source, TSNode root) {
        if (root.hasError()) {
            throw new SourceSyntaxException("invalid syntax", firstErrorLine(root));
        }
        return new TreeSitterCstBuilder(source).convert(root);
    }

    private CstNode convert(TSNode root) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, lastLine));
        CstNode result = null;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next < frame.node.getChildCount()) {
                TSNode child = frame.node.getChild(frame.next++);
                if (child == null || child.isNull() || DROPPED.contains(child.getType())) {
                    continue;
                }
                if (isLeaf(child)) {
                    CstNode terminal = toTerminal(child);
                    if (terminal != null) {
                        frame.children.add(terminal);
                        lastLine = terminal.getLine();
                    }
                } else {
                    stack.push(new Frame(child, lastLine));
                }
                continue;
            }

            stack.pop();
            CstNode built = finish(frame, stack.isEmpty());
            if (stack.isEmpty()) {
                result = built;
            } else if (built != null) {
                stack.peek().children.add(built);
            }
        }
        return result;
    }

    private CstNode finish(Frame frame, boolean isRoot) {
        List<CstNode> children = frame.children;
        String type = frame.node.getType();

        if (isRoot) {
            children.add(CstNode.terminal(CstNode.ENDMARKER, "", endMarkerLine()));
            return CstNode.nonTerminal(type, children);
        }
        if (children.isEmpty()) {
            return null;
        }
        if (BLOCK.equals(type)) {
            int firstLine = firstTerminal(children.get(0)).getLine();
            if (firstLine > frame.lineBefore) {
                List<CstNode> indented = new ArrayList<>(children.size() + 2);
                indented.add(CstNode.terminal(CstNode.INDENT, "", firstLine));
                indented.addAll(children);
                indented.add(CstNode.terminal(CstNode.DEDENT, "", lastLine));
                children = indented;
            }
        }
        return CstNode.nonTerminal(type, children);
    }

    private static boolean isLeaf(TSNode node) {
        return node.getChildCount() == 0 || CstNode.STRING.equals(node.getType());
    }

    private CstNode toTerminal(TSNode node) {
        String text = textOf(node);
        if (text.isEmpty()) {
            return null;
        }
        String type = node.getType();
        // a string literal reports the line it ends on
        int line = CstNode.STRING.equals(type)
                ? node.getEndPoint().getRow() + 1
                : node.getStartPoint().getRow() + 1;
        return CstNode.terminal(type, text, line);
    }

    private String textOf(TSNode node) {
        int start = Math.max(0, node.getStartByte());
        int end = Math.min(sourceBytes.length, node.getEndByte());
        if (start >= end) return "";
        return new String(sourceBytes, start, end - start, StandardCharsets.UTF_8);
    }

    private int endMarkerLine() {
        int newlines = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') newlines++;
        }
        return newlines + 1;
    }

    private static CstNode firstTerminal(CstNode node) {
        CstNode current = node;
        while (!current.isTerminal()) {
            current = current.getChild(0);
        }
        return current;
    }

    static int firstErrorLine(TSNode root) {
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (node == null || node.isNull()) continue;
            if (ERROR.equals(node.getType()) || node.isMissing()) {
                return node.getStartPoint().getRow() + 1;
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                stack.push(node.getChild(i));
            }
        }
        return root.getStartPoint().getRow() + 1;
    }

    private static final class Frame {
        final TSNode node;
        final int lineBefore;
        final List<CstNode> children = new ArrayList<>();
        int next;

        Frame(TSNode node, int lineBefore) {
            this.node = node;
            this.lineBefore = lineBefore;
        }
    }
}
