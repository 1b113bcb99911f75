package org.dxworks.pycscope.cst;

import java.util.Collections;
import java.util.List;

/**
 * A node of the concrete syntax tree handed to the indexer.
 *
 * Terminals carry a kind, their literal text and a 1-based line number;
 * non-terminals carry a kind and their ordered children. Kinds are the
 * grammar's node types, plus the synthetic layout tokens declared here.
 * Tree-sitter keeps newlines out of the tree, so there is no newline token.
 *
 * Equality is identity: two structurally identical nodes are distinct keys.
 */
public final class CstNode {
    public static final String INDENT = "INDENT";
    public static final String DEDENT = "DEDENT";
    public static final String ENDMARKER = "ENDMARKER";

    public static final String IDENTIFIER = "identifier";
    public static final String STRING = "string";
    public static final String DOT = ".";

    private final String kind;
    private final String text;
    private final int line;
    private final List<CstNode> children;

    private CstNode(String kind, String text, int line, List<CstNode> children) {
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.children = children;
    }

    public static CstNode terminal(String kind, String text, int line) {
        return new CstNode(kind, text == null ? "" : text, line, null);
    }

    public static CstNode nonTerminal(String kind, List<CstNode> children) {
        return new CstNode(kind, null, 0, Collections.unmodifiableList(children));
    }

    public boolean isTerminal() {
        return children == null;
    }

    public String getKind() {
        return kind;
    }

    public boolean is(String kind) {
        return this.kind.equals(kind);
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public List<CstNode> getChildren() {
        return children == null ? Collections.emptyList() : children;
    }

    public int getChildCount() {
        return children == null ? 0 : children.size();
    }

    public CstNode getChild(int index) {
        return children.get(index);
    }

    public CstNode getLastChild() {
        return children == null || children.isEmpty() ? null : children.get(children.size() - 1);
    }

    public CstNode findFirstChild(String kind) {
        for (CstNode child : getChildren()) {
            if (child.is(kind)) return child;
        }
        return null;
    }

    /**
     * The child following the first child of the given kind, or null.
     */
    public CstNode childAfter(String kind) {
        List<CstNode> nodes = getChildren();
        for (int i = 0; i < nodes.size() - 1; i++) {
            if (nodes.get(i).is(kind)) return nodes.get(i + 1);
        }
        return null;
    }

    @Override
    public String toString() {
        return isTerminal() ? kind + "(" + text + ")@" + line : kind + children;
    }
}
