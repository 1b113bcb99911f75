package org.dxworks.pycscope.analyzer;

import org.dxworks.pycscope.cst.CstNode;

import java.util.List;

/**
 * Shorthands for building small trees by hand.
 */
final class CstTrees {
    private CstTrees() {}

    static CstNode leaf(String kind, String text, int line) {
        return CstNode.terminal(kind, text, line);
    }

    static CstNode name(String text, int line) {
        return CstNode.terminal(CstNode.IDENTIFIER, text, line);
    }

    static CstNode node(String kind, CstNode... children) {
        return CstNode.nonTerminal(kind, List.of(children));
    }

    static CstNode module(int endLine, CstNode... statements) {
        CstNode[] children = new CstNode[statements.length + 1];
        System.arraycopy(statements, 0, children, 0, statements.length);
        children[statements.length] = CstNode.terminal(CstNode.ENDMARKER, "", endLine);
        return CstNode.nonTerminal("module", List.of(children));
    }
}
