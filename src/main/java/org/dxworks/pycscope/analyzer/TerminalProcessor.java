package org.dxworks.pycscope.analyzer;

import org.dxworks.pycscope.cst.CstNode;
import org.dxworks.pycscope.model.Mark;
import org.dxworks.pycscope.model.NonSymbol;
import org.dxworks.pycscope.model.Symbol;

/**
 * Turns terminals into symbol and non-symbol runs of the current line,
 * applying any mark registered for them earlier in the walk.
 */
public class TerminalProcessor {

    /**
     * @return the line number of the terminal
     */
    public int process(TraversalContext ctx, CstNode token) {
        int lineNo = token.getLine();
        String kind = token.getKind();

        if (CstNode.DEDENT.equals(kind)) {
            // handled ahead of any line change so the function end lands on
            // the last line of the body
            ctx.indentDepth--;
            if (ctx.indentDepth == ctx.functionDepth) {
                ctx.functionDepth = TraversalContext.NO_FUNCTION;
                ctx.append(Symbol.functionEnd());
            }
            return lineNo;
        }

        if (lineNo != ctx.currentLineNumber() && !CstNode.STRING.equals(kind)) {
            // a token on a new line; strings are exempt so multi-line literals
            // stay on the line they belong to
            ctx.commit(lineNo);
        }

        switch (kind) {
            case CstNode.INDENT -> ctx.indentDepth++;
            case CstNode.ENDMARKER -> ctx.commit();
            case CstNode.STRING -> appendString(ctx, token.getText());
            case CstNode.DOT -> {
                if (ctx.marks.contains(token)) {
                    // part of a dotted include, merges with the names around it
                    ctx.append(new Symbol(token.getText(), ctx.marks.take(token)));
                } else {
                    ctx.append(new NonSymbol(token.getText()));
                }
            }
            default -> {
                if (PythonNames.isNameToken(token)) {
                    appendName(ctx, token);
                } else {
                    ctx.append(new NonSymbol(token.getText()));
                }
            }
        }
        return lineNo;
    }

    private void appendName(TraversalContext ctx, CstNode token) {
        if (PythonNames.isReserved(token)) {
            if (ctx.marks.contains(token)) {
                // keywords never become symbols, whatever was registered for them
                ctx.marks.take(token);
            }
            ctx.append(new NonSymbol(token.getText()));
            return;
        }
        Mark mark = ctx.marks.contains(token) ? ctx.marks.take(token) : Mark.NONE;
        ctx.append(new Symbol(token.getText(), mark));
    }

    private void appendString(TraversalContext ctx, String literal) {
        if (ctx.stringsAsSymbols && PythonNames.isQuotedIdentifier(literal)) {
            // shown as [[ 'name' ]] in cscope so the quoted name is searchable
            ctx.append(new NonSymbol("[["));
            ctx.append(new Symbol(literal));
            ctx.append(new NonSymbol("]]"));
        } else {
            ctx.append(new NonSymbol(literal.replace("\n", "\\n")));
        }
    }
}
