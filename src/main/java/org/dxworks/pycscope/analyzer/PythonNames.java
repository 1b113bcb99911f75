package org.dxworks.pycscope.analyzer;

import org.dxworks.pycscope.cst.CstNode;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical facts about Python names used while classifying tokens.
 */
public final class PythonNames {

    /** Python 3 keywords plus the builtin constants. */
    public static final Set<String> RESERVED_WORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except",
            "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
            "while", "with", "yield");

    /** Reserved only where the grammar uses them as keywords. */
    public static final Set<String> SOFT_KEYWORDS = Set.of("match", "case", "type");

    /** Decorators that do not count as calls. */
    public static final Set<String> NO_OP_DECORATORS = Set.of("property", "classmethod");

    private static final Pattern NAME = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private static final Pattern QUOTED_IDENTIFIER =
            Pattern.compile("^('|\"|'''|\"\"\")[A-Za-z_][A-Za-z_0-9]*('|\"|'''|\"\"\")$");

    private PythonNames() {}

    /**
     * A terminal spelled like a Python name: identifiers as well as keywords.
     */
    public static boolean isNameToken(CstNode node) {
        return node.isTerminal()
                && (node.is(CstNode.IDENTIFIER) || NAME.matcher(node.getText()).matches());
    }

    public static boolean isReserved(CstNode node) {
        String text = node.getText();
        if (RESERVED_WORDS.contains(text)) {
            return true;
        }
        // a grammar keyword token has its own spelling as its kind
        return SOFT_KEYWORDS.contains(text) && !node.is(CstNode.IDENTIFIER);
    }

    public static boolean isMarkable(CstNode node) {
        return node.isTerminal() && (isNameToken(node) || node.is(CstNode.DOT));
    }

    public static boolean isQuotedIdentifier(String literal) {
        return QUOTED_IDENTIFIER.matcher(literal).matches();
    }
}
