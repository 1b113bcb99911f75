package org.dxworks.pycscope.analyzer;

import org.dxworks.pycscope.cst.CstNode;
import org.dxworks.pycscope.cst.TreeSitterCstBuilder;
import org.dxworks.pycscope.exception.CrossReferenceException;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.util.List;
import java.util.function.Consumer;

/**
 * Indexes one Python source file: parses it with tree-sitter, converts the
 * parse tree and walks it, producing the file's rendered database lines.
 */
public class PythonXrefAnalyzer {
    private static final TSLanguage PYTHON = new TreeSitterPython();

    private final boolean stringsAsSymbols;
    private final CstWalker walker;

    public PythonXrefAnalyzer(boolean stringsAsSymbols) {
        this(stringsAsSymbols, new CstWalker());
    }

    public PythonXrefAnalyzer(boolean stringsAsSymbols, CstWalker walker) {
        this.stringsAsSymbols = stringsAsSymbols;
        this.walker = walker;
    }

    /**
     * Parses, indexes and returns the database lines for one file.
     *
     * @throws CrossReferenceException when the file cannot be indexed; the
     *         exception carries the file path and the last line reached
     */
    public List<String> analyze(String filePath, String sourceCode) {
        return analyze(filePath, sourceCode, root -> { });
    }

    /**
     * Like {@link #analyze(String, String)}, handing the parsed tree to
     * {@code beforeIndex} before it is walked.
     */
    public List<String> analyze(String filePath, String sourceCode, Consumer<CstNode> beforeIndex) {
        if (sourceCode.isEmpty()) {
            return List.of();
        }
        try {
            CstNode root = parse(normalize(sourceCode));
            beforeIndex.accept(root);
            return index(root);
        } catch (CrossReferenceException e) {
            throw e.inFile(filePath);
        }
    }

    /**
     * Parses normalized source into the tree the indexer walks.
     */
    public CstNode parse(String normalizedSource) {
        TSParser parser = new TSParser();
        parser.setLanguage(PYTHON);
        TSTree tree = parser.parseString(null, normalizedSource);
        return TreeSitterCstBuilder.build(normalizedSource, tree.getRootNode());
    }

    public List<String> index(CstNode root) {
        TraversalContext ctx = new TraversalContext(stringsAsSymbols);
        walker.walk(ctx, root);
        return ctx.getLines();
    }

    /**
     * Strips a byte order mark, converts line endings to {@code \n} and makes
     * sure the text ends with a newline.
     */
    public static String normalize(String sourceCode) {
        String source = sourceCode;
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }
        source = source.replace("\r\n", "\n").replace("\r", "\n");
        if (!source.isEmpty() && !source.endsWith("\n")) {
            source += "\n";
        }
        return source;
    }
}
