package org.dxworks.pycscope;

import org.dxworks.pycscope.analyzer.PythonXrefAnalyzer;
import org.dxworks.pycscope.cst.CstDumper;
import org.dxworks.pycscope.cst.CstNode;
import org.dxworks.pycscope.database.CscopeDatabase;
import org.dxworks.pycscope.database.CscopeDatabaseWriter;
import org.dxworks.pycscope.exception.CrossReferenceException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

public class App {
    public static final String VERSION = "1.1";

    public static void main(String[] args) {
        System.exit(run(args, Paths.get("").toAbsolutePath()));
    }

    /**
     * Runs the indexer with the given directory as base path.
     *
     * @return the process exit code
     */
    public static int run(String[] args, Path basePath) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("pycscope: " + e.getMessage());
            System.err.println(CommandLineOptions.USAGE);
            return 2;
        }

        if (options.isPrintVersion()) {
            System.out.println("pycscope: Version " + VERSION);
            return 0;
        }

        PycscopeConfig config = PycscopeConfig.load(basePath.resolve(PycscopeConfig.CONFIG_FILE_NAME)).with(options);

        List<String> operands = new ArrayList<>(options.getOperands());
        List<String> files;
        try {
            for (String listFile : options.getSourceListFiles()) {
                operands.addAll(SourceFileCollector.readSourceList(basePath.resolve(listFile)));
            }
            // search the current directory by default
            if (operands.isEmpty()) {
                operands.add(".");
            }
            files = new SourceFileCollector(basePath, options.isRecurse(), config.getMaxFileLines()).collect(operands);
        } catch (IOException e) {
            System.err.println("pycscope: " + e.getMessage());
            return 1;
        }

        System.out.println("Indexing " + files.size() + " Python source files in " + basePath);
        Instant startTime = Instant.now();

        CscopeDatabase database = new CscopeDatabase(basePath.toString());
        PythonXrefAnalyzer analyzer = new PythonXrefAnalyzer(config.isStringsAsSymbols());
        int errorCount = indexFiles(database, basePath, files, analyzer, options.isDumpTree());

        Path output = basePath.resolve(config.getIndexFileName());
        try {
            CscopeDatabaseWriter.write(database, output);
        } catch (IOException e) {
            System.err.println("pycscope: cannot write " + output + ": " + e.getMessage());
            return 1;
        }

        System.out.println("Indexed " + database.getFileCount() + " files in "
                + Duration.between(startTime, Instant.now()).toMillis() + " ms");
        if (errorCount > 0) {
            System.out.println("Files with errors: " + errorCount);
        }
        System.out.println("Cross-reference written to: " + output);
        return 0;
    }

    /**
     * Indexes the files one after another into the database. A file that fails
     * is reported and left out; files indexed before it are unaffected.
     *
     * @return the number of files that could not be indexed
     */
    public static int indexFiles(CscopeDatabase database, Path basePath, List<String> files,
                                 PythonXrefAnalyzer analyzer, boolean dumpTree) {
        int errorCount = 0;
        for (String relativePath : files) {
            try {
                List<String> lines = analyzeFile(basePath, relativePath, analyzer, dumpTree);
                database.addFile(relativePath, lines);
            } catch (IOException e) {
                // can't read the file, report it and move on
                System.err.println("pycscope: " + relativePath + ": " + e.getMessage());
                errorCount++;
            } catch (CrossReferenceException e) {
                System.err.println("pycscope: " + e.describe());
                errorCount++;
            }
        }
        return errorCount;
    }

    public static List<String> analyzeFile(Path basePath, String relativePath, PythonXrefAnalyzer analyzer,
                                           boolean dumpTree) throws IOException {
        String sourceCode = Files.readString(basePath.resolve(relativePath), StandardCharsets.UTF_8);
        Consumer<CstNode> beforeIndex = dumpTree ? root -> System.out.println(CstDumper.dump(root)) : root -> { };
        return analyzer.analyze(relativePath, sourceCode, beforeIndex);
    }
}
