package org.dxworks.pycscope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command line of the indexer, parsed getopt style: flags may be clustered
 * ({@code -RS}), option arguments may be attached ({@code -fxref.out}) or
 * follow as the next word, and option parsing stops at the first operand or
 * at {@code --}.
 */
public class CommandLineOptions {
    public static final String USAGE = String.join("\n",
            "Usage: pycscope [-D] [-R] [-S] [-V] [-f reffile] [-i srclistfile] [files ...]",
            "",
            "-D              Dump the concrete syntax tree generated for each file",
            "-R              Recurse directories for files",
            "-S              Interpret simple strings as symbols",
            "-V              Print version and exit",
            "-f reffile      Use 'reffile' as cross-ref file name instead of 'cscope.out'",
            "-i srclistfile  Use the contents of 'srclistfile' as the list of source files to scan");

    private boolean dumpTree;
    private boolean recurse;
    private boolean stringsAsSymbols;
    private boolean printVersion;
    private String indexFileName;
    private final List<String> sourceListFiles = new ArrayList<>();
    private final List<String> operands = new ArrayList<>();

    private CommandLineOptions() {}

    public static CommandLineOptions parse(String[] args) {
        CommandLineOptions options = new CommandLineOptions();
        int i = 0;
        while (i < args.length) {
            String arg = args[i];
            if ("--".equals(arg)) {
                i++;
                break;
            }
            if (!arg.startsWith("-") || arg.length() == 1) {
                break;
            }
            for (int pos = 1; pos < arg.length(); pos++) {
                char flag = arg.charAt(pos);
                switch (flag) {
                    case 'D' -> options.dumpTree = true;
                    case 'R' -> options.recurse = true;
                    case 'S' -> options.stringsAsSymbols = true;
                    case 'V' -> options.printVersion = true;
                    case 'f', 'i' -> {
                        String value;
                        if (pos + 1 < arg.length()) {
                            value = arg.substring(pos + 1);
                        } else if (i + 1 < args.length) {
                            value = args[++i];
                        } else {
                            throw new IllegalArgumentException("option -" + flag + " requires an argument");
                        }
                        if (flag == 'f') {
                            options.indexFileName = value;
                        } else {
                            options.sourceListFiles.add(value);
                        }
                        pos = arg.length();
                    }
                    default -> throw new IllegalArgumentException("option -" + flag + " not recognized");
                }
            }
            i++;
        }
        for (; i < args.length; i++) {
            options.operands.add(args[i]);
        }
        return options;
    }

    public boolean isDumpTree() {
        return dumpTree;
    }

    public boolean isRecurse() {
        return recurse;
    }

    public boolean isStringsAsSymbols() {
        return stringsAsSymbols;
    }

    public boolean isPrintVersion() {
        return printVersion;
    }

    /**
     * The {@code -f} value, or null when the option was not given.
     */
    public String getIndexFileName() {
        return indexFileName;
    }

    public List<String> getSourceListFiles() {
        return Collections.unmodifiableList(sourceListFiles);
    }

    public List<String> getOperands() {
        return Collections.unmodifiableList(operands);
    }
}
