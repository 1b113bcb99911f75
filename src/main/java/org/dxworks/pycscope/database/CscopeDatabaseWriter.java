package org.dxworks.pycscope.database;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link CscopeDatabase} in cscope's version 15 layout:
 * header, symbol data, then the trailer listing the source files.
 */
public final class CscopeDatabaseWriter {
    static final int VERSION = 15;
    /** Header characters surrounding the base path. */
    static final int HEADER_OVERHEAD = 25;

    private CscopeDatabaseWriter() {}

    public static void write(CscopeDatabase database, Path output) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            write(database, writer);
        }
    }

    public static void write(CscopeDatabase database, Writer out) throws IOException {
        String basePath = database.getBasePath();
        String body = database.body();
        long total = basePath.codePointCount(0, basePath.length()) + HEADER_OVERHEAD
                + body.codePointCount(0, body.length());

        out.write(String.format("cscope %d %s -c %010d", VERSION, basePath, total));
        out.write(body);

        String names = String.join("\n", database.getFileNames()) + "\n";
        out.write("\n1\n.\n0\n");
        out.write(database.getFileCount() + "\n");
        out.write(names.getBytes(StandardCharsets.UTF_8).length + "\n");
        out.write(names);
    }

    public static String toString(CscopeDatabase database) {
        StringWriter out = new StringWriter();
        try {
            write(database, out);
        } catch (IOException e) {
            throw new IllegalStateException("StringWriter does not fail", e);
        }
        return out.toString();
    }
}
