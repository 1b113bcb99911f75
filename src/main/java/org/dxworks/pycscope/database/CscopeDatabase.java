package org.dxworks.pycscope.database;

import org.dxworks.pycscope.model.Mark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The cross-reference data of a whole run: one entry per indexed file, each a
 * file mark followed by the file's rendered lines, in indexing order.
 * Entries are only ever appended.
 */
public class CscopeDatabase {
    private final String basePath;
    private final List<String> index = new ArrayList<>();
    private final List<String> fileNames = new ArrayList<>();

    public CscopeDatabase(String basePath) {
        this.basePath = basePath;
    }

    public String getBasePath() {
        return basePath;
    }

    public List<String> getFileNames() {
        return Collections.unmodifiableList(fileNames);
    }

    public int getFileCount() {
        return fileNames.size();
    }

    public void addFile(String relativePath, List<String> lines) {
        fileNames.add(relativePath);
        index.add("\n" + Mark.FILE.getCode() + relativePath + "\n\n");
        index.addAll(lines);
    }

    /**
     * Every file entry followed by the bare file mark that ends the symbol data.
     */
    public String body() {
        StringBuilder body = new StringBuilder();
        for (String entry : index) {
            body.append(entry);
        }
        return body.append('\n').append(Mark.FILE.getCode()).toString();
    }
}
