package org.dxworks.pycscope.model;

/**
 * A piece of a source line as stored in the database: either a {@link Symbol}
 * or a {@link NonSymbol}.
 */
public interface TextRun {
    String format();
}
