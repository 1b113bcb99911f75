package org.dxworks.pycscope.model;

/**
 * Classification marks understood by cscope (database format 15).
 * LOCAL is part of the vocabulary but no recognized shape produces it yet.
 */
public enum Mark {
    NONE(""),
    FILE("@"),
    FUNC_DEF("$"),
    FUNC_CALL("`"),
    FUNC_END("}"),
    INCLUDE("~"),
    ASSIGN("="),
    CLASS("c"),
    GLOBAL("g"),
    LOCAL("l");

    private final String code;

    Mark(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * A tab followed by the mark character, or the empty string for {@link #NONE}.
     */
    public String format() {
        return this == NONE ? "" : "\t" + code;
    }
}
