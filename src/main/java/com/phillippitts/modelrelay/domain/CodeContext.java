package com.phillippitts.modelrelay.domain;

/**
 * Editor position a completion or explanation request refers to.
 *
 * @param filePath        file being edited, may be null for scratch buffers
 * @param language        language identifier such as {@code java} or {@code python}
 * @param cursorLine      zero-based line of the cursor
 * @param cursorColumn    zero-based column of the cursor
 * @param surroundingCode code around the cursor sent as context
 */
public record CodeContext(String filePath, String language, int cursorLine, int cursorColumn, String surroundingCode) {

    public CodeContext {
        if (cursorLine < 0 || cursorColumn < 0) {
            throw new IllegalArgumentException("Cursor position must be >= 0");
        }
        if (surroundingCode == null) {
            surroundingCode = "";
        }
    }
}
