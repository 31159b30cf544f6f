package com.biomodel.generator.parser.exception;

/**
 * Base type for every failure that aborts a model build.
 * Carries the 1-based line number where the failure was detected, or 0 when
 * the failure concerns the model as a whole.
 */
public class ModelBuildException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final int lineNumber;

    public ModelBuildException(int lineNumber, String message) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public boolean hasLineNumber() {
        return lineNumber > 0;
    }
}
