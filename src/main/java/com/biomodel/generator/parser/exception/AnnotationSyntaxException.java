package com.biomodel.generator.parser.exception;

/**
 * An {@code @obs} or {@code @sim} line is malformed.
 */
public class AnnotationSyntaxException extends ModelBuildException {

    private static final long serialVersionUID = 1L;

    public AnnotationSyntaxException(int lineNumber, String message) {
        super(lineNumber, message);
    }
}
