package com.biomodel.generator.parser.exception;

/**
 * A reaction sentence or clause does not have the shape its rule requires,
 * typically because a delimiter such as {@code -->} is missing.
 */
public class MalformedSentenceException extends ModelBuildException {

    private static final long serialVersionUID = 1L;
    private final String expectedDelimiter;

    public MalformedSentenceException(int lineNumber, String message) {
        super(lineNumber, message);
        this.expectedDelimiter = null;
    }

    public MalformedSentenceException(int lineNumber, String expectedDelimiter, String message) {
        super(lineNumber, "Use '" + expectedDelimiter + "' " + message);
        this.expectedDelimiter = expectedDelimiter;
    }

    public String getExpectedDelimiter() {
        return expectedDelimiter;
    }
}
