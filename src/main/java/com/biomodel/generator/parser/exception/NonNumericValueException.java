package com.biomodel.generator.parser.exception;

public class NonNumericValueException extends ModelBuildException {

    private static final long serialVersionUID = 1L;
    private final String value;

    public NonNumericValueException(int lineNumber, String subject, String value) {
        super(lineNumber, subject + " must be int or float, got '" + value + "'.");
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
