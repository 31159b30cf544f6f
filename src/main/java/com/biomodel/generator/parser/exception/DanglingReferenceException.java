package com.biomodel.generator.parser.exception;

import java.util.List;

/**
 * A parameter constraint points at a line whose parameters do not exist,
 * usually because that line uses a different reaction rule.
 */
public class DanglingReferenceException extends ModelBuildException {

    private static final long serialVersionUID = 1L;
    private final int referencedLine;
    private final List<String> missingParameters;

    public DanglingReferenceException(int lineNumber, int referencedLine, List<String> missingParameters) {
        super(lineNumber, "Cannot constrain parameters to line " + referencedLine + ": "
                + String.join(", ", missingParameters) + " not defined there."
                + " Different reaction rules in parameter constraints?");
        this.referencedLine = referencedLine;
        this.missingParameters = List.copyOf(missingParameters);
    }

    public int getReferencedLine() {
        return referencedLine;
    }

    public List<String> getMissingParameters() {
        return missingParameters;
    }
}
