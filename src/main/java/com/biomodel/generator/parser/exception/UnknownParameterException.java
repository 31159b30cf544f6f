package com.biomodel.generator.parser.exception;

import java.util.List;

public class UnknownParameterException extends ModelBuildException {

    private static final long serialVersionUID = 1L;
    private final String parameter;
    private final List<String> availableParameters;

    public UnknownParameterException(int lineNumber, String parameter, List<String> availableParameters) {
        super(lineNumber, "'" + parameter + "' is not a parameter of this rule. Available parameters are: "
                + String.join(", ", availableParameters) + ".");
        this.parameter = parameter;
        this.availableParameters = List.copyOf(availableParameters);
    }

    public UnknownParameterException(int lineNumber, String parameter) {
        super(lineNumber, "'" + parameter + "' is not defined in model parameters.");
        this.parameter = parameter;
        this.availableParameters = List.of();
    }

    public String getParameter() {
        return parameter;
    }

    public List<String> getAvailableParameters() {
        return availableParameters;
    }
}
