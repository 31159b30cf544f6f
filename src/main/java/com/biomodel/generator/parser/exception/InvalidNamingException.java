package com.biomodel.generator.parser.exception;

/**
 * A species name is not a valid identifier, or a product reuses the name of
 * the species it is derived from.
 */
public class InvalidNamingException extends ModelBuildException {

    private static final long serialVersionUID = 1L;
    private final String name;

    public InvalidNamingException(int lineNumber, String name, String message) {
        super(lineNumber, "'" + name + "' <- " + message);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
