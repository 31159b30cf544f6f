package com.biomodel.generator.parser.exception;

/**
 * The same phosphorylation event is referenced with two different species
 * names on separate lines.
 */
public class InconsistentNamingException extends ModelBuildException {

    private static final long serialVersionUID = 1L;
    private final String firstName;
    private final String secondName;

    public InconsistentNamingException(String firstName, String secondName) {
        super(0, "These species names should be same: '" + firstName + "' and '" + secondName + "'.");
        this.firstName = firstName;
        this.secondName = secondName;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getSecondName() {
        return secondName;
    }
}
