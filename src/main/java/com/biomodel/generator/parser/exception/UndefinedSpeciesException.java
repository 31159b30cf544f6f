package com.biomodel.generator.parser.exception;

public class UndefinedSpeciesException extends ModelBuildException {

    private static final long serialVersionUID = 1L;
    private final String species;

    public UndefinedSpeciesException(int lineNumber, String species, String message) {
        super(lineNumber, message);
        this.species = species;
    }

    public static UndefinedSpeciesException notInReaction(int lineNumber, String species) {
        return new UndefinedSpeciesException(lineNumber, species,
                "Name '" + species + "' is not defined in this reaction.");
    }

    public static UndefinedSpeciesException notInModel(int lineNumber, String species) {
        return new UndefinedSpeciesException(lineNumber, species,
                "'" + species + "' is not defined in model species.");
    }

    public String getSpecies() {
        return species;
    }
}
