package com.biomodel.generator.lexicon;

/**
 * Rejected attempt to extend the rule vocabulary.
 */
public class LexiconConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LexiconConfigurationException(String message) {
        super(message);
    }
}
