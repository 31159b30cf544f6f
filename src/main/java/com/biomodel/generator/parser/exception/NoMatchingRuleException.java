package com.biomodel.generator.parser.exception;

import java.util.Optional;

import com.biomodel.generator.parser.Suggestion;

/**
 * No reaction rule recognizes the sentence. May carry a "did you mean" hint.
 */
public class NoMatchingRuleException extends ModelBuildException {

    private static final long serialVersionUID = 1L;
    private final String sentence;
    private final transient Suggestion suggestion;

    public NoMatchingRuleException(int lineNumber, String sentence, Suggestion suggestion) {
        super(lineNumber, "Unregistered words in '" + sentence + "'"
                + (suggestion != null
                        ? ". Maybe: '" + suggestion.getPhrase() + "' instead of '" + suggestion.getMatchedText().trim() + "'."
                        : ""));
        this.sentence = sentence;
        this.suggestion = suggestion;
    }

    public String getSentence() {
        return sentence;
    }

    public Optional<Suggestion> getSuggestion() {
        return Optional.ofNullable(suggestion);
    }
}
