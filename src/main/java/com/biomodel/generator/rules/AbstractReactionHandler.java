package com.biomodel.generator.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.biomodel.generator.model.FluxTerm;
import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.model.Reaction;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;
import com.biomodel.generator.parser.exception.InvalidNamingException;
import com.biomodel.generator.parser.exception.MalformedSentenceException;

/**
 * Common steps of every rule: register the parameters, apply the parameter
 * clause, then let the rule read its sentence.
 */
public abstract class AbstractReactionHandler implements ReactionHandler {

    static final String ARROW = "-->";
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ClauseExtractor clauseExtractor;

    protected AbstractReactionHandler(ClauseExtractor clauseExtractor) {
        this.clauseExtractor = clauseExtractor;
    }

    @Override
    public final void apply(ReactionLine line, List<String> parameterNames, ModelBuilder builder) {
        List<String> names = parameterNames(line, parameterNames);
        builder.registerParameters(line.getLineNumber(), names);
        clauseExtractor.applyParameterClause(line, names, builder);
        handle(line, builder);
    }

    /**
     * Parameter base names this line actually uses.
     */
    protected List<String> parameterNames(ReactionLine line, List<String> defaults) {
        return defaults;
    }

    protected abstract void handle(ReactionLine line, ModelBuilder builder);

    // ------------------------------------------------------------------ helpers

    /**
     * Splits {@code text} around {@code -->}; returns the trimmed left and right parts.
     */
    protected String[] splitArrow(ReactionLine line, String text, String purpose) {
        if (!text.contains(ARROW)) {
            throw new MalformedSentenceException(line.getLineNumber(), ARROW, purpose);
        }
        return new String[] {
                StringUtils.substringBefore(text, ARROW).trim(),
                StringUtils.substringAfter(text, ARROW).trim()
        };
    }

    /**
     * Product after an arrow that must directly follow the trigger phrase.
     */
    protected String arrowTarget(ReactionLine line, String purpose) {
        String[] parts = splitArrow(line, line.getObject(), purpose);
        if (!parts[0].isEmpty()) {
            throw new MalformedSentenceException(line.getLineNumber(),
                    "Unexpected '" + parts[0] + "' before '" + ARROW + "'.");
        }
        return parts[1];
    }

    /**
     * Rules whose sentence ends with the trigger phrase.
     */
    protected void requireNothingAfterPhrase(ReactionLine line) {
        if (!line.getObject().isEmpty()) {
            throw new MalformedSentenceException(line.getLineNumber(),
                    "Unexpected '" + line.getObject() + "' after '" + line.getPhrase() + "'.");
        }
    }

    protected String requireName(ReactionLine line, String name) {
        if (name == null || name.isEmpty()) {
            throw new MalformedSentenceException(line.getLineNumber(),
                    "Missing species name in '" + line.getSentence() + "'.");
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new InvalidNamingException(line.getLineNumber(), name,
                    "Species names may only contain letters, digits and '_', and must not start with a digit.");
        }
        return name;
    }

    protected void requireDistinct(ReactionLine line, String source, String product) {
        if (source.equals(product)) {
            throw new InvalidNamingException(line.getLineNumber(), product, "Use a different name.");
        }
    }

    /**
     * Applies the initial-value clause against the given species, then
     * registers them in the order given.
     */
    protected void declareSpecies(ReactionLine line, ModelBuilder builder, String... species) {
        List<String> distinct = new ArrayList<>();
        for (String name : species) {
            if (!distinct.contains(name)) {
                distinct.add(name);
            }
        }
        clauseExtractor.applyInitialValueClause(line, distinct, builder);
        builder.registerSpecies(distinct.toArray(new String[0]));
    }

    protected static String param(ReactionLine line, String baseName) {
        return baseName + line.getLineNumber();
    }

    protected static void addReaction(ReactionLine line, ModelBuilder builder, String rateLaw) {
        builder.addReaction(new Reaction(line.getLineNumber(), line.getRule(), line.getSentence(), rateLaw));
    }

    protected static void flux(ReactionLine line, ModelBuilder builder, String species, int coefficient) {
        builder.addFlux(species, FluxTerm.of(line.getLineNumber(), coefficient));
    }
}
