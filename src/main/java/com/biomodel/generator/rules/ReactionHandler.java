package com.biomodel.generator.rules;

import java.util.List;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ReactionLine;

/**
 * Turns one reaction line of a known rule into parameters, species, a rate law
 * and signed flux terms on the builder.
 */
public interface ReactionHandler {

    /**
     * @param line           the line, already split around its trigger phrase
     * @param parameterNames base names of the rule's kinetic parameters
     * @param builder        state of the build in progress
     */
    void apply(ReactionLine line, List<String> parameterNames, ModelBuilder builder);
}
