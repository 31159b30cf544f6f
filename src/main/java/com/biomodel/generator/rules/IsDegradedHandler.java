package com.biomodel.generator.rules;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;

/**
 * {@code species is degraded}: v = kf*species.
 */
public class IsDegradedHandler extends AbstractReactionHandler {

    public IsDegradedHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String species = requireName(line, line.getSubject());
        requireNothingAfterPhrase(line);

        declareSpecies(line, builder, species);
        addReaction(line, builder, param(line, "kf") + "*" + species);
        flux(line, builder, species, -1);
    }
}
