package com.biomodel.generator.rules;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;

/**
 * {@code protease degrades protein}: v = kf*protease.
 */
public class DegradeHandler extends AbstractReactionHandler {

    public DegradeHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String protease = requireName(line, line.getSubject());
        String protein = requireName(line, line.getObject());

        declareSpecies(line, builder, protease, protein);
        addReaction(line, builder, param(line, "kf") + "*" + protease);
        flux(line, builder, protein, -1);
    }
}
