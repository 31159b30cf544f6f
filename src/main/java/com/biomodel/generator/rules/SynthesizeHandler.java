package com.biomodel.generator.rules;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;

/**
 * {@code catalyst synthesizes product}: v = kf*catalyst.
 */
public class SynthesizeHandler extends AbstractReactionHandler {

    public SynthesizeHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String catalyst = requireName(line, line.getSubject());
        String product = requireName(line, line.getObject());

        declareSpecies(line, builder, catalyst, product);
        addReaction(line, builder, param(line, "kf") + "*" + catalyst);
        flux(line, builder, product, +1);
    }
}
