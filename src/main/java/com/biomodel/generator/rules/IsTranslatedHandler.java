package com.biomodel.generator.rules;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;

/**
 * {@code mRNA is translated into protein}: v = kf*mRNA.
 */
public class IsTranslatedHandler extends AbstractReactionHandler {

    public IsTranslatedHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String mRNA = requireName(line, line.getSubject());
        String protein = requireName(line, line.getObject());
        requireDistinct(line, mRNA, protein);

        declareSpecies(line, builder, mRNA, protein);
        addReaction(line, builder, param(line, "kf") + "*" + mRNA);
        flux(line, builder, protein, +1);
    }
}
