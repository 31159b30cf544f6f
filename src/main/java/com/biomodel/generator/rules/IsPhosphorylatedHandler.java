package com.biomodel.generator.rules;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;

/**
 * {@code U is phosphorylated --> P}: v = kf*U - kr*P.
 */
public class IsPhosphorylatedHandler extends AbstractReactionHandler {

    public IsPhosphorylatedHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String unphosphorylated = requireName(line, line.getSubject());
        String phosphorylated = requireName(line,
                arrowTarget(line, "to specify the name of the phosphorylated protein."));
        requireDistinct(line, unphosphorylated, phosphorylated);

        builder.recordPhosphorylation(unphosphorylated, phosphorylated);
        declareSpecies(line, builder, unphosphorylated, phosphorylated);
        addReaction(line, builder, param(line, "kf") + "*" + unphosphorylated
                + " - " + param(line, "kr") + "*" + phosphorylated);
        flux(line, builder, unphosphorylated, -1);
        flux(line, builder, phosphorylated, +1);
    }
}
