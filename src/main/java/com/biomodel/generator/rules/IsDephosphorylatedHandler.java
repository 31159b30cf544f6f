package com.biomodel.generator.rules;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;

/**
 * {@code P is dephosphorylated --> U}: v = V*P/(K + P).
 */
public class IsDephosphorylatedHandler extends AbstractReactionHandler {

    public IsDephosphorylatedHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String phosphorylated = requireName(line, line.getSubject());
        String unphosphorylated = requireName(line,
                arrowTarget(line, "to specify the name of the dephosphorylated protein."));
        requireDistinct(line, phosphorylated, unphosphorylated);

        builder.recordPhosphorylation(unphosphorylated, phosphorylated);
        declareSpecies(line, builder, phosphorylated, unphosphorylated);
        addReaction(line, builder, param(line, "V") + "*" + phosphorylated
                + "/(" + param(line, "K") + " + " + phosphorylated + ")");
        flux(line, builder, unphosphorylated, +1);
        flux(line, builder, phosphorylated, -1);
    }
}
