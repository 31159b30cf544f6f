package com.biomodel.generator.rules;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;

/**
 * {@code E dephosphorylates P --> U}: v = V*E*P/(K + P).
 */
public class DephosphorylateHandler extends AbstractReactionHandler {

    public DephosphorylateHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String phosphatase = requireName(line, line.getSubject());
        String[] parts = splitArrow(line, line.getObject(), "to specify the name of the dephosphorylated protein.");
        String phosphorylated = requireName(line, parts[0]);
        String unphosphorylated = requireName(line, parts[1]);
        requireDistinct(line, phosphorylated, unphosphorylated);

        builder.recordPhosphorylation(unphosphorylated, phosphorylated);
        declareSpecies(line, builder, phosphatase, phosphorylated, unphosphorylated);
        addReaction(line, builder, param(line, "V") + "*" + phosphatase + "*" + phosphorylated
                + "/(" + param(line, "K") + " + " + phosphorylated + ")");
        flux(line, builder, phosphorylated, -1);
        flux(line, builder, unphosphorylated, +1);
    }
}
