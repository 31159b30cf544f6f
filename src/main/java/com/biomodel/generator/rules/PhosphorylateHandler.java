package com.biomodel.generator.rules;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;

/**
 * {@code E phosphorylates U --> P}: v = V*E*U/(K + U).
 */
public class PhosphorylateHandler extends AbstractReactionHandler {

    public PhosphorylateHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String kinase = requireName(line, line.getSubject());
        String[] parts = splitArrow(line, line.getObject(), "to specify the name of the phosphorylated protein.");
        String unphosphorylated = requireName(line, parts[0]);
        String phosphorylated = requireName(line, parts[1]);
        requireDistinct(line, unphosphorylated, phosphorylated);

        builder.recordPhosphorylation(unphosphorylated, phosphorylated);
        declareSpecies(line, builder, kinase, unphosphorylated, phosphorylated);
        addReaction(line, builder, param(line, "V") + "*" + kinase + "*" + unphosphorylated
                + "/(" + param(line, "K") + " + " + unphosphorylated + ")");
        flux(line, builder, unphosphorylated, -1);
        flux(line, builder, phosphorylated, +1);
    }
}
