package com.biomodel.generator.rules;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;

/**
 * {@code M dimerizes --> D}: v = kf*M*M - kr*D.
 */
public class DimerizeHandler extends AbstractReactionHandler {

    public DimerizeHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String monomer = requireName(line, line.getSubject());
        String dimer = requireName(line, arrowTarget(line, "to specify the name of the dimer."));
        requireDistinct(line, monomer, dimer);
        declareSpecies(line, builder, monomer, dimer);
        emit(line, builder, monomer, dimer);
    }

    static void emit(ReactionLine line, ModelBuilder builder, String monomer, String dimer) {
        addReaction(line, builder, param(line, "kf") + "*" + monomer + "*" + monomer
                + " - " + param(line, "kr") + "*" + dimer);
        flux(line, builder, monomer, -2);
        flux(line, builder, dimer, +1);
    }
}
