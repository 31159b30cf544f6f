package com.biomodel.generator.rules;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;

/**
 * {@code A binds B --> C}: v = kf*A*B - kr*C. Binding a species to itself is
 * treated as dimerization.
 */
public class BindHandler extends AbstractReactionHandler {

    public BindHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String first = requireName(line, line.getSubject());
        String[] parts = splitArrow(line, line.getObject(), "to specify the name of the protein complex.");
        String second = requireName(line, parts[0]);
        String complex = requireName(line, parts[1]);
        requireDistinct(line, first, complex);
        requireDistinct(line, second, complex);

        declareSpecies(line, builder, first, second, complex);
        if (first.equals(second)) {
            DimerizeHandler.emit(line, builder, first, complex);
            return;
        }
        addReaction(line, builder, param(line, "kf") + "*" + first + "*" + second
                + " - " + param(line, "kr") + "*" + complex);
        flux(line, builder, first, -1);
        flux(line, builder, second, -1);
        flux(line, builder, complex, +1);
    }
}
