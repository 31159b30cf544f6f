package com.biomodel.generator.rules;

import org.apache.commons.lang3.StringUtils;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;
import com.biomodel.generator.parser.exception.MalformedSentenceException;

/**
 * {@code C is dissociated into A and B}: v = kf*C - kr*A*B.
 */
public class IsDissociatedHandler extends AbstractReactionHandler {

    private static final String AND = " and ";

    public IsDissociatedHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String complex = requireName(line, line.getSubject());
        if (!line.getObject().contains(AND)) {
            throw new MalformedSentenceException(line.getLineNumber(), "and",
                    "to specify the names of the dissociated components.");
        }
        String first = requireName(line, StringUtils.substringBefore(line.getObject(), AND).trim());
        String second = requireName(line, StringUtils.substringAfter(line.getObject(), AND).trim());
        requireDistinct(line, complex, first);
        requireDistinct(line, complex, second);

        declareSpecies(line, builder, complex, first, second);
        addReaction(line, builder, param(line, "kf") + "*" + complex
                + " - " + param(line, "kr") + "*" + first + "*" + second);
        flux(line, builder, complex, -1);
        if (first.equals(second)) {
            flux(line, builder, first, +2);
        } else {
            flux(line, builder, first, +1);
            flux(line, builder, second, +1);
        }
    }
}
