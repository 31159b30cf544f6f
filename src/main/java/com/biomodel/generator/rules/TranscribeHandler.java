package com.biomodel.generator.rules;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;
import com.biomodel.generator.parser.exception.MalformedSentenceException;

/**
 * Hill-type transcription.
 * <ul>
 *   <li>{@code TF transcribes mRNA}: v = V*TF^n/(K^n + TF^n)</li>
 *   <li>{@code TF1 and TF2 transcribe mRNA}: the activator becomes {@code (TF1*TF2)}</li>
 *   <li>{@code TF transcribes mRNA, repressed by R}: adds {@code (R/KF)^nF} to the denominator</li>
 * </ul>
 */
public class TranscribeHandler extends AbstractReactionHandler {

    static final String REPRESSOR = ", repressed by";
    private static final String AND = " and ";
    private static final List<String> REPRESSOR_PARAMETERS = List.of("KF", "nF");

    public TranscribeHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected List<String> parameterNames(ReactionLine line, List<String> defaults) {
        if (line.getObject().contains(REPRESSOR)) {
            return defaults;
        }
        return defaults.stream().filter(name -> !REPRESSOR_PARAMETERS.contains(name)).toList();
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String object = line.getObject();
        String mRNA;
        String repressor = null;
        if (object.contains(REPRESSOR)) {
            mRNA = requireName(line, StringUtils.substringBefore(object, REPRESSOR).trim());
            repressor = requireName(line, StringUtils.substringAfter(object, REPRESSOR).trim());
        } else if (object.contains(" ")) {
            throw new MalformedSentenceException(line.getLineNumber(), REPRESSOR.trim(),
                    "to describe negative regulation, e.g. 'TF transcribes mRNA, repressed by R'.");
        } else {
            mRNA = requireName(line, object);
        }

        String subject = line.getSubject();
        String activator;
        if (subject.contains(AND)) {
            String first = requireName(line, StringUtils.substringBefore(subject, AND).trim());
            String second = requireName(line, StringUtils.substringAfter(subject, AND).trim());
            requireDistinct(line, first, mRNA);
            requireDistinct(line, second, mRNA);
            if (repressor == null) {
                declareSpecies(line, builder, first, second, mRNA);
            } else {
                declareSpecies(line, builder, first, second, mRNA, repressor);
            }
            activator = "(" + first + "*" + second + ")";
        } else {
            String factor = requireName(line, subject);
            requireDistinct(line, factor, mRNA);
            if (repressor == null) {
                declareSpecies(line, builder, factor, mRNA);
            } else {
                declareSpecies(line, builder, factor, mRNA, repressor);
            }
            activator = factor;
        }

        String n = param(line, "n");
        StringBuilder rate = new StringBuilder()
                .append(param(line, "V")).append('*').append(activator).append('^').append(n)
                .append("/(")
                .append(param(line, "K")).append('^').append(n)
                .append(" + ").append(activator).append('^').append(n);
        if (repressor != null) {
            rate.append(" + (").append(repressor).append('/').append(param(line, "KF"))
                    .append(")^").append(param(line, "nF"));
        }
        rate.append(')');

        addReaction(line, builder, rate.toString());
        flux(line, builder, mRNA, +1);
    }
}
