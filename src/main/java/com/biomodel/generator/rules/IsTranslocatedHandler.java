package com.biomodel.generator.rules;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.biomodel.generator.model.FluxTerm;
import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.ReactionLine;
import com.biomodel.generator.parser.exception.MalformedSentenceException;
import com.biomodel.generator.parser.exception.NonNumericValueException;

/**
 * {@code pre is translocated [from X to Y] --> post (preVolume, postVolume)}.
 * Text between the phrase and the arrow only describes the compartments; the
 * volume pair may stand on either side of the arrow.
 * With equal or omitted volumes v = kf*pre - kr*post; otherwise
 * v = kf*pre - kr*(postVolume/preVolume)*post and the gain of {@code post} is
 * scaled by preVolume/postVolume.
 */
public class IsTranslocatedHandler extends AbstractReactionHandler {

    private static final Logger log = LoggerFactory.getLogger(IsTranslocatedHandler.class);

    private static final Pattern VOLUMES = Pattern.compile("\\(([^()]*)\\)");

    public IsTranslocatedHandler(ClauseExtractor clauseExtractor) {
        super(clauseExtractor);
    }

    @Override
    protected void handle(ReactionLine line, ModelBuilder builder) {
        String object = line.getObject();
        String preVolume = null;
        String postVolume = null;

        Matcher matcher = VOLUMES.matcher(object);
        if (matcher.find()) {
            String[] volumes = matcher.group(1).split(",", -1);
            if (volumes.length != 2) {
                throw new MalformedSentenceException(line.getLineNumber(),
                        "Compartment volumes are written as (pre_volume, post_volume).");
            }
            preVolume = requireVolume(line, volumes[0].trim());
            postVolume = requireVolume(line, volumes[1].trim());
            object = (object.substring(0, matcher.start()) + object.substring(matcher.end())).trim();
        }

        String pre = requireName(line, line.getSubject());
        String[] parts = splitArrow(line, object, "to specify the name of the species after translocation.");
        if (!parts[0].isEmpty()) {
            log.debug("line {}: ignoring compartment description '{}'", line.getLineNumber(), parts[0]);
        }
        String post = requireName(line, parts[1]);
        requireDistinct(line, pre, post);

        declareSpecies(line, builder, pre, post);
        boolean scaled = preVolume != null
                && new BigDecimal(preVolume).compareTo(new BigDecimal(postVolume)) != 0;
        if (scaled) {
            addReaction(line, builder, param(line, "kf") + "*" + pre + " - " + param(line, "kr")
                    + "*(" + postVolume + "/" + preVolume + ")*" + post);
            flux(line, builder, pre, -1);
            builder.addFlux(post, new FluxTerm(line.getLineNumber(), +1, preVolume + "/" + postVolume));
        } else {
            addReaction(line, builder, param(line, "kf") + "*" + pre + " - " + param(line, "kr") + "*" + post);
            flux(line, builder, pre, -1);
            flux(line, builder, post, +1);
        }
    }

    private static String requireVolume(ReactionLine line, String value) {
        if (!ClauseExtractor.isNumeric(value)) {
            throw new NonNumericValueException(line.getLineNumber(), "Compartment volume", value);
        }
        return value;
    }
}
