package com.biomodel.generator.rules;

import java.util.EnumMap;
import java.util.Map;

import lombok.experimental.UtilityClass;

import com.biomodel.generator.lexicon.ReactionRule;
import com.biomodel.generator.parser.ClauseExtractor;

/**
 * Dispatch table from rule to handler.
 */
@UtilityClass
public class ReactionHandlers {

    public static Map<ReactionRule, ReactionHandler> defaultTable(ClauseExtractor clauseExtractor) {
        Map<ReactionRule, ReactionHandler> table = new EnumMap<>(ReactionRule.class);
        table.put(ReactionRule.DIMERIZE, new DimerizeHandler(clauseExtractor));
        table.put(ReactionRule.BIND, new BindHandler(clauseExtractor));
        table.put(ReactionRule.IS_DISSOCIATED, new IsDissociatedHandler(clauseExtractor));
        table.put(ReactionRule.IS_PHOSPHORYLATED, new IsPhosphorylatedHandler(clauseExtractor));
        table.put(ReactionRule.IS_DEPHOSPHORYLATED, new IsDephosphorylatedHandler(clauseExtractor));
        table.put(ReactionRule.PHOSPHORYLATE, new PhosphorylateHandler(clauseExtractor));
        table.put(ReactionRule.DEPHOSPHORYLATE, new DephosphorylateHandler(clauseExtractor));
        table.put(ReactionRule.TRANSCRIBE, new TranscribeHandler(clauseExtractor));
        table.put(ReactionRule.IS_TRANSLATED, new IsTranslatedHandler(clauseExtractor));
        table.put(ReactionRule.SYNTHESIZE, new SynthesizeHandler(clauseExtractor));
        table.put(ReactionRule.IS_SYNTHESIZED, new IsSynthesizedHandler(clauseExtractor));
        table.put(ReactionRule.DEGRADE, new DegradeHandler(clauseExtractor));
        table.put(ReactionRule.IS_DEGRADED, new IsDegradedHandler(clauseExtractor));
        table.put(ReactionRule.IS_TRANSLOCATED, new IsTranslocatedHandler(clauseExtractor));
        return table;
    }
}
