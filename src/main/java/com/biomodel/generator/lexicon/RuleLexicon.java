package com.biomodel.generator.lexicon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps each {@link ReactionRule} to its ordered trigger phrases.
 *
 * Phrases are stored with one leading space so that " binds" never matches
 * inside "forbids". The lexicon may be extended with {@link #register} until a
 * parse starts on it; afterwards it is locked.
 */
public class RuleLexicon {
    private static final Logger log = LoggerFactory.getLogger(RuleLexicon.class);

    private final Map<ReactionRule, List<String>> phrases = new EnumMap<>(ReactionRule.class);
    private boolean locked;

    public RuleLexicon() {
        for (ReactionRule rule : ReactionRule.values()) {
            List<String> words = new ArrayList<>();
            for (String phrase : rule.getDefaultPhrases()) {
                words.add(normalizePhrase(phrase));
            }
            phrases.put(rule, words);
        }
    }

    /**
     * Register a user-defined trigger phrase for the rule with the given identifier.
     *
     * @throws LexiconConfigurationException if the rule is unknown, the phrase is
     *         already registered, it overlaps a phrase of a different rule, or the
     *         lexicon is already in use by a parser
     */
    public void register(String ruleId, String phrase) {
        ReactionRule rule = ReactionRule.fromId(ruleId)
                .orElseThrow(() -> new LexiconConfigurationException(ruleId
                        + " is not defined in reaction rules. Choose a reaction rule from "
                        + String.join(", ", ReactionRule.ids())));
        register(rule, phrase);
    }

    public void register(ReactionRule rule, String phrase) {
        if (locked) {
            throw new LexiconConfigurationException(
                    "Cannot register '" + phrase + "': rule words must be registered before parsing.");
        }
        if (StringUtils.isBlank(phrase)) {
            throw new LexiconConfigurationException("Cannot register an empty rule word for " + rule.getId());
        }
        String candidate = normalizePhrase(phrase);

        for (Map.Entry<ReactionRule, List<String>> entry : phrases.entrySet()) {
            for (String registered : entry.getValue()) {
                boolean same = registered.equals(candidate);
                boolean overlapping = registered.contains(candidate) || candidate.contains(registered);
                if (same || (overlapping && entry.getKey() != rule)) {
                    throw new LexiconConfigurationException("Cannot register '" + candidate.trim()
                            + "'. Currently, '" + registered.trim() + "' is used in the rule: "
                            + entry.getKey().getId());
                }
            }
        }

        phrases.get(rule).add(candidate);
        log.debug("Registered rule word '{}' for {}", candidate.trim(), rule.getId());
    }

    /**
     * First rule, in lexicon order, one of whose phrases (ignoring a trailing
     * preposition) occurs in the sentence.
     */
    public Optional<ReactionRule> match(String sentence) {
        for (Map.Entry<ReactionRule, List<String>> entry : phrases.entrySet()) {
            for (String phrase : entry.getValue()) {
                if (sentence.contains(Prepositions.stripTrailing(phrase))) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public List<String> phrasesOf(ReactionRule rule) {
        return Collections.unmodifiableList(phrases.get(rule));
    }

    /**
     * Every registered phrase, grouped by rule in lexicon order.
     */
    public List<String> allPhrases() {
        List<String> all = new ArrayList<>();
        phrases.values().forEach(all::addAll);
        return all;
    }

    public void lock() {
        locked = true;
    }

    public boolean isLocked() {
        return locked;
    }

    static String normalizePhrase(String phrase) {
        return " " + StringUtils.normalizeSpace(phrase);
    }
}
