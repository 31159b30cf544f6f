package com.biomodel.generator.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.biomodel.generator.lexicon.Prepositions;
import com.biomodel.generator.lexicon.ReactionRule;
import com.biomodel.generator.parser.exception.MalformedSentenceException;

/**
 * Normalizes and classifies input lines and splits reaction lines into their
 * sentence parts and clauses.
 */
public class LinePreprocessor {

    static final String OBSERVABLE_PREFIX = "@obs ";
    static final String SIMULATION_PREFIX = "@sim ";
    private static final String CLAUSE_SEPARATOR = "|";

    /**
     * Drops the comment, collapses whitespace runs and trims.
     */
    public String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return StringUtils.normalizeSpace(StringUtils.substringBefore(raw, "#"));
    }

    public SourceLine classify(int number, String raw) {
        String text = normalize(raw);
        LineKind kind;
        if (text.isEmpty()) {
            kind = LineKind.BLANK;
        } else if (text.startsWith(OBSERVABLE_PREFIX) || text.startsWith(SIMULATION_PREFIX)) {
            kind = LineKind.ANNOTATION;
        } else {
            kind = LineKind.REACTION;
        }
        return new SourceLine(number, raw, text, kind);
    }

    public List<SourceLine> classifyAll(List<String> rawLines) {
        List<SourceLine> lines = new ArrayList<>(rawLines.size());
        for (int i = 0; i < rawLines.size(); i++) {
            lines.add(classify(i + 1, rawLines.get(i)));
        }
        return lines;
    }

    /**
     * Raw text of every non-blank line mapped to the 1-based lines where it
     * appears, keeping only texts that appear more than once.
     */
    public Map<String, List<Integer>> indexDuplicates(List<SourceLine> lines) {
        Map<String, List<Integer>> occurrences = new LinkedHashMap<>();
        for (SourceLine line : lines) {
            if (!line.isBlank()) {
                occurrences.computeIfAbsent(line.getRaw(), key -> new ArrayList<>()).add(line.getNumber());
            }
        }
        occurrences.values().removeIf(numbers -> numbers.size() < 2);
        return occurrences;
    }

    /**
     * Part of a normalized reaction line before the first clause separator.
     */
    public String sentenceOf(String text) {
        return StringUtils.substringBefore(text, CLAUSE_SEPARATOR).trim();
    }

    /**
     * Splits a reaction line at the longest trigger phrase of {@code rule} found
     * in its sentence. When only the preposition-less form of a phrase occurs,
     * that form is used and a leading preposition is dropped from the object.
     *
     * @throws MalformedSentenceException if the line has more than two clause separators
     */
    public ReactionLine split(SourceLine line, ReactionRule rule, List<String> phrases) {
        String text = line.getText();
        if (StringUtils.countMatches(text, CLAUSE_SEPARATOR) > 2) {
            throw new MalformedSentenceException(line.getNumber(),
                    "A reaction takes at most two '|' separators: sentence | parameters | initial values.");
        }
        String[] parts = text.split("\\|", -1);
        String sentence = parts[0].trim();

        String phrase = longestOccurring(sentence, phrases);
        boolean stripped = false;
        if (phrase == null) {
            List<String> strippedPhrases = phrases.stream().map(Prepositions::stripTrailing).toList();
            phrase = longestOccurring(sentence, strippedPhrases);
            stripped = true;
        }
        if (phrase == null) {
            throw new MalformedSentenceException(line.getNumber(),
                    "'" + sentence + "' does not contain a phrase of " + rule.getId() + ".");
        }

        int index = sentence.indexOf(phrase);
        String subject = sentence.substring(0, index).trim();
        String object = sentence.substring(index + phrase.length()).trim();
        if (stripped) {
            object = Prepositions.stripLeading(object);
        }

        return ReactionLine.builder()
                .lineNumber(line.getNumber())
                .text(text)
                .sentence(sentence)
                .rule(rule)
                .phrase(phrase.trim())
                .subject(subject)
                .object(object)
                .parameterClause(parts.length > 1 ? parts[1].trim() : "")
                .initialValueClause(parts.length > 2 ? parts[2].trim() : "")
                .build();
    }

    private static String longestOccurring(String sentence, List<String> phrases) {
        String best = null;
        for (String phrase : phrases) {
            if (sentence.contains(phrase) && (best == null || phrase.length() > best.length())) {
                best = phrase;
            }
        }
        return best;
    }
}
