package com.biomodel.generator.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.biomodel.generator.lexicon.ReactionRule;
import com.biomodel.generator.lexicon.RuleLexicon;
import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.model.OdeModel;
import com.biomodel.generator.parser.exception.DuplicateLineException;
import com.biomodel.generator.parser.exception.NoMatchingRuleException;
import com.biomodel.generator.rules.ReactionHandler;
import com.biomodel.generator.rules.ReactionHandlers;

/**
 * Compiles a model text into an {@link OdeModel}.
 *
 * Input format, one statement per line:
 * - Reaction: A binds B --> C | kf=1.0, kr=0.5 | A=10
 * - Parameter constraint: A binds D --> E | 3
 * - Observable: @obs total_A = u[A] + u[C]
 * - Simulation: @sim tspan: [0, 100]
 * - Comments: # comment
 *
 * Parsing is fail-fast: the first offending line aborts the build with a
 * {@link com.biomodel.generator.parser.exception.ModelBuildException}.
 */
public class ModelTextParser {
    private static final Logger log = LoggerFactory.getLogger(ModelTextParser.class);

    private final RuleLexicon lexicon;
    private final LinePreprocessor preprocessor = new LinePreprocessor();
    private final AnnotationParser annotationParser = new AnnotationParser();
    private final ConsistencyChecker consistencyChecker = new ConsistencyChecker();
    private final UnregisteredWordSuggester suggester;
    private final Map<ReactionRule, ReactionHandler> handlers;

    public ModelTextParser() {
        this(new RuleLexicon());
    }

    public ModelTextParser(RuleLexicon lexicon) {
        this(lexicon, UnregisteredWordSuggester.DEFAULT_THRESHOLD);
    }

    public ModelTextParser(RuleLexicon lexicon, double similarityThreshold) {
        this.lexicon = lexicon;
        this.suggester = new UnregisteredWordSuggester(similarityThreshold);
        this.handlers = ReactionHandlers.defaultTable(new ClauseExtractor());
    }

    public RuleLexicon getLexicon() {
        return lexicon;
    }

    public OdeModel parse(Path modelFile) throws IOException {
        log.debug("Reading model text {}", modelFile);
        return parse(Files.readAllLines(modelFile, StandardCharsets.UTF_8));
    }

    public OdeModel parse(List<String> rawLines) {
        lexicon.lock();
        ModelBuilder builder = new ModelBuilder();

        List<SourceLine> lines = preprocessor.classifyAll(rawLines);
        Map<String, List<Integer>> duplicates = preprocessor.indexDuplicates(lines);

        for (SourceLine line : lines) {
            if (line.isBlank()) {
                continue;
            }
            List<Integer> occurrences = duplicates.get(line.getRaw());
            if (occurrences != null) {
                throw new DuplicateLineException(line.getText(), occurrences);
            }

            if (line.getKind() == LineKind.ANNOTATION) {
                annotationParser.parse(line, builder);
                log.debug("line {}: annotation '{}'", line.getNumber(), line.getText());
            } else {
                parseReaction(line, builder);
            }
        }

        consistencyChecker.check(builder.getProteinPairs());
        OdeModel model = builder.build();
        log.debug("Built model with {} reactions, {} species, {} parameters",
                model.getReactions().size(), model.getSpecies().size(), model.getParameters().size());
        return model;
    }

    private void parseReaction(SourceLine line, ModelBuilder builder) {
        String sentence = preprocessor.sentenceOf(line.getText());
        ReactionRule rule = lexicon.match(sentence)
                .orElseThrow(() -> new NoMatchingRuleException(line.getNumber(), sentence,
                        suggester.suggest(sentence, lexicon.allPhrases()).orElse(null)));

        ReactionLine reaction = preprocessor.split(line, rule, lexicon.phrasesOf(rule));
        handlers.get(rule).apply(reaction, rule.getParameterNames(), builder);
        log.debug("line {}: {} '{}'", line.getNumber(), rule.getId(), reaction.getSentence());
    }
}
