package com.biomodel.generator.rules;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.biomodel.generator.lexicon.ReactionRule;
import com.biomodel.generator.lexicon.RuleLexicon;
import com.biomodel.generator.model.DifferentialEquation;
import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.model.OdeModel;
import com.biomodel.generator.model.ProteinPair;
import com.biomodel.generator.model.Reaction;
import com.biomodel.generator.parser.ClauseExtractor;
import com.biomodel.generator.parser.LinePreprocessor;
import com.biomodel.generator.parser.ReactionLine;
import com.biomodel.generator.parser.exception.InvalidNamingException;
import com.biomodel.generator.parser.exception.MalformedSentenceException;
import com.biomodel.generator.parser.exception.NonNumericValueException;

import static org.assertj.core.api.Assertions.*;

class ReactionHandlersTest {

    private final RuleLexicon lexicon = new RuleLexicon();
    private final LinePreprocessor preprocessor = new LinePreprocessor();
    private final Map<ReactionRule, ReactionHandler> handlers = ReactionHandlers.defaultTable(new ClauseExtractor());
    private ModelBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ModelBuilder();
    }

    private void apply(int number, String text) {
        String sentence = preprocessor.sentenceOf(preprocessor.normalize(text));
        ReactionRule rule = lexicon.match(sentence).orElseThrow();
        ReactionLine line = preprocessor.split(preprocessor.classify(number, text), rule, lexicon.phrasesOf(rule));
        handlers.get(rule).apply(line, rule.getParameterNames(), builder);
    }

    private OdeModel applyAndBuild(int number, String text) {
        apply(number, text);
        return builder.build();
    }

    private static String rateOf(OdeModel model) {
        return model.getReactions().get(0).getStatement();
    }

    private static String equationOf(OdeModel model, String species) {
        return model.findEquation(species).map(DifferentialEquation::getStatement).orElseThrow();
    }

    @Test
    void testTableCoversEveryRule() {
        assertThat(handlers).containsOnlyKeys(ReactionRule.values());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "A dimerizes --> B                     | v[1] = kf1*A*A - kr1*B",
            "A binds B --> C                       | v[1] = kf1*A*B - kr1*C",
            "A binds A --> AA                      | v[1] = kf1*A*A - kr1*AA",
            "C is dissociated into A and B         | v[1] = kf1*C - kr1*A*B",
            "U is phosphorylated --> P             | v[1] = kf1*U - kr1*P",
            "P is dephosphorylated --> U           | v[1] = V1*P/(K1 + P)",
            "E phosphorylates U --> P              | v[1] = V1*E*U/(K1 + U)",
            "E dephosphorylates P --> U            | v[1] = V1*E*P/(K1 + P)",
            "TF transcribes m                      | v[1] = V1*TF^n1/(K1^n1 + TF^n1)",
            "A and B transcribe m                  | v[1] = V1*(A*B)^n1/(K1^n1 + (A*B)^n1)",
            "TF transcribes m, repressed by R      | v[1] = V1*TF^n1/(K1^n1 + TF^n1 + (R/KF1)^nF1)",
            "m is translated into P                | v[1] = kf1*m",
            "E synthesizes P                       | v[1] = kf1*E",
            "P is synthesized                      | v[1] = kf1",
            "E degrades P                          | v[1] = kf1*E",
            "P is degraded                         | v[1] = kf1*P",
            "A is translocated --> B               | v[1] = kf1*A - kr1*B",
            "A is translocated --> B (2, 2.0)      | v[1] = kf1*A - kr1*B",
            "A is translocated --> B (1, 0.5)      | v[1] = kf1*A - kr1*(0.5/1)*B",
    })
    void testRateLaws(String sentence, String expected) {
        assertThat(rateOf(applyAndBuild(1, sentence))).isEqualTo(expected);
    }

    @Test
    void testDimerizeEquations() {
        OdeModel model = applyAndBuild(1, "A dimerizes --> B");

        assertThat(model.getSpecies()).containsExactly("A", "B");
        assertThat(model.getDifferentialEquations()).extracting(DifferentialEquation::getStatement)
                .containsExactly("dA/dt = -2*v[1]", "dB/dt = +v[1]");
    }

    @Test
    void testBindToItselfActsAsDimerization() {
        OdeModel model = applyAndBuild(4, "A binds A --> AA");

        assertThat(model.getSpecies()).containsExactly("A", "AA");
        assertThat(equationOf(model, "A")).isEqualTo("dA/dt = -2*v[4]");
    }

    @Test
    void testBindEquations() {
        OdeModel model = applyAndBuild(2, "A binds B --> C");

        assertThat(model.getDifferentialEquations()).extracting(DifferentialEquation::getStatement)
                .containsExactly("dA/dt = -v[2]", "dB/dt = -v[2]", "dC/dt = +v[2]");
    }

    @Test
    void testDissociationIntoIdenticalComponents() {
        OdeModel model = applyAndBuild(1, "AA is dissociated into A and A");

        assertThat(model.getSpecies()).containsExactly("AA", "A");
        assertThat(equationOf(model, "A")).isEqualTo("dA/dt = +2*v[1]");
    }

    @Test
    void testDissociationNeedsAnd() {
        assertThatThrownBy(() -> apply(1, "C is dissociated into A, B"))
                .isInstanceOf(MalformedSentenceException.class)
                .extracting(e -> ((MalformedSentenceException) e).getExpectedDelimiter())
                .isEqualTo("and");
    }

    @Test
    void testPhosphorylationRecordsPair() {
        OdeModel model = applyAndBuild(1, "Kinase phosphorylates Fos --> pFos");

        assertThat(model.getSpecies()).containsExactly("Kinase", "Fos", "pFos");
        assertThat(model.getProteinPairs()).containsExactly(new ProteinPair("Fos", "pFos"));
        assertThat(model.findEquation("Kinase")).isEmpty();
    }

    @Test
    void testDephosphorylationSpeciesOrder() {
        OdeModel model = applyAndBuild(1, "pA is dephosphorylated --> A");

        assertThat(model.getSpecies()).containsExactly("pA", "A");
        assertThat(model.getDifferentialEquations()).extracting(DifferentialEquation::getStatement)
                .containsExactly("dA/dt = +v[1]", "dpA/dt = -v[1]");
        assertThat(model.getProteinPairs()).containsExactly(new ProteinPair("A", "pA"));
    }

    @Test
    void testTranscriptionParameters() {
        OdeModel model = applyAndBuild(3, "TF transcribes m");

        assertThat(model.getParameterNames()).containsExactly("V3", "K3", "n3");
        assertThat(model.getDifferentialEquations()).extracting(DifferentialEquation::getStatement)
                .containsExactly("dm/dt = +v[3]");
    }

    @Test
    void testTranscriptionWithRepressor() {
        OdeModel model = applyAndBuild(3, "TF transcribes m, repressed by R | KF=2, nF=1");

        assertThat(model.getParameterNames()).containsExactly("V3", "K3", "n3", "KF3", "nF3");
        assertThat(model.getSpecies()).containsExactly("TF", "m", "R");
    }

    @Test
    void testTranscriptionWithoutRepressorRejectsRepressorParameters() {
        assertThatThrownBy(() -> apply(1, "TF transcribes m | KF=2"))
                .hasMessageContaining("Available parameters are: V, K, n.");
    }

    @Test
    void testTranscriptionWithUnknownModifier() {
        assertThatThrownBy(() -> apply(1, "TF transcribes m inhibited by R"))
                .isInstanceOf(MalformedSentenceException.class)
                .extracting(e -> ((MalformedSentenceException) e).getExpectedDelimiter())
                .isEqualTo(", repressed by");
    }

    @Test
    void testTranslation() {
        OdeModel model = applyAndBuild(1, "m is translated into P");

        assertThat(model.getSpecies()).containsExactly("m", "P");
        assertThat(model.getDifferentialEquations()).extracting(DifferentialEquation::getStatement)
                .containsExactly("dP/dt = +v[1]");
    }

    @Test
    void testDegradeByProtease() {
        OdeModel model = applyAndBuild(1, "E degrades P");

        assertThat(model.getDifferentialEquations()).extracting(DifferentialEquation::getStatement)
                .containsExactly("dP/dt = -v[1]");
    }

    @Test
    void testAutocatalyticSynthesis() {
        OdeModel model = applyAndBuild(1, "A synthesizes A");

        assertThat(model.getSpecies()).containsExactly("A");
        assertThat(rateOf(model)).isEqualTo("v[1] = kf1*A");
        assertThat(equationOf(model, "A")).isEqualTo("dA/dt = +v[1]");
    }

    @Test
    void testSelfDegradation() {
        OdeModel model = applyAndBuild(1, "A degrades A");

        assertThat(model.getSpecies()).containsExactly("A");
        assertThat(rateOf(model)).isEqualTo("v[1] = kf1*A");
        assertThat(equationOf(model, "A")).isEqualTo("dA/dt = -v[1]");
    }

    @Test
    void testSynthesisFromNothing() {
        OdeModel model = applyAndBuild(1, "P is synthesized | kf=0.1 | P=0");

        assertThat(model.getParameterNames()).containsExactly("kf1");
        assertThat(model.getInitialConditions()).hasSize(1);
        assertThat(equationOf(model, "P")).isEqualTo("dP/dt = +v[1]");
    }

    @Test
    void testTextAfterTerminalPhrase() {
        assertThatThrownBy(() -> apply(1, "P is degraded quickly"))
                .isInstanceOf(MalformedSentenceException.class)
                .hasMessageContaining("quickly");
    }

    @Test
    void testTranslocationWithVolumeRatio() {
        OdeModel model = applyAndBuild(10, "pFos is translocated --> pFos_nuc (1, 0.5)");

        assertThat(model.getSpecies()).containsExactly("pFos", "pFos_nuc");
        assertThat(model.getDifferentialEquations()).extracting(DifferentialEquation::getStatement)
                .containsExactly("dpFos/dt = -v[10]", "dpFos_nuc/dt = +v[10]*(1/0.5)");
    }

    @Test
    void testTranslocationWithCompartmentDescription() {
        OdeModel model = applyAndBuild(1, "A is translocated from cytoplasm to nucleus (1, 2) --> An");

        assertThat(model.getSpecies()).containsExactly("A", "An");
        assertThat(rateOf(model)).isEqualTo("v[1] = kf1*A - kr1*(2/1)*An");
        assertThat(equationOf(model, "An")).isEqualTo("dAn/dt = +v[1]*(1/2)");
    }

    @Test
    void testTranslocationDescriptionWithVolumesAfterArrow() {
        OdeModel model = applyAndBuild(1, "A is translocated from cytoplasm to nucleus --> An (1, 2)");

        assertThat(rateOf(model)).isEqualTo("v[1] = kf1*A - kr1*(2/1)*An");
        assertThat(equationOf(model, "A")).isEqualTo("dA/dt = -v[1]");
    }

    @Test
    void testTranslocationVolumes() {
        assertThatThrownBy(() -> apply(1, "A is translocated --> B (1, 2, 3)"))
                .isInstanceOf(MalformedSentenceException.class);
        assertThatThrownBy(() -> apply(1, "A is translocated --> B (1, big)"))
                .isInstanceOf(NonNumericValueException.class)
                .hasMessageContaining("Compartment volume");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "A dimerizes B",
            "A dimerizes X --> B",
            "A is phosphorylated pA",
            "E phosphorylates A",
            "A is translocated B",
            "A binds B",
    })
    void testMissingOrMisplacedArrow(String sentence) {
        assertThatThrownBy(() -> apply(1, sentence)).isInstanceOf(MalformedSentenceException.class);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "A dimerizes --> A",
            "A binds B --> A",
            "A is phosphorylated --> A",
            "A is translocated into nucleus --> A",
            "m is translated into m",
            "TF transcribes TF",
    })
    void testProductNamedLikeSource(String sentence) {
        assertThatThrownBy(() -> apply(1, sentence))
                .isInstanceOf(InvalidNamingException.class)
                .hasMessageContaining("Use a different name.");
    }

    @Test
    void testInvalidSpeciesName() {
        assertThatThrownBy(() -> apply(1, "1A binds B --> C"))
                .isInstanceOf(InvalidNamingException.class)
                .extracting(e -> ((InvalidNamingException) e).getName())
                .isEqualTo("1A");
    }

    @Test
    void testMissingSpeciesName() {
        assertThatThrownBy(() -> apply(1, "A binds B -->"))
                .isInstanceOf(MalformedSentenceException.class)
                .hasMessageContaining("Missing species name");
    }

    @Test
    void testReactionKeepsSentenceAndRule() {
        OdeModel model = applyAndBuild(5, "A binds B --> C | kf=1 | A=3");

        Reaction reaction = model.getReactions().get(0);
        assertThat(reaction.getLineNumber()).isEqualTo(5);
        assertThat(reaction.getRule()).isEqualTo(ReactionRule.BIND);
        assertThat(reaction.getSentence()).isEqualTo("A binds B --> C");
    }
}
