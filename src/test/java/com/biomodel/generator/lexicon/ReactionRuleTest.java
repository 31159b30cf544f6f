package com.biomodel.generator.lexicon;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ReactionRuleTest {

    @Test
    void testFromId() {
        assertThat(ReactionRule.fromId("is_translocated")).contains(ReactionRule.IS_TRANSLOCATED);
        assertThat(ReactionRule.fromId(" bind ")).contains(ReactionRule.BIND);
        assertThat(ReactionRule.fromId("glow")).isEmpty();
        assertThat(ReactionRule.fromId(null)).isEmpty();
    }

    @Test
    void testIdsInDispatchOrder() {
        assertThat(ReactionRule.ids()).hasSize(14);
        assertThat(ReactionRule.ids()).startsWith("dimerize", "bind", "is_dissociated");
    }

    @Test
    void testTranscriptionParameters() {
        assertThat(ReactionRule.TRANSCRIBE.getParameterNames()).containsExactly("V", "K", "n", "KF", "nF");
    }

    @Test
    void testPhosphorylationType() {
        assertThat(ReactionRule.PHOSPHORYLATE.isPhosphorylationType()).isTrue();
        assertThat(ReactionRule.IS_DEPHOSPHORYLATED.isPhosphorylationType()).isTrue();
        assertThat(ReactionRule.BIND.isPhosphorylationType()).isFalse();
    }
}
