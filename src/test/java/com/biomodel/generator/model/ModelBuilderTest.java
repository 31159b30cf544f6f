package com.biomodel.generator.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.biomodel.generator.lexicon.ReactionRule;

import static org.assertj.core.api.Assertions.*;

class ModelBuilderTest {

    @Test
    void testRegisterParametersKeepsFirstRegistration() {
        ModelBuilder builder = new ModelBuilder();
        builder.registerParameters(1, List.of("kf", "kr"));
        builder.assignParameter("kf1", "2", false);
        builder.registerParameters(1, List.of("kf"));

        OdeModel model = builder.build();

        assertThat(model.getParameterNames()).containsExactly("kf1", "kr1");
        assertThat(model.findParameter("kf1")).hasValueSatisfying(p -> {
            assertThat(p.getInitialValue()).isEqualTo("2");
            assertThat(p.getBaseName()).isEqualTo("kf");
            assertThat(p.getLineNumber()).isEqualTo(1);
        });
    }

    @Test
    void testAssignUnregisteredParameter() {
        ModelBuilder builder = new ModelBuilder();

        assertThatThrownBy(() -> builder.assignParameter("kf9", "1", false))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testConstrainedParameterIsExcluded() {
        ModelBuilder builder = new ModelBuilder();
        builder.registerParameters(1, List.of("kf"));
        builder.registerParameters(2, List.of("kf"));
        builder.constrainParameter("kf2", "kf1", 1);

        OdeModel model = builder.build();

        assertThat(model.getExcludedParameters()).containsExactly("kf2");
        assertThat(model.findParameter("kf2").orElseThrow().isConstrained()).isTrue();
        assertThat(model.findParameter("kf1").orElseThrow().isConstrained()).isFalse();
        assertThat(model.getParameterConstraints()).containsExactly(new ParameterConstraint("kf2", "kf1"));
    }

    @Test
    void testSpeciesKeepFirstAppearanceOrder() {
        ModelBuilder builder = new ModelBuilder();
        builder.registerSpecies("B", "A");
        builder.registerSpecies("A", "C");

        assertThat(builder.hasSpecies("C")).isTrue();
        assertThat(builder.build().getSpecies()).containsExactly("B", "A", "C");
    }

    @Test
    void testEquationsKeepFirstTouchOrder() {
        ModelBuilder builder = new ModelBuilder();
        builder.addFlux("B", FluxTerm.of(1, +1));
        builder.addFlux("A", FluxTerm.of(1, -2));
        builder.addFlux("B", FluxTerm.of(2, -1));

        OdeModel model = builder.build();

        assertThat(model.getDifferentialEquations()).extracting(DifferentialEquation::getStatement)
                .containsExactly("dB/dt = +v[1] - v[2]", "dA/dt = -2*v[1]");
    }

    @Test
    void testUnperturbedStatementsAreJoined() {
        ModelBuilder builder = new ModelBuilder();
        builder.addUnperturbed("init[A] = 0");
        builder.addUnperturbed("p[kf1] = 1");

        assertThat(builder.build().getUnperturbed()).isEqualTo("init[A] = 0; p[kf1] = 1");
    }

    @Test
    void testBuiltModelIsFrozen() {
        ModelBuilder builder = new ModelBuilder();
        builder.addReaction(new Reaction(1, ReactionRule.IS_DEGRADED, "A is degraded", "kf1*A"));
        OdeModel model = builder.build();

        assertThat(builder.isBuilt()).isTrue();
        assertThatThrownBy(() -> builder.registerSpecies("B")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> model.getReactions().add(null)).isInstanceOf(UnsupportedOperationException.class);
    }
}
