package com.biomodel.generator.lexicon;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

/**
 * The biochemical event grammars understood by the parser, in dispatch order.
 * Each rule carries its default trigger phrases and the base names of the
 * kinetic parameters it introduces.
 */
@Getter
public enum ReactionRule {

    DIMERIZE("dimerize",
            List.of("dimerizes", "homodimerizes", "forms a dimer", "forms dimers"),
            List.of("kf", "kr")),
    BIND("bind",
            List.of("binds", "forms complexes with"),
            List.of("kf", "kr")),
    IS_DISSOCIATED("is_dissociated",
            List.of("is dissociated into"),
            List.of("kf", "kr")),
    IS_PHOSPHORYLATED("is_phosphorylated",
            List.of("is phosphorylated"),
            List.of("kf", "kr")),
    IS_DEPHOSPHORYLATED("is_dephosphorylated",
            List.of("is dephosphorylated"),
            List.of("V", "K")),
    PHOSPHORYLATE("phosphorylate",
            List.of("phosphorylates"),
            List.of("V", "K")),
    DEPHOSPHORYLATE("dephosphorylate",
            List.of("dephosphorylates"),
            List.of("V", "K")),
    TRANSCRIBE("transcribe",
            List.of("transcribe", "transcribes"),
            List.of("V", "K", "n", "KF", "nF")),
    IS_TRANSLATED("is_translated",
            List.of("is translated into"),
            List.of("kf")),
    SYNTHESIZE("synthesize",
            List.of("synthesizes", "promotes synthesis of"),
            List.of("kf")),
    IS_SYNTHESIZED("is_synthesized",
            List.of("is synthesized"),
            List.of("kf")),
    DEGRADE("degrade",
            List.of("degrades", "promotes degradation of"),
            List.of("kf")),
    IS_DEGRADED("is_degraded",
            List.of("is degraded"),
            List.of("kf")),
    IS_TRANSLOCATED("is_translocated",
            List.of("is translocated"),
            List.of("kf", "kr"));

    private final String id;
    private final List<String> defaultPhrases;
    private final List<String> parameterNames;

    ReactionRule(String id, List<String> defaultPhrases, List<String> parameterNames) {
        this.id = id;
        this.defaultPhrases = defaultPhrases;
        this.parameterNames = parameterNames;
    }

    public static Optional<ReactionRule> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = id.trim();
        return Arrays.stream(values())
                .filter(rule -> rule.id.equals(key))
                .findFirst();
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(ReactionRule::getId).toList();
    }

    /**
     * Whether reactions of this rule record an (unphosphorylated, phosphorylated) pair.
     */
    public boolean isPhosphorylationType() {
        return this == IS_PHOSPHORYLATED || this == IS_DEPHOSPHORYLATED
                || this == PHOSPHORYLATE || this == DEPHOSPHORYLATE;
    }
}
