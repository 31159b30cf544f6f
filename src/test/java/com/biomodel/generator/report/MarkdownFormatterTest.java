package com.biomodel.generator.report;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.biomodel.generator.model.DifferentialEquation;
import com.biomodel.generator.model.FluxTerm;
import com.biomodel.generator.model.Parameter;

import static org.assertj.core.api.Assertions.*;

class MarkdownFormatterTest {

    private static Map<String, Parameter> parameters(int line, String... baseNames) {
        Map<String, Parameter> map = new LinkedHashMap<>();
        for (String baseName : baseNames) {
            Parameter parameter = Parameter.of(baseName, line);
            map.put(parameter.getName(), parameter);
        }
        return map;
    }

    @Test
    void testMassAction() {
        String rendered = MarkdownFormatter.rateEquation("kf2*EGF*EGFR - kr2*EGF_EGFR",
                parameters(2, "kf", "kr"), Set.of("EGF", "EGFR", "EGF_EGFR"));

        assertThat(rendered).isEqualTo("kf<sub>2</sub>·[EGF]·[EGFR] - kr<sub>2</sub>·[EGF_EGFR]");
    }

    @Test
    void testHillExponents() {
        String rendered = MarkdownFormatter.rateEquation("V7*TF^n7/(K7^n7 + TF^n7)",
                parameters(7, "V", "K", "n"), Set.of("TF"));

        assertThat(rendered).isEqualTo("V<sub>7</sub>·[TF]<sup>n<sub>7</sub></sup>/"
                + "(K<sub>7</sub><sup>n<sub>7</sub></sup> + [TF]<sup>n<sub>7</sub></sup>)");
    }

    @Test
    void testVolumeRatioIsKept() {
        String rendered = MarkdownFormatter.rateEquation("kf1*A - kr1*(0.5/1)*B",
                parameters(1, "kf", "kr"), Set.of("A", "B"));

        assertThat(rendered).isEqualTo("kf<sub>1</sub>·[A] - kr<sub>1</sub>·(0.5/1)·[B]");
    }

    @Test
    void testDifferentialEquation() {
        DifferentialEquation equation = new DifferentialEquation("A",
                List.of(FluxTerm.of(1, -2), FluxTerm.of(4, 1)));

        assertThat(MarkdownFormatter.differentialEquation(equation))
                .isEqualTo("d[A]/dt = -2·_v_ <sub>1</sub> + _v_ <sub>4</sub>");
    }
}
