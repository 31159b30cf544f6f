package com.biomodel.generator.report;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.biomodel.generator.model.OdeModel;
import com.biomodel.generator.parser.ModelTextParser;

import static org.assertj.core.api.Assertions.*;

class MarkdownReportGeneratorTest {

    @TempDir
    Path tempDir;

    private final MarkdownReportGenerator generator = new MarkdownReportGenerator();

    private static OdeModel model() {
        return new ModelTextParser().parse(List.of(
                "A binds B --> C",
                "C is degraded",
                "A is synthesized"));
    }

    @Test
    void testGenerateReport() throws Exception {
        Path reportDir = generator.generate(model(), "toy", tempDir, null);

        assertThat(reportDir).isEqualTo(tempDir.resolve("toy"));
        List<String> rates = Files.readAllLines(reportDir.resolve("rate_equation.md"));
        assertThat(rates).containsExactly(
                "|No.|Reactions|Rate equations|",
                "|---|---------|--------------|",
                "|1|A binds B --> C|kf<sub>1</sub>·[A]·[B] - kr<sub>1</sub>·[C]|",
                "|2|C is degraded|kf<sub>2</sub>·[C]|",
                "|3|A is synthesized|kf<sub>3</sub>|");

        List<String> odes = Files.readAllLines(reportDir.resolve("differential_equation.md"));
        assertThat(odes).containsExactly(
                "|No.|Differential equations|",
                "|---|----------------------|",
                "|1|d[A]/dt = -_v_ <sub>1</sub> + _v_ <sub>3</sub>|",
                "|2|d[B]/dt = -_v_ <sub>1</sub>|",
                "|3|d[C]/dt = +_v_ <sub>1</sub> - _v_ <sub>2</sub>|");
    }

    @Test
    void testReactionLimit() {
        List<RateEquationRow> rows = generator.rateEquationRows(model(), 2);

        assertThat(rows).extracting(RateEquationRow::getNumber).containsExactly("1", "2");
        assertThat(generator.rateEquationRows(model(), 10)).hasSize(3);
    }

    @Test
    void testDifferentialEquationRowsAreNumberedSequentially() {
        List<DifferentialEquationRow> rows = generator.differentialEquationRows(model());

        assertThat(rows).extracting(DifferentialEquationRow::getNumber).containsExactly("1", "2", "3");
    }
}
