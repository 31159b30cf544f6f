package com.biomodel.generator.report;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.biomodel.generator.model.DifferentialEquation;
import com.biomodel.generator.model.OdeModel;
import com.biomodel.generator.model.Parameter;
import com.biomodel.generator.model.Reaction;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Writes Markdown tables of a model's rate equations and differential equations.
 *
 * Output, under {@code <outputDir>/<modelName>/}:
 * - rate_equation.md: |No.|Reactions|Rate equations|
 * - differential_equation.md: |No.|Differential equations|
 */
public class MarkdownReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(MarkdownReportGenerator.class);

    static final String RATE_EQUATION_FILE = "rate_equation.md";
    static final String DIFFERENTIAL_EQUATION_FILE = "differential_equation.md";

    private final Configuration freemarkerConfig;

    public MarkdownReportGenerator() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * @param reactionLimit number of leading reactions to include, or null for all
     * @return the directory the two files were written to
     */
    public Path generate(OdeModel model, String modelName, Path outputDir, Integer reactionLimit) throws IOException {
        Path reportDir = outputDir.resolve(modelName);
        Files.createDirectories(reportDir);

        Map<String, Object> rateData = new HashMap<>();
        rateData.put("rows", rateEquationRows(model, reactionLimit));
        write(reportDir.resolve(RATE_EQUATION_FILE), "rate_equation.md.ftl", rateData);

        Map<String, Object> odeData = new HashMap<>();
        odeData.put("rows", differentialEquationRows(model));
        write(reportDir.resolve(DIFFERENTIAL_EQUATION_FILE), "differential_equation.md.ftl", odeData);

        log.info("Markdown report written to {}", reportDir);
        return reportDir;
    }

    List<RateEquationRow> rateEquationRows(OdeModel model, Integer reactionLimit) {
        Map<String, Parameter> parameters = model.getParameters().stream()
                .collect(Collectors.toMap(Parameter::getName, Function.identity()));
        Set<String> species = new LinkedHashSet<>(model.getSpecies());

        List<Reaction> reactions = model.getReactions();
        int count = reactionLimit == null ? reactions.size() : Math.min(reactionLimit, reactions.size());
        List<RateEquationRow> rows = new ArrayList<>(count);
        for (Reaction reaction : reactions.subList(0, count)) {
            rows.add(new RateEquationRow(
                    String.valueOf(reaction.getLineNumber()),
                    reaction.getSentence(),
                    MarkdownFormatter.rateEquation(reaction.getRateLaw(), parameters, species)));
        }
        return rows;
    }

    List<DifferentialEquationRow> differentialEquationRows(OdeModel model) {
        List<DifferentialEquation> equations = model.getDifferentialEquations();
        List<DifferentialEquationRow> rows = new ArrayList<>(equations.size());
        for (int i = 0; i < equations.size(); i++) {
            rows.add(new DifferentialEquationRow(
                    String.valueOf(i + 1),
                    MarkdownFormatter.differentialEquation(equations.get(i))));
        }
        return rows;
    }

    private void write(Path file, String templateName, Map<String, Object> data) throws IOException {
        Template template = freemarkerConfig.getTemplate(templateName);
        Writer out = new StringWriter();
        try {
            template.process(data, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + templateName + ": " + e.getMessage(), e);
        }
        Files.writeString(file, out.toString(), StandardCharsets.UTF_8);
        log.debug("Wrote {}", file);
    }
}
