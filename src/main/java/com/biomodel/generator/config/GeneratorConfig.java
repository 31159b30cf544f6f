package com.biomodel.generator.config;

import java.nio.file.Path;
import java.util.List;

import com.biomodel.generator.parser.UnregisteredWordSuggester;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for one model conversion.
 */
@Data
@Builder
public class GeneratorConfig {
    private Path modelFile;
    private String modelName;

    @Singular
    private List<PhraseRegistration> registrations;

    @Builder.Default
    private double similarityThreshold = UnregisteredWordSuggester.DEFAULT_THRESHOLD;

    @Builder.Default
    private boolean checkReferences = true;

    /** Where Markdown tables are written; no report when null. */
    private Path markdownDir;

    /** Number of leading reactions in the rate equation table; all when null. */
    private Integer reactionLimit;

    public boolean isMarkdownEnabled() {
        return markdownDir != null;
    }
}
