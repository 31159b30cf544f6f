package com.biomodel.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.biomodel.generator.config.PhraseRegistration;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the converter. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    String modelName;
    Path modelFile;
    Path markdownDir;
    List<PhraseRegistration> registrations;
}
