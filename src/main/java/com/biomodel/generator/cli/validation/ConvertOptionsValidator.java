package com.biomodel.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.biomodel.generator.cli.exception.OptionsValidationException;
import com.biomodel.generator.cli.model.ConvertOptions;
import com.biomodel.generator.cli.model.ValidatedConvertOptions;
import com.biomodel.generator.config.PhraseRegistration;
import com.biomodel.generator.lexicon.ReactionRule;

public class ConvertOptionsValidator {

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		Path modelFile = o.getModelFile();
		if (modelFile == null) {
			errors.add("Model file is required.");
		} else if (!Files.isRegularFile(modelFile)) {
			errors.add("Model file does not exist or is not a file: " + modelFile);
		}

		if (o.getSimilarityThreshold() < 0.0 || o.getSimilarityThreshold() > 1.0) {
			errors.add("Similarity threshold must be in range 0-1. Got: " + o.getSimilarityThreshold());
		}

		if (o.getReactionLimit() != null) {
			if (o.getReactionLimit() <= 0) {
				errors.add("Reaction limit must be > 0. Got: " + o.getReactionLimit());
			}
			if (o.getMarkdownDir() == null) {
				errors.add("--reaction-limit only applies together with --markdown-dir.");
			}
		}

		if (o.getMarkdownDir() != null && Files.exists(o.getMarkdownDir()) && !Files.isDirectory(o.getMarkdownDir())) {
			errors.add("Markdown output path exists and is not a directory: " + o.getMarkdownDir());
		}

		List<PhraseRegistration> registrations = parseRegistrations(o.getRegistrations(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path normalizedModelFile = modelFile.toAbsolutePath().normalize();
		Path normalizedMarkdownDir = o.getMarkdownDir() == null ? null
				: o.getMarkdownDir().toAbsolutePath().normalize();

		return new ValidatedConvertOptions(modelNameOf(normalizedModelFile), normalizedModelFile,
				normalizedMarkdownDir, registrations);
	}

	/**
	 * File name without its extension: models/Kholodenko.txt -> Kholodenko.
	 */
	static String modelNameOf(Path modelFile) {
		String fileName = modelFile.getFileName().toString();
		return fileName.contains(".") ? StringUtils.substringBeforeLast(fileName, ".") : fileName;
	}

	private static List<PhraseRegistration> parseRegistrations(List<String> raw, List<String> errors) {
		List<PhraseRegistration> result = new ArrayList<>();
		if (raw == null) {
			return result;
		}
		for (String text : raw) {
			try {
				PhraseRegistration registration = PhraseRegistration.parse(text);
				if (ReactionRule.fromId(registration.getRuleId()).isEmpty()) {
					errors.add("Unknown reaction rule '" + registration.getRuleId() + "' in --register. Choose from: "
							+ String.join(", ", ReactionRule.ids()));
				} else {
					result.add(registration);
				}
			} catch (IllegalArgumentException e) {
				errors.add("Invalid --register value: " + e.getMessage());
			}
		}
		return result;
	}
}
