package com.biomodel.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "convert" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Parameters(index = "0", paramLabel = "MODEL_FILE", description = "Text file describing the reactions, one per line")
	private Path modelFile;

	@Option(names = { "--register", "-r" }, paramLabel = "RULE=PHRASE",
			description = "Add a trigger phrase to a reaction rule, e.g. degrade=breaks down (repeatable)")
	private List<String> registrations = new ArrayList<>();

	@Option(names = { "--similarity-threshold" }, defaultValue = "0.7",
			description = "Minimum similarity for suggesting a registered phrase (default: 0.7)")
	private double similarityThreshold;

	@Option(names = { "--markdown-dir", "-m" }, description = "Write rate and differential equation tables under this directory")
	private Path markdownDir;

	@Option(names = { "--reaction-limit" }, description = "Number of leading reactions in the rate equation table")
	private Integer reactionLimit;

	@Option(names = { "--skip-reference-check" }, description = "Do not verify p[], u[] and init[] references in annotations")
	private boolean skipReferenceCheck;
}
