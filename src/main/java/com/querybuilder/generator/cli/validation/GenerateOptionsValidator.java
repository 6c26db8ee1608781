package com.querybuilder.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.querybuilder.generator.cli.exception.OptionsValidationException;
import com.querybuilder.generator.cli.model.GenerateOptions;
import com.querybuilder.generator.cli.model.ValidatedGenerateOptions;
import com.querybuilder.generator.codegen.classify.TimePattern;
import com.querybuilder.generator.codegen.util.FileWriteUtil;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		boolean directoryMode = o.getDirectory() != null;
		Path inputPath = null;
		Path outputPath = null;

		if (directoryMode) {
			if (o.getInputFile() != null) {
				errors.add("Give either an input file or --dir, not both.");
			}
			if (o.getOutputFile() != null) {
				errors.add("--output cannot be combined with --dir; outputs are written beside each schema.");
			}
			if (!existsDirectory(o.getDirectory())) {
				errors.add("Directory does not exist or is not a directory: " + o.getDirectory());
			}
			inputPath = o.getDirectory().toAbsolutePath().normalize();
		} else if (o.getInputFile() == null) {
			errors.add("Input file is required (or use --dir).");
		} else {
			if (!Files.isRegularFile(o.getInputFile())) {
				errors.add("Input file does not exist: " + o.getInputFile());
			}
			inputPath = o.getInputFile().toAbsolutePath().normalize();
			outputPath = o.getOutputFile() != null
					? o.getOutputFile().toAbsolutePath().normalize()
					: FileWriteUtil.defaultOutputPath(inputPath);
			if (outputPath.equals(inputPath)) {
				errors.add("Output file must differ from the input file: " + outputPath);
			}
		}

		if (o.getSuffix() != null && !o.getSuffix().matches("[A-Za-z0-9_]*")) {
			errors.add("Suffix must be a valid identifier part. Got: " + o.getSuffix());
		}

		if (o.getRuntimeImport() == null || o.getRuntimeImport().isBlank()) {
			errors.add("Runtime import path must not be empty (--runtime-import).");
		}

		List<TimePattern> timePatterns = parseTimeTypes(o.getTimeTypes(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(directoryMode, inputPath, outputPath, timePatterns);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static List<TimePattern> parseTimeTypes(List<String> raw, List<String> errors) {
		List<TimePattern> patterns = new ArrayList<>();
		if (raw == null) {
			return patterns;
		}
		for (String spec : raw) {
			try {
				patterns.add(TimePattern.parse(spec));
			} catch (IllegalArgumentException e) {
				errors.add(e.getMessage());
			}
		}
		return patterns;
	}
}
