package com.querybuilder.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the generate command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Parameters(index = "0", arity = "0..1", paramLabel = "<schema.json>", description = "Schema document to generate query builders for")
	private Path inputFile;

	@Option(names = { "--output", "-o" }, description = "Output file path (default: <input>_querybuilder.go)")
	private Path outputFile;

	@Option(names = { "--suffix", "-s" }, description = "Suffix to append to record names")
	private String suffix;

	@Option(names = { "--dir", "-d" }, description = "Process every schema document (*.json) in a directory")
	private Path directory;

	@Option(names = { "--types" }, description = "Show filterable and non-filterable field categories and exit")
	private boolean showTypes;

	@Option(names = { "--dry-run" }, description = "Show what would be generated without writing files")
	private boolean dryRun;

	@Option(names = { "--verbose" }, description = "Verbose output")
	private boolean verbose;

	@Option(names = { "--time-type" }, paramLabel = "NAME[:orderable|:unordered]", description = "Additional type to treat as a time value (repeatable)")
	private List<String> timeTypes = new ArrayList<>();

	@Option(names = {
			"--runtime-import" }, description = "Import path of the runtime repository package (default: ${DEFAULT-VALUE})", defaultValue = "github.com/dchlong/querybuilder/repository")
	private String runtimeImport;
}
