package com.querybuilder.generator;

import com.querybuilder.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the query builder generator.
 * Reads record schemas and writes Go filter, updater and sort-option builders
 * for every record annotated with {@code gen:querybuilder}.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
