package com.querybuilder.generator.cli.validation;

import com.querybuilder.generator.cli.exception.OptionsValidationException;
import com.querybuilder.generator.cli.model.GenerateOptions;
import com.querybuilder.generator.cli.model.ValidatedGenerateOptions;
import com.querybuilder.generator.codegen.classify.TimePattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class GenerateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path schema;
    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @BeforeEach
    void setUp() throws IOException {
        schema = tempDir.resolve("models.json");
        Files.writeString(schema, "{}");
    }

    @Test
    void testSingleFileDefaults() {
        ValidatedGenerateOptions v = validator.validate(parse(schema.toString()));

        assertThat(v.isDirectoryMode()).isFalse();
        assertThat(v.getInputPath()).isEqualTo(schema.toAbsolutePath().normalize());
        assertThat(v.getOutputPath().getFileName().toString()).isEqualTo("models_querybuilder.go");
        assertThat(v.getTimePatterns()).isEmpty();
    }

    @Test
    void testExplicitOutputAndTimeTypes() {
        Path output = tempDir.resolve("gen/out.go");

        ValidatedGenerateOptions v = validator.validate(parse(schema.toString(), "-o", output.toString(),
                "--time-type", "civil.Date:unordered", "--time-type", "civil.DateTime"));

        assertThat(v.getOutputPath()).isEqualTo(output.toAbsolutePath().normalize());
        assertThat(v.getTimePatterns()).containsExactly(
                new TimePattern("civil.Date", false), new TimePattern("civil.DateTime", true));
    }

    @Test
    void testDirectoryMode() {
        ValidatedGenerateOptions v = validator.validate(parse("--dir", tempDir.toString()));

        assertThat(v.isDirectoryMode()).isTrue();
        assertThat(v.getOutputPath()).isNull();
    }

    @Test
    void testMissingInput() {
        assertThatThrownBy(() -> validator.validate(parse()))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Input file is required");
    }

    @Test
    void testCollectsAllErrors() {
        GenerateOptions options = parse("--dir", tempDir.resolve("missing").toString(), "-o", "x.go",
                "-s", "bad-suffix", "--time-type", "civil.Date:maybe");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors()).hasSize(4));
    }

    @Test
    void testNonexistentInputFile() {
        assertThatThrownBy(() -> validator.validate(parse(tempDir.resolve("nope.json").toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("does not exist");
    }

    private static GenerateOptions parse(String... args) {
        GenerateOptions options = new GenerateOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
