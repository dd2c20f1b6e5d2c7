package com.xlsform.converter.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.xlsform.converter.cli.exception.OptionsValidationException;
import com.xlsform.converter.cli.model.ValidatedConvertOptions;

/**
 * Unit tests for ConvertOptionsValidator.
 */
class ConvertOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();

    @Test
    void testDefaultOutputSitsNextToInput() throws IOException {
        Path input = Files.createFile(tempDir.resolve("survey.xlsx"));

        ValidatedConvertOptions v = validator.validate(input, null, false);

        assertThat(v.getInputFile()).isEqualTo(input.toAbsolutePath().normalize());
        assertThat(v.getOutputFile().getFileName().toString()).isEqualTo("survey.json");
        assertThat(v.getOutputFile().getParent()).isEqualTo(v.getInputFile().getParent());
    }

    @Test
    void testCollectsAllErrors() throws IOException {
        Path input = Files.createFile(tempDir.resolve("survey.csv"));
        Path output = Files.createDirectory(tempDir.resolve("out"));

        OptionsValidationException e = catchThrowableOfType(
                () -> validator.validate(input, output, false), OptionsValidationException.class);

        assertThat(e.getErrors()).hasSize(2);
    }

    @Test
    void testMissingInputFails() {
        assertThatThrownBy(() -> validator.validate(tempDir.resolve("missing.xlsx"), null, false))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void testExistingOutputNeedsForce() throws IOException {
        Path input = Files.createFile(tempDir.resolve("survey.xls"));
        Files.createFile(tempDir.resolve("survey.json"));

        assertThatThrownBy(() -> validator.validate(input, null, false))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--force");
        assertThatCode(() -> validator.validate(input, null, true)).doesNotThrowAnyException();
    }
}
