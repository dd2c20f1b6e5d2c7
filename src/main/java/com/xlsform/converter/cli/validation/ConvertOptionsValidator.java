package com.xlsform.converter.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.xlsform.converter.cli.exception.OptionsValidationException;
import com.xlsform.converter.cli.model.ConvertOptions;
import com.xlsform.converter.cli.model.ValidatedConvertOptions;

public class ConvertOptionsValidator {

	public ValidatedConvertOptions validate(ConvertOptions o) {
		return validate(o.getInputFile(), o.getOutputFile(), o.isForce());
	}

	public ValidatedConvertOptions validate(Path input, Path output, boolean force) {
		List<String> errors = new ArrayList<>();

		Path inputFile = null;
		if (input == null) {
			errors.add("An XLSForm file is required.");
		} else {
			inputFile = input.toAbsolutePath().normalize();
			if (!Files.isRegularFile(inputFile)) {
				errors.add("Input file does not exist or is not a file: " + inputFile);
			} else if (!hasExcelExtension(inputFile)) {
				errors.add("Unsupported excel file type: " + inputFile.getFileName() + " (expected .xls or .xlsx)");
			}
		}

		Path outputFile = null;
		if (output != null) {
			outputFile = output.toAbsolutePath().normalize();
		} else if (inputFile != null) {
			outputFile = defaultOutput(inputFile);
		}

		if (outputFile != null) {
			if (Files.isDirectory(outputFile)) {
				errors.add("Output path is a directory: " + outputFile);
			} else if (Files.exists(outputFile) && !force) {
				errors.add("Output file already exists: " + outputFile + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedConvertOptions(inputFile, outputFile);
	}

	static Path defaultOutput(Path inputFile) {
		String name = inputFile.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String base = dot > 0 ? name.substring(0, dot) : name;
		return inputFile.resolveSibling(base + ".json");
	}

	private static boolean hasExcelExtension(Path p) {
		String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
		return name.endsWith(".xls") || name.endsWith(".xlsx");
	}
}
