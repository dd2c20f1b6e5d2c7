package com.xlsform.converter.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the convert command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Parameters(index = "0", paramLabel = "XLSFORM", description = "XLSForm workbook to convert (.xls or .xlsx)")
	private Path inputFile;

	@Option(names = { "--output", "-o" }, description = "Output JSON file (defaults to the input name with a .json extension)")
	private Path outputFile;

	@Option(names = { "--pretty" }, description = "Indent the JSON output")
	private boolean pretty;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;
}
