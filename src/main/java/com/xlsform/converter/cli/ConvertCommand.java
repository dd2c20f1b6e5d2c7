package com.xlsform.converter.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.xlsform.converter.cli.exception.OptionsValidationException;
import com.xlsform.converter.cli.model.ConvertOptions;
import com.xlsform.converter.cli.model.ValidatedConvertOptions;
import com.xlsform.converter.cli.output.ConvertResultsPrinter;
import com.xlsform.converter.cli.validation.ConvertOptionsValidator;
import com.xlsform.converter.service.ConversionResult;
import com.xlsform.converter.service.ConverterConfig;
import com.xlsform.converter.service.ConverterService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command converting an XLSForm workbook into an AJF JSON form.
 */
@Command(
        name = "xlsform-ajf",
        mixinStandardHelpOptions = true,
        version = "xlsform-ajf-converter 1.0.0",
        description = "Converts an XLSForm survey workbook into an AJF JSON form definition."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options = new ConvertOptions();

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    @Override
    public Integer call() {
        ValidatedConvertOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        ConverterConfig config = ConverterConfig.builder()
                .inputFile(validated.getInputFile())
                .outputFile(validated.getOutputFile())
                .prettyPrint(options.isPretty())
                .build();

        try {
            ConversionResult result = new ConverterService(config).convert();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }
            printer.printSuccess(result);
            return 0;
        } catch (Exception e) {
            log.error("Conversion failed with exception", e);
            return 1;
        }
    }
}
