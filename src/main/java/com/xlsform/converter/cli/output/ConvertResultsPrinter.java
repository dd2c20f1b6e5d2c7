package com.xlsform.converter.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.xlsform.converter.cli.model.ConvertOptions;
import com.xlsform.converter.cli.model.ValidatedConvertOptions;
import com.xlsform.converter.service.ConversionResult;

/**
 * Responsible only for printing CLI output for the convert command.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(ConvertOptions o, ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("XLSForm to AJF Converter");
        log.info("=================================================");
        log.info("Input File: {}", v.getInputFile());
        log.info("Output File: {}", v.getOutputFile());
        log.info("Pretty Print: {}", o.isPretty());
        log.info("=================================================");
    }

    public void printSuccess(ConversionResult result) {
        log.info("");
        log.info("=================================================");
        log.info("CONVERSION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Slides: {}", result.getSlideCount());
        log.info("Fields: {}", result.getFieldCount());
        log.info("Choice Lists: {}", result.getChoiceOriginCount());
        log.info("=================================================");
    }

    public void printFailure(ConversionResult result) {
        log.error("Conversion failed: {}", result.getErrorMessage());
    }
}
