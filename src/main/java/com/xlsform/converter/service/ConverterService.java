package com.xlsform.converter.service;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.xlsform.converter.converter.ConversionException;
import com.xlsform.converter.converter.XlsFormConverter;
import com.xlsform.converter.model.form.AjfForm;
import com.xlsform.converter.model.input.XlsForm;
import com.xlsform.converter.reader.XlsFormReadException;
import com.xlsform.converter.reader.XlsFormReader;
import com.xlsform.converter.writer.AjfFormWriter;

/**
 * Reads an XLSForm workbook, converts it and writes the JSON form.
 */
public class ConverterService {
    private static final Logger log = LoggerFactory.getLogger(ConverterService.class);

    private final ConverterConfig config;
    private final XlsFormReader reader;
    private final XlsFormConverter converter;
    private final AjfFormWriter writer;

    public ConverterService(ConverterConfig config) {
        this.config = config;
        this.reader = new XlsFormReader();
        this.converter = new XlsFormConverter();
        this.writer = new AjfFormWriter(config.isPrettyPrint());
    }

    public ConversionResult convert() {
        try {
            log.info("Step 1: Reading {}", config.getInputFile());
            XlsForm xlsForm = reader.read(config.getInputFile());

            log.info("Step 2: Converting {} survey rows", xlsForm.getSurveyRows().size());
            AjfForm form = converter.convert(xlsForm);

            log.info("Step 3: Writing {}", config.getOutputFile());
            writer.write(form, config.getOutputFile());

            return ConversionResult.builder()
                    .success(true)
                    .outputPath(config.getOutputFile())
                    .slideCount(form.getSlides().size())
                    .fieldCount(form.countFields())
                    .choiceOriginCount(form.getChoicesOrigins().size())
                    .build();
        } catch (ConversionException e) {
            log.debug("Conversion rejected ({})", e.getKind(), e);
            return ConversionResult.failure(e.getMessage(), e.getLineNumber());
        } catch (XlsFormReadException e) {
            log.debug("Workbook rejected", e);
            return ConversionResult.failure(e.getMessage());
        } catch (IOException e) {
            log.error("Could not write output {}", config.getOutputFile(), e);
            return ConversionResult.failure("Could not write " + config.getOutputFile() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure converting {}", config.getInputFile(), e);
            return ConversionResult.failure("Unexpected error: " + e.getMessage());
        }
    }
}
