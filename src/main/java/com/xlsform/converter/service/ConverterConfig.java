package com.xlsform.converter.service;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for one conversion run.
 */
@Value
@Builder
public class ConverterConfig {
    Path inputFile;
    Path outputFile;
    boolean prettyPrint;
}
