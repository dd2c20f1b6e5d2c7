package com.xlsform.converter.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    Path inputFile;
    Path outputFile;
}
