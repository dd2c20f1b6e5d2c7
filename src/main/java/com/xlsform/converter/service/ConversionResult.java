package com.xlsform.converter.service;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a conversion run.
 */
@Data
@Builder
public class ConversionResult {
    private boolean success;
    private String errorMessage;
    /** Survey line the error points at, 0 when unknown. */
    private int errorLine;
    private Path outputPath;

    private int slideCount;
    private int fieldCount;
    private int choiceOriginCount;

    public static ConversionResult failure(String errorMessage) {
        return failure(errorMessage, 0);
    }

    public static ConversionResult failure(String errorMessage, int errorLine) {
        return ConversionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorLine(errorLine)
                .build();
    }
}
