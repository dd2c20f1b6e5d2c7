package com.xlsform.converter.converter;

import lombok.Getter;

/**
 * Terminal failure of a conversion, attributed to a source row when possible.
 */
@Getter
public class ConversionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ConversionErrorKind kind;
    /** 1-based line in the survey sheet, or 0 when no single row is to blame. */
    private final int lineNumber;

    public ConversionException(ConversionErrorKind kind, int lineNumber, String message) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    public ConversionException(ConversionErrorKind kind, String message) {
        this(kind, 0, message);
    }
}
