package com.xlsform.converter.reader;

/**
 * The spreadsheet could not be opened or does not have the XLSForm layout.
 */
public class XlsFormReadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public XlsFormReadException(String message) {
        super(message);
    }

    public XlsFormReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
