package com.xlsform.converter;

import com.xlsform.converter.cli.ConvertCommand;

import picocli.CommandLine;

/**
 * Main entry point for the XLSForm to AJF converter.
 */
public class ConverterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand()).execute(args);
        System.exit(exitCode);
    }
}
