package com.xlsform.converter.model.input;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the survey sheet: a question, a group boundary or a repeat boundary.
 * Blank cells are empty strings, never null.
 */
@Value
@Builder
public class SurveyRow {
    @Builder.Default
    String type = "";
    @Builder.Default
    String name = "";
    @Builder.Default
    String label = "";
    @Builder.Default
    String relevant = "";
    @Builder.Default
    String constraint = "";
    @Builder.Default
    String calculation = "";
    @Builder.Default
    String required = "";
    @Builder.Default
    String repeatCount = "";
    int lineNumber;

    public boolean isRequired() {
        return "yes".equals(required);
    }
}
