package com.xlsform.converter.model.input;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the choices sheet, binding a value/label pair to a named list.
 */
@Value
@Builder
public class ChoiceRow {
    @Builder.Default
    String listName = "";
    @Builder.Default
    String value = "";
    @Builder.Default
    String label = "";
    int lineNumber;
}
