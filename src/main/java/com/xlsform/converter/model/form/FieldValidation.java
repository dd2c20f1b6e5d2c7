package com.xlsform.converter.model.form;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Validation flags attached to a field. Only "not empty" is derived today.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldValidation {
    private boolean notEmpty;

    public static FieldValidation notEmptyValidation() {
        return new FieldValidation(true);
    }
}
