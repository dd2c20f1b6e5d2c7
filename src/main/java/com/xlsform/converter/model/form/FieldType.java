package com.xlsform.converter.model.form;

public enum FieldType {
    NUMBER,
    STRING,
    BOOLEAN,
    SINGLE_CHOICE,
    MULTIPLE_CHOICE,
    NOTE,
    DATE,
    TIME,
    FORMULA;

    public boolean isChoice() {
        return this == SINGLE_CHOICE || this == MULTIPLE_CHOICE;
    }
}
