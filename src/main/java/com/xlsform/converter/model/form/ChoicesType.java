package com.xlsform.converter.model.form;

public enum ChoicesType {
    STRING
}
