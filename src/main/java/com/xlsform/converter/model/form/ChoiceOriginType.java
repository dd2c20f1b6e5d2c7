package com.xlsform.converter.model.form;

public enum ChoiceOriginType {
    FIXED
}
