package com.xlsform.converter.model.form;

import lombok.Value;

@Value
public class Choice {
    String value;
    String label;
}
