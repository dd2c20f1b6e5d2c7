package com.xlsform.converter.model.form;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A named, ordered list of selectable value/label pairs.
 */
@Value
@Builder
public class ChoiceOrigin {
    String name;
    @Builder.Default
    ChoiceOriginType type = ChoiceOriginType.FIXED;
    @Builder.Default
    ChoicesType choicesType = ChoicesType.STRING;
    @Singular
    List<Choice> choices;
}
