package com.xlsform.converter.choices;

import java.util.List;
import java.util.Map;

import com.xlsform.converter.model.form.Choice;
import com.xlsform.converter.model.form.ChoiceOrigin;

import lombok.Value;

/**
 * Choice origins in first-seen list order, plus a lookup of choices by list name.
 */
@Value
public class ChoiceOrigins {
    List<ChoiceOrigin> origins;
    Map<String, List<Choice>> choicesByList;

    public boolean isDefined(String listName) {
        return choicesByList.containsKey(listName);
    }
}
