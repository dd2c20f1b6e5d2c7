package com.xlsform.converter.choices;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.xlsform.converter.model.form.Choice;
import com.xlsform.converter.model.form.ChoiceOrigin;
import com.xlsform.converter.model.form.ChoiceOriginType;
import com.xlsform.converter.model.form.ChoicesType;
import com.xlsform.converter.model.input.ChoiceRow;

/**
 * Groups choice rows by list name. Lists keep their rows in input order and
 * origins are emitted in the order their list name first appears.
 */
public class ChoiceOriginBuilder {

    public ChoiceOrigins build(List<ChoiceRow> rows) {
        Map<String, List<Choice>> choicesByList = new LinkedHashMap<>();
        for (ChoiceRow row : rows) {
            choicesByList.computeIfAbsent(row.getListName(), k -> new ArrayList<>())
                    .add(new Choice(row.getValue(), row.getLabel()));
        }

        Map<String, List<Choice>> frozen = new LinkedHashMap<>();
        List<ChoiceOrigin> origins = new ArrayList<>(choicesByList.size());
        choicesByList.forEach((name, choices) -> frozen.put(name, List.copyOf(choices)));
        frozen.forEach((name, choices) -> origins.add(ChoiceOrigin.builder()
                .name(name)
                .type(ChoiceOriginType.FIXED)
                .choicesType(ChoicesType.STRING)
                .choices(choices)
                .build()));

        return new ChoiceOrigins(List.copyOf(origins), Collections.unmodifiableMap(frozen));
    }
}
