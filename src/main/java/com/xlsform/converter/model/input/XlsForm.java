package com.xlsform.converter.model.input;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Fully materialized content of one XLSForm spreadsheet.
 */
@Value
@Builder
public class XlsForm {
    @Singular
    List<SurveyRow> surveyRows;
    @Singular
    List<ChoiceRow> choiceRows;
    String fileName;
}
