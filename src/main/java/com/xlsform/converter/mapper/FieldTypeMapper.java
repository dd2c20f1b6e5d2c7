package com.xlsform.converter.mapper;

import com.xlsform.converter.model.form.FieldNode;
import com.xlsform.converter.model.form.FieldType;
import com.xlsform.converter.model.form.FieldValidation;
import com.xlsform.converter.model.input.SurveyRow;
import com.xlsform.converter.parser.RowTypes;

import lombok.experimental.UtilityClass;

@UtilityClass
public class FieldTypeMapper {

    /**
     * Map a survey row whose type is a supported field token to a field node.
     * Expressions are copied as-is; blank cells become absent.
     *
     * @throws IllegalArgumentException if the row type is not a supported field type
     */
    public FieldNode toField(SurveyRow row) {
        String type = row.getType();
        FieldType fieldType = fieldTypeOf(type);

        FieldNode.FieldNodeBuilder field = FieldNode.builder()
                .name(row.getName())
                .label(row.getLabel())
                .fieldType(fieldType)
                .relevant(emptyToNull(row.getRelevant()))
                .constraint(emptyToNull(row.getConstraint()))
                .calculation(emptyToNull(row.getCalculation()))
                .sourceLine(row.getLineNumber());

        if (fieldType.isChoice()) {
            field.choiceOriginRef(RowTypes.listName(type));
        }
        if (fieldType == FieldType.NOTE) {
            field.html(row.getLabel());
        }
        if (row.isRequired()) {
            field.validation(FieldValidation.notEmptyValidation());
        }
        return field.build();
    }

    public FieldType fieldTypeOf(String type) {
        // yes_no must win over the generic select_one rule
        if (RowTypes.YES_NO.equals(type)) {
            return FieldType.BOOLEAN;
        }
        if (RowTypes.isSelectOne(type)) {
            return FieldType.SINGLE_CHOICE;
        }
        if (RowTypes.isSelectMultiple(type)) {
            return FieldType.MULTIPLE_CHOICE;
        }
        return switch (type) {
            case RowTypes.DECIMAL -> FieldType.NUMBER;
            case RowTypes.TEXT -> FieldType.STRING;
            case RowTypes.NOTE -> FieldType.NOTE;
            case RowTypes.DATE -> FieldType.DATE;
            case RowTypes.TIME -> FieldType.TIME;
            case RowTypes.CALCULATE -> FieldType.FORMULA;
            default -> throw new IllegalArgumentException("Not a supported field type: " + type);
        };
    }

    private String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
