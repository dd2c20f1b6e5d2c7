package com.xlsform.converter.model.form;

import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Leaf node holding a single question.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class FieldNode extends FormNode {
    private FieldType fieldType;
    private String choiceOriginRef;
    private String html;
    private FieldValidation validation;
    private String constraint;
    private String calculation;

    @Builder
    public FieldNode(String name, String label, String relevant, int sourceLine,
                     FieldType fieldType, String choiceOriginRef, String html,
                     FieldValidation validation, String constraint, String calculation) {
        this.name = name;
        this.label = label;
        this.relevant = relevant;
        this.sourceLine = sourceLine;
        this.fieldType = fieldType;
        this.choiceOriginRef = choiceOriginRef;
        this.html = html;
        this.validation = validation;
        this.constraint = constraint;
        this.calculation = calculation;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.FIELD;
    }

    @Override
    public List<FormNode> getChildren() {
        return List.of();
    }

    @Override
    public void accept(FormNodeVisitor visitor) {
        visitor.visit(this);
    }
}
