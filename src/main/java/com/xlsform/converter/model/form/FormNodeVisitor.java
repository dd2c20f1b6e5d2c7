package com.xlsform.converter.model.form;

/**
 * Visitor over the form tree node kinds.
 */
public interface FormNodeVisitor {
    void visit(FieldNode node);
    void visit(GroupNode node);
    void visit(RepeatingSlideNode node);
}
