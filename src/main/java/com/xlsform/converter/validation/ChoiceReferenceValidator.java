package com.xlsform.converter.validation;

import com.xlsform.converter.choices.ChoiceOrigins;
import com.xlsform.converter.converter.ConversionErrorKind;
import com.xlsform.converter.converter.ConversionException;
import com.xlsform.converter.model.form.FieldNode;
import com.xlsform.converter.model.form.FormNode;
import com.xlsform.converter.model.form.FormNodeVisitor;
import com.xlsform.converter.model.form.GroupNode;
import com.xlsform.converter.model.form.RepeatingSlideNode;

/**
 * Checks that every single/multiple choice field refers to a defined choice list.
 * Stops at the first undefined reference, in tree order.
 */
public class ChoiceReferenceValidator {

    public void validate(FormNode root, ChoiceOrigins choiceOrigins) {
        root.accept(new ReferenceVisitor(choiceOrigins));
    }

    private static final class ReferenceVisitor implements FormNodeVisitor {
        private final ChoiceOrigins choiceOrigins;

        private ReferenceVisitor(ChoiceOrigins choiceOrigins) {
            this.choiceOrigins = choiceOrigins;
        }

        @Override
        public void visit(FieldNode node) {
            if (node.getFieldType().isChoice() && !choiceOrigins.isDefined(node.getChoiceOriginRef())) {
                throw new ConversionException(ConversionErrorKind.REFERENCE, node.getSourceLine(),
                        "Undefined choice list \"" + node.getChoiceOriginRef() + "\" in field \"" + node.getName() + "\"");
            }
        }

        @Override
        public void visit(GroupNode node) {
            visitChildren(node);
        }

        @Override
        public void visit(RepeatingSlideNode node) {
            visitChildren(node);
        }

        private void visitChildren(GroupNode node) {
            for (FormNode child : node.getChildren()) {
                child.accept(this);
            }
        }
    }
}
