package com.xlsform.converter.model.form;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Result of a conversion: the choice origins and the top-level slides.
 */
@Value
@Builder
public class AjfForm {
    List<ChoiceOrigin> choicesOrigins;
    List<FormNode> slides;

    /**
     * Count of field nodes across the whole tree.
     */
    public int countFields() {
        return countFields(slides);
    }

    private static int countFields(List<FormNode> nodes) {
        int count = 0;
        for (FormNode node : nodes) {
            if (node instanceof FieldNode) {
                count++;
            } else {
                count += countFields(node.getChildren());
            }
        }
        return count;
    }
}
