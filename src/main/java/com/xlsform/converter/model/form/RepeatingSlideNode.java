package com.xlsform.converter.model.form;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Top-level section whose content may be instantiated several times.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class RepeatingSlideNode extends GroupNode {
    private Integer maxRepetitions;

    public RepeatingSlideNode(String name, String label, String relevant, int sourceLine,
                              List<FormNode> children, Integer maxRepetitions) {
        super(name, label, relevant, sourceLine, children != null ? children : new ArrayList<>(), false);
        this.maxRepetitions = maxRepetitions;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.REPEATING_SLIDE;
    }

    @Override
    public void accept(FormNodeVisitor visitor) {
        visitor.visit(this);
    }
}
