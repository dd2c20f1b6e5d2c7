package com.xlsform.converter.model.form;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Non-repeating container. A group that ends up at the top level of the form
 * is published as a slide.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class GroupNode extends FormNode {
    private List<FormNode> children = new ArrayList<>();
    @JsonIgnore
    private boolean slide;

    @Builder
    public GroupNode(String name, String label, String relevant, int sourceLine,
                     List<FormNode> children, boolean slide) {
        this.name = name;
        this.label = label;
        this.relevant = relevant;
        this.sourceLine = sourceLine;
        this.children = children != null ? children : new ArrayList<>();
        this.slide = slide;
    }

    public void addChild(FormNode child) {
        children.add(child);
    }

    @Override
    public NodeType getNodeType() {
        return slide ? NodeType.SLIDE : NodeType.GROUP;
    }

    @Override
    public void accept(FormNodeVisitor visitor) {
        visitor.visit(this);
    }
}
