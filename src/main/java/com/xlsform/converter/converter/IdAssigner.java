package com.xlsform.converter.converter;

import java.util.List;

import com.xlsform.converter.model.form.FormNode;

/**
 * Assigns navigation ids to a validated tree.
 *
 * The first child of a node with id P gets {@code P * 1000 + 1} and {@code previous = P};
 * each later sibling gets the prior sibling's id plus one and points back at it.
 * Top-level nodes are the children of a virtual root with id 0.
 *
 * A parent can hold at most 999 children: a 1000th child would step into the id range
 * of the next sibling's descendants, so it is rejected instead.
 */
public class IdAssigner {

    public static final long ID_MULTIPLIER = 1000;
    public static final int MAX_CHILDREN = (int) ID_MULTIPLIER - 1;

    public void assignIds(List<FormNode> topLevel) {
        assignIds(topLevel, 0L);
    }

    private void assignIds(List<FormNode> nodes, long parentId) {
        if (nodes.isEmpty()) {
            return;
        }
        if (nodes.size() > MAX_CHILDREN) {
            FormNode overflow = nodes.get(MAX_CHILDREN);
            throw new ConversionException(ConversionErrorKind.STRUCTURAL, overflow.getSourceLine(),
                    "Too many items in one block: at most " + MAX_CHILDREN + " are allowed");
        }

        FormNode first = nodes.get(0);
        first.setPrevious(parentId);
        first.setId(firstChildId(parentId, first));
        assignIds(first.getChildren(), first.getId());

        for (int i = 1; i < nodes.size(); i++) {
            FormNode node = nodes.get(i);
            FormNode prior = nodes.get(i - 1);
            node.setPrevious(prior.getId());
            node.setId(nextSiblingId(prior, node));
            assignIds(node.getChildren(), node.getId());
        }
    }

    private long firstChildId(long parentId, FormNode child) {
        try {
            return Math.addExact(Math.multiplyExact(parentId, ID_MULTIPLIER), 1L);
        } catch (ArithmeticException e) {
            throw new ConversionException(ConversionErrorKind.STRUCTURAL, child.getSourceLine(),
                    "Nesting too deep to assign an id to \"" + child.getName() + "\"");
        }
    }

    private long nextSiblingId(FormNode prior, FormNode sibling) {
        try {
            return Math.addExact(prior.getId(), 1L);
        } catch (ArithmeticException e) {
            throw new ConversionException(ConversionErrorKind.STRUCTURAL, sibling.getSourceLine(),
                    "Nesting too deep to assign an id to \"" + sibling.getName() + "\"");
        }
    }
}
