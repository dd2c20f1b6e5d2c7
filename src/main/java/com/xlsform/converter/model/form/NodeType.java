package com.xlsform.converter.model.form;

/**
 * Kind of a node in the converted form tree.
 */
public enum NodeType {
    FIELD,
    GROUP,
    SLIDE,
    REPEATING_SLIDE
}
