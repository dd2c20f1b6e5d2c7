package com.xlsform.converter.model.form;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Base class for all nodes of the converted form tree.
 *
 * {@code id} and {@code previous} stay 0 until ids are assigned on the validated tree.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "nodeType", "id", "previous", "name", "label" })
public abstract class FormNode {
    protected String name;
    protected String label;
    protected long id;
    protected long previous;
    protected String relevant;
    @JsonIgnore
    protected int sourceLine;

    public abstract NodeType getNodeType();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract List<FormNode> getChildren();

    public abstract void accept(FormNodeVisitor visitor);
}
