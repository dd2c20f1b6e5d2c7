package com.xlsform.converter.converter;

/**
 * Category of a user-facing conversion failure.
 */
public enum ConversionErrorKind {
    /** Unbalanced or illegally nested groups/repeats, repeats mixed with ungrouped questions. */
    STRUCTURAL,
    /** Unsupported or unrecognized row type. */
    TYPE,
    /** Choice field pointing at an undefined choice list. */
    REFERENCE,
    /** Malformed cell value, e.g. a non-numeric repeat count. */
    VALUE
}
