package com.xlsform.converter.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.xlsform.converter.converter.ConversionErrorKind;
import com.xlsform.converter.converter.ConversionException;
import com.xlsform.converter.model.input.SurveyRow;

/**
 * Checks group/repeat nesting of the raw survey rows and wraps them so that the
 * tree builder always receives exactly one top-level group.
 *
 * Rules:
 * - groups and repeats must balance, each closed by its own end token
 * - a repeat can only be opened at the top level, and nothing opens inside a repeat
 * - questions outside any block cannot coexist with repeats
 *
 * Ungrouped questions get wrapped in a synthetic "form" group; the result is always
 * wrapped in a synthetic "global" group. Synthetic rows carry line number 0.
 */
public class StructurePreprocessor {

    public static final String FORM_GROUP_NAME = "form";
    public static final String GLOBAL_GROUP_NAME = "global";

    private enum Block { GROUP, REPEAT }

    private record OpenBlock(Block block, SurveyRow row) {
    }

    public List<SurveyRow> preprocess(List<SurveyRow> survey) {
        Deque<OpenBlock> stack = new ArrayDeque<>();
        SurveyRow firstUngrouped = null;
        boolean hasRepeats = false;

        for (SurveyRow row : survey) {
            switch (row.getType()) {
                case RowTypes.BEGIN_GROUP -> {
                    if (!stack.isEmpty() && stack.peek().block() == Block.REPEAT) {
                        throw structural(row, "groups can't be nested inside repeats");
                    }
                    stack.push(new OpenBlock(Block.GROUP, row));
                }
                case RowTypes.END_GROUP -> {
                    if (stack.isEmpty() || stack.peek().block() != Block.GROUP) {
                        throw structural(row, "\"end group\" without a matching \"begin group\"");
                    }
                    stack.pop();
                }
                case RowTypes.BEGIN_REPEAT -> {
                    if (!stack.isEmpty()) {
                        throw structural(row, "repeats can't be nested");
                    }
                    hasRepeats = true;
                    stack.push(new OpenBlock(Block.REPEAT, row));
                }
                case RowTypes.END_REPEAT -> {
                    if (stack.isEmpty() || stack.peek().block() != Block.REPEAT) {
                        throw structural(row, "\"end repeat\" without a matching \"begin repeat\"");
                    }
                    stack.pop();
                }
                default -> {
                    if (stack.isEmpty() && firstUngrouped == null) {
                        firstUngrouped = row;
                    }
                }
            }
        }

        if (!stack.isEmpty()) {
            OpenBlock unclosed = stack.peek();
            String kind = unclosed.block() == Block.GROUP ? "group" : "repeat";
            throw structural(unclosed.row(), "unterminated " + kind + " \"" + unclosed.row().getName() + "\"");
        }

        if (firstUngrouped != null && hasRepeats) {
            throw structural(firstUngrouped, "repeats and ungrouped questions cannot coexist");
        }

        List<SurveyRow> result = survey;
        if (firstUngrouped != null) {
            result = wrap(result, FORM_GROUP_NAME, "Form");
        }
        return wrap(result, GLOBAL_GROUP_NAME, "Global");
    }

    private static List<SurveyRow> wrap(List<SurveyRow> rows, String name, String label) {
        List<SurveyRow> wrapped = new ArrayList<>(rows.size() + 2);
        wrapped.add(SurveyRow.builder().type(RowTypes.BEGIN_GROUP).name(name).label(label).build());
        wrapped.addAll(rows);
        wrapped.add(SurveyRow.builder().type(RowTypes.END_GROUP).build());
        return wrapped;
    }

    private static ConversionException structural(SurveyRow row, String message) {
        return new ConversionException(ConversionErrorKind.STRUCTURAL, row.getLineNumber(), message);
    }
}
