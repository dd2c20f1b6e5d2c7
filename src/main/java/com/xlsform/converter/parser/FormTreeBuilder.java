package com.xlsform.converter.parser;

import java.util.List;
import java.util.regex.Pattern;

import com.xlsform.converter.converter.ConversionErrorKind;
import com.xlsform.converter.converter.ConversionException;
import com.xlsform.converter.mapper.FieldTypeMapper;
import com.xlsform.converter.model.form.GroupNode;
import com.xlsform.converter.model.form.RepeatingSlideNode;
import com.xlsform.converter.model.input.SurveyRow;

/**
 * Recursive-descent construction of the form tree from preprocessed survey rows.
 *
 * Each block is handled as an index range {@code [begin, end]} where {@code begin}
 * holds a "begin group"/"begin repeat" row and {@code end} its matching close.
 * No cursor is shared between calls.
 */
public class FormTreeBuilder {

    static final int MAX_REPEAT_COUNT = 0xFFFF;
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    /** A built block and the index just past its closing row. */
    record BuiltBlock(GroupNode node, int next) {
    }

    /**
     * Build the tree rooted at the synthetic top-level group.
     *
     * @param rows output of {@link StructurePreprocessor#preprocess(List)}
     * @return the top-level group, whose children are the form sections
     */
    public GroupNode build(List<SurveyRow> rows) {
        if (rows.isEmpty()) {
            throw new IllegalStateException("no rows to build from");
        }
        BuiltBlock root = buildBlock(rows, 0, matchingClose(rows, 0));
        if (root.next() != rows.size()) {
            throw new IllegalStateException("rows found after the top-level group");
        }
        return root.node();
    }

    BuiltBlock buildBlock(List<SurveyRow> rows, int begin, int end) {
        SurveyRow open = rows.get(begin);
        if (!RowTypes.isBlockOpen(open.getType())) {
            throw new IllegalStateException("not a group: " + open.getType());
        }
        GroupNode block = newBlock(open);

        int i = begin + 1;
        while (i < end) {
            SurveyRow row = rows.get(i);
            String type = row.getType();

            if (RowTypes.isBlockOpen(type)) {
                BuiltBlock child = buildBlock(rows, i, matchingClose(rows, i));
                block.addChild(child.node());
                i = child.next();
                continue;
            }

            if (RowTypes.isBlockClose(type)) {
                throw new IllegalStateException("unexpected \"" + type + "\" inside block \"" + open.getName() + "\"");
            } else if (RowTypes.isSupportedField(type)) {
                block.addChild(FieldTypeMapper.toField(row));
            } else if (RowTypes.isUnsupportedField(type)) {
                throw new ConversionException(ConversionErrorKind.TYPE, row.getLineNumber(),
                        "Field type \"" + type + "\" is not supported");
            } else {
                throw new ConversionException(ConversionErrorKind.TYPE, row.getLineNumber(),
                        "Invalid type \"" + type + "\" in survey");
            }
            i++;
        }
        return new BuiltBlock(block, end + 1);
    }

    /**
     * Index of the row closing the block opened at {@code begin}. Groups and repeats
     * share one depth counter.
     */
    int matchingClose(List<SurveyRow> rows, int begin) {
        int depth = 1;
        for (int i = begin + 1; i < rows.size(); i++) {
            String type = rows.get(i).getType();
            if (RowTypes.isBlockOpen(type)) {
                depth++;
            } else if (RowTypes.isBlockClose(type)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new IllegalStateException("block end not found for \"" + rows.get(begin).getName() + "\"");
    }

    private GroupNode newBlock(SurveyRow open) {
        String relevant = open.getRelevant().isEmpty() ? null : open.getRelevant();
        if (RowTypes.BEGIN_REPEAT.equals(open.getType())) {
            return new RepeatingSlideNode(open.getName(), open.getLabel(), relevant, open.getLineNumber(),
                    null, parseRepeatCount(open));
        }
        return GroupNode.builder()
                .name(open.getName())
                .label(open.getLabel())
                .relevant(relevant)
                .sourceLine(open.getLineNumber())
                .build();
    }

    private Integer parseRepeatCount(SurveyRow row) {
        String raw = row.getRepeatCount();
        if (raw.isEmpty()) {
            return null;
        }
        if (!DIGITS.matcher(raw).matches()) {
            throw new ConversionException(ConversionErrorKind.VALUE, row.getLineNumber(),
                    "Invalid repeat count \"" + raw + "\"");
        }
        int count;
        try {
            count = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConversionException(ConversionErrorKind.VALUE, row.getLineNumber(),
                    "Invalid repeat count \"" + raw + "\"");
        }
        if (count <= 0 || count > MAX_REPEAT_COUNT) {
            throw new ConversionException(ConversionErrorKind.VALUE, row.getLineNumber(),
                    "Repeat count " + count + " out of range 1-" + MAX_REPEAT_COUNT);
        }
        return count;
    }
}
