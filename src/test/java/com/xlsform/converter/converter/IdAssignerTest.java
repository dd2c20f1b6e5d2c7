package com.xlsform.converter.converter;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.xlsform.converter.model.form.FieldNode;
import com.xlsform.converter.model.form.FieldType;
import com.xlsform.converter.model.form.FormNode;
import com.xlsform.converter.model.form.GroupNode;

/**
 * Unit tests for IdAssigner.
 */
class IdAssignerTest {

    private final IdAssigner assigner = new IdAssigner();

    @Test
    void testFirstChildAndSiblingRules() {
        GroupNode slide1 = group("slide1", field("a"), field("b"), group("nested", field("c"), field("d")));
        GroupNode slide2 = group("slide2", field("e"));

        assigner.assignIds(List.of(slide1, slide2));

        assertIds(slide1, 1, 0);
        assertIds(slide1.getChildren().get(0), 1001, 1);
        assertIds(slide1.getChildren().get(1), 1002, 1001);
        FormNode nested = slide1.getChildren().get(2);
        assertIds(nested, 1003, 1002);
        assertIds(nested.getChildren().get(0), 1003001, 1003);
        assertIds(nested.getChildren().get(1), 1003002, 1003001);
        assertIds(slide2, 2, 1);
        assertIds(slide2.getChildren().get(0), 2001, 2);
    }

    @Test
    void testIdsAreUniqueAndPositive() {
        List<FormNode> slides = new ArrayList<>();
        for (int s = 0; s < 5; s++) {
            GroupNode slide = group("s" + s);
            for (int g = 0; g < 20; g++) {
                GroupNode inner = group("g" + g);
                for (int f = 0; f < 30; f++) {
                    inner.addChild(field("f" + f));
                }
                slide.addChild(inner);
            }
            slides.add(slide);
        }

        assigner.assignIds(slides);

        List<Long> ids = new ArrayList<>();
        collectIds(slides, ids);
        assertThat(ids).hasSize(5 + 5 * 20 + 5 * 20 * 30);
        assertThat(ids).doesNotHaveDuplicates();
        assertThat(ids).allMatch(id -> id > 0);
    }

    @Test
    void testMaximumFanOutIsAccepted() {
        GroupNode slide = group("slide");
        for (int i = 0; i < IdAssigner.MAX_CHILDREN; i++) {
            slide.addChild(field("f" + i));
        }

        assigner.assignIds(List.of(slide));

        assertThat(slide.getChildren().get(IdAssigner.MAX_CHILDREN - 1).getId()).isEqualTo(1999);
    }

    @Test
    void testFanOutBeyondIdSpaceFailsLoudly() {
        GroupNode slide = group("slide");
        for (int i = 0; i < IdAssigner.MAX_CHILDREN + 1; i++) {
            FieldNode f = field("f" + i);
            f.setSourceLine(i + 2);
            slide.addChild(f);
        }

        assertThatThrownBy(() -> assigner.assignIds(List.of(slide)))
                .isInstanceOf(ConversionException.class)
                .hasFieldOrPropertyWithValue("kind", ConversionErrorKind.STRUCTURAL)
                .hasFieldOrPropertyWithValue("lineNumber", IdAssigner.MAX_CHILDREN + 2);
    }

    @Test
    void testDeepNestingOverflowFailsLoudly() {
        // seven levels reach ids near 10^18; the eighth no longer fits in a long
        GroupNode top = group("level1");
        GroupNode current = top;
        for (int depth = 2; depth <= 8; depth++) {
            GroupNode next = group("level" + depth);
            next.setSourceLine(depth + 10);
            current.addChild(next);
            current = next;
        }

        assertThatThrownBy(() -> assigner.assignIds(List.of(top)))
                .isInstanceOf(ConversionException.class)
                .hasFieldOrPropertyWithValue("kind", ConversionErrorKind.STRUCTURAL)
                .hasFieldOrPropertyWithValue("lineNumber", 18);
    }

    @Test
    void testSiblingIdOverflowFailsLoudly() {
        // the last node at each level carries the next level, so the parent of the
        // final level has id 9223372036854775 and its 808th child is Long.MAX_VALUE + 1
        int[] fanOut = { 9, 223, 372, 36, 854, 775, 808 };
        List<FormNode> topLevel = new ArrayList<>();
        List<FormNode> level = topLevel;
        FieldNode lastLeaf = null;
        for (int depth = 0; depth < fanOut.length; depth++) {
            boolean leafLevel = depth == fanOut.length - 1;
            GroupNode parent = null;
            for (int i = 0; i < fanOut[depth]; i++) {
                boolean carrier = i == fanOut[depth] - 1;
                if (carrier && !leafLevel) {
                    parent = group("g" + depth);
                    level.add(parent);
                } else {
                    FieldNode f = field("f" + depth + "_" + i);
                    f.setSourceLine(i + 2);
                    level.add(f);
                    lastLeaf = f;
                }
            }
            if (parent != null) {
                level = parent.getChildren();
            }
        }

        assertThatThrownBy(() -> assigner.assignIds(topLevel))
                .isInstanceOf(ConversionException.class)
                .hasFieldOrPropertyWithValue("kind", ConversionErrorKind.STRUCTURAL)
                .hasFieldOrPropertyWithValue("lineNumber", lastLeaf.getSourceLine());
        assertThat(lastLeaf.getSourceLine()).isEqualTo(809);
    }

    @Test
    void testEmptyForestIsNoOp() {
        assertThatCode(() -> assigner.assignIds(List.of())).doesNotThrowAnyException();
    }

    private static void assertIds(FormNode node, long id, long previous) {
        assertThat(node.getId()).as("id of %s", node.getName()).isEqualTo(id);
        assertThat(node.getPrevious()).as("previous of %s", node.getName()).isEqualTo(previous);
    }

    private static void collectIds(List<FormNode> nodes, List<Long> ids) {
        for (FormNode node : nodes) {
            ids.add(node.getId());
            collectIds(node.getChildren(), ids);
        }
    }

    private static GroupNode group(String name, FormNode... children) {
        GroupNode group = GroupNode.builder().name(name).label(name).build();
        for (FormNode child : children) {
            group.addChild(child);
        }
        return group;
    }

    private static FieldNode field(String name) {
        return FieldNode.builder().name(name).label(name).fieldType(FieldType.STRING).build();
    }
}
