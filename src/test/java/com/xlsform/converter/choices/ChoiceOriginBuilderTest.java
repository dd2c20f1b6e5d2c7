package com.xlsform.converter.choices;

import static com.xlsform.converter.TestRows.choice;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.xlsform.converter.model.form.Choice;
import com.xlsform.converter.model.form.ChoiceOrigin;
import com.xlsform.converter.model.form.ChoiceOriginType;
import com.xlsform.converter.model.form.ChoicesType;

/**
 * Unit tests for ChoiceOriginBuilder.
 */
class ChoiceOriginBuilderTest {

    private final ChoiceOriginBuilder builder = new ChoiceOriginBuilder();

    @Test
    void testGroupsByListNameInFirstSeenOrder() {
        ChoiceOrigins result = builder.build(List.of(
                choice("sizes", "s", 2),
                choice("colors", "red", 3),
                choice("sizes", "m", 4),
                choice("colors", "blue", 5),
                choice("animals", "cat", 6),
                choice("sizes", "l", 7)));

        assertThat(result.getOrigins()).extracting(ChoiceOrigin::getName)
                .containsExactly("sizes", "colors", "animals");
        assertThat(result.getOrigins().get(0).getChoices()).extracting(Choice::getValue)
                .containsExactly("s", "m", "l");
        assertThat(result.getChoicesByList().get("colors"))
                .containsExactly(new Choice("red", "RED"), new Choice("blue", "BLUE"));
    }

    @Test
    void testNoRowIsDropped() {
        ChoiceOrigins result = builder.build(List.of(
                choice("a", "1", 2),
                choice("a", "1", 3),
                choice("b", "x", 4)));

        int total = result.getOrigins().stream().mapToInt(o -> o.getChoices().size()).sum();
        assertThat(total).isEqualTo(3);
        assertThat(result.getChoicesByList().get("a")).hasSize(2);
    }

    @Test
    void testPublishedListsAreReadOnly() {
        ChoiceOrigins result = builder.build(List.of(choice("a", "1", 2)));

        assertThatThrownBy(() -> result.getChoicesByList().get("a").add(new Choice("2", "2")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getChoicesByList().put("b", List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testOriginsAreFixedStringLists() {
        ChoiceOrigin origin = builder.build(List.of(choice("a", "1", 2))).getOrigins().get(0);

        assertThat(origin.getType()).isEqualTo(ChoiceOriginType.FIXED);
        assertThat(origin.getChoicesType()).isEqualTo(ChoicesType.STRING);
    }

    @Test
    void testListNamesMatchExactly() {
        ChoiceOrigins result = builder.build(List.of(
                choice("Colors", "red", 2),
                choice("colors", "blue", 3)));

        assertThat(result.getOrigins()).hasSize(2);
        assertThat(result.isDefined("colors")).isTrue();
        assertThat(result.isDefined("COLORS")).isFalse();
    }

    @Test
    void testEmptyInput() {
        ChoiceOrigins result = builder.build(List.of());

        assertThat(result.getOrigins()).isEmpty();
        assertThat(result.getChoicesByList()).isEmpty();
    }
}
