package com.williamcallahan.asciimarkdown.service.markdown;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests line breaking against a column budget.
 */
class ColumnWrapperTest {

    @Test
    void shortLineIsReturnedUnchanged() {
        assertThat(ColumnWrapper.wrap("fits", 10)).containsExactly("fits");
    }

    @Test
    void breaksAtLastSpaceAndDropsIt() {
        List<String> lines = ColumnWrapper.wrap("aaaa bbbb cccc dddd eeee ffff", 20);

        assertThat(lines).containsExactly("aaaa bbbb cccc dddd", "eeee ffff");
    }

    @Test
    void everyLineFitsTheBudget() {
        String text = "The quick brown fox jumps over the lazy dog and keeps running far away";

        List<String> lines = ColumnWrapper.wrap(text, 12);

        assertThat(lines).allSatisfy(line -> assertThat(DisplayWidth.of(line)).isLessThanOrEqualTo(12));
        assertThat(String.join(" ", lines)).isEqualTo(text);
    }

    @Test
    void debugMarkersTakeNoColumns() {
        String full = "<SPAN:text>" + "x".repeat(20) + "</SPAN:text>";

        assertThat(ColumnWrapper.wrap(full, 20, AsciiRenderer.DEBUG_MARKER)).containsExactly(full);
        assertThat(ColumnWrapper.wrap("<SPAN:text>aaaa bbbb cccc dddd eeee ffff</SPAN:text>", 20, AsciiRenderer.DEBUG_MARKER))
            .containsExactly("<SPAN:text>aaaa bbbb cccc dddd", "eeee ffff</SPAN:text>");
    }

    @Test
    void wordLongerThanBudgetIsHardBroken() {
        assertThat(ColumnWrapper.wrap("abcdefghij", 4)).containsExactly("abcd", "efgh", "ij");
    }

    @Test
    void wideCharactersAreNeverSplit() {
        List<String> lines = ColumnWrapper.wrap("漢字漢字漢字", 5);

        assertThat(lines).containsExactly("漢字", "漢字", "漢字");
    }

    @Test
    void wideCharacterWiderThanBudgetGetsOwnLine() {
        assertThat(ColumnWrapper.wrap("漢字", 1)).containsExactly("漢", "字");
    }

    @Test
    void continuationLinesDoNotStartWithSpaces() {
        List<String> lines = ColumnWrapper.wrap("abcd   efgh", 4);

        assertThat(lines).containsExactly("abcd", "efgh");
    }
}
