package com.williamcallahan.asciimarkdown.service.markdown;

import com.williamcallahan.asciimarkdown.domain.document.Node;
import com.williamcallahan.asciimarkdown.domain.document.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests conversion of flexmark documents into the plain-text document tree.
 */
class FlexmarkDocumentAdapterTest {

    private FlexmarkDocumentAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new FlexmarkDocumentAdapter();
    }

    @Test
    @DisplayName("Headings are numbered as dotted sections")
    void headingNumbers() {
        Node root = adapter.parse("# A\n\n## B\n\n## C\n\n# D\n");

        assertThat(descendants(root, NodeKind.HEADER))
            .extracting(header -> header.fullMark().orElse(""))
            .containsExactly("1", "1.1", "1.2", "2");
    }

    @Test
    @DisplayName("Section numbers start at the shallowest heading level")
    void headingNumbersRelativeToShallowestLevel() {
        Node root = adapter.parse("## A\n\n### B\n\n## C\n");

        assertThat(descendants(root, NodeKind.HEADER))
            .extracting(header -> header.fullMark().orElse(""))
            .containsExactly("1", "1.1", "2");
    }

    @Test
    @DisplayName("Skipped heading levels nest one section deeper than the open one")
    void skippedHeadingLevels() {
        Node root = adapter.parse("##### deep\n\n# top\n\n### child\n");

        assertThat(descendants(root, NodeKind.HEADER))
            .extracting(header -> header.fullMark().orElse(""))
            .containsExactly("1", "2", "2.1");
    }

    @Test
    @DisplayName("Definition terms and descriptions are not list items")
    void definitionListsAreNotListItems() {
        Node root = adapter.parse("1. first\n\nTerm\n: Definition\n\n2. second\n");

        assertThat(descendants(root, NodeKind.DEFINITION_LIST)).hasSize(1);
        assertThat(descendants(root, NodeKind.DEFINITION_TERM)).hasSize(1);
        assertThat(descendants(root, NodeKind.DEFINITION_DESCRIPTION)).hasSize(1);
        assertThat(descendants(root, NodeKind.LIST_ITEM))
            .extracting(item -> item.fullMark().orElse(""))
            .containsExactly("1", "2");
    }

    @Test
    @DisplayName("Nested ordered lists switch from numbers to letters")
    void orderedItemMarks() {
        Node root = adapter.parse("1. one\n2. two\n   1. sub\n   2. sub\n");

        assertThat(descendants(root, NodeKind.LIST_ITEM))
            .extracting(item -> item.fullMark().orElse(""))
            .containsExactly("1", "2", "2.a", "2.b");
    }

    @Test
    @DisplayName("Ordered lists count from their start number")
    void orderedListStartNumber() {
        Node root = adapter.parse("3. three\n4. four\n");

        assertThat(descendants(root, NodeKind.LIST_ITEM))
            .extracting(item -> item.fullMark().orElse(""))
            .containsExactly("3", "4");
    }

    @Test
    @DisplayName("Bullet list items carry no mark")
    void bulletItemsHaveNoMark() {
        Node root = adapter.parse("- a\n- b\n");

        assertThat(descendants(root, NodeKind.UNORDERED_LIST)).hasSize(1);
        assertThat(descendants(root, NodeKind.LIST_ITEM)).allMatch(item -> item.fullMark().isEmpty());
    }

    @Test
    @DisplayName("Soft breaks join with a space, except between wide characters")
    void softBreaks() {
        assertEquals("alpha beta", firstText(adapter.parse("alpha\nbeta\n")));
        assertEquals("漢字漢字", firstText(adapter.parse("漢字\n漢字\n")));
    }

    @Test
    @DisplayName("Fenced code keeps its content")
    void fencedCode() {
        Node root = adapter.parse("```java\nint x = 1;\n```\n");

        List<Node> code = descendants(root, NodeKind.CODEBLOCK);
        assertThat(code).hasSize(1);
        assertEquals("int x = 1;\n", code.get(0).text());
    }

    @Test
    @DisplayName("References, labels, action items and issues are recognised in text")
    void inlineConstructs() {
        Node root = adapter.parse("# Intro [label:intro]\n\nSee [ref:intro], -->(bob) and #12.\n");

        assertThat(descendants(root, NodeKind.LABEL)).extracting(Node::text).containsExactly("intro");
        assertThat(descendants(root, NodeKind.REFERENCE)).extracting(Node::text).containsExactly("intro");
        assertThat(descendants(root, NodeKind.ACTION_ITEM)).hasSize(1);
        assertThat(descendants(root, NodeKind.ISSUE_LINK))
            .extracting(node -> node.optionText(Node.OPTION_MATCH))
            .containsExactly("#12");
    }

    @Test
    @DisplayName("Links and images keep their targets as attributes")
    void linksAndImages() {
        Node root = adapter.parse("[site](https://example.org \"Home\") ![logo](logo.png)\n");

        Node link = descendants(root, NodeKind.LINK).get(0);
        assertThat(link.attribute(Node.ATTR_HREF)).contains("https://example.org");
        assertThat(link.attribute(Node.ATTR_TITLE)).contains("Home");
        assertThat(descendants(root, NodeKind.IMAGE).get(0).attribute(Node.ATTR_SRC)).contains("logo.png");
    }

    @Test
    @DisplayName("Inline HTML comments are kept as silent span nodes")
    void htmlComments() {
        Node root = adapter.parse("before <!-- note --> after\n");

        assertThat(descendants(root, NodeKind.XML_COMMENT)).hasSize(1);
    }

    @Test
    @DisplayName("Spans never contain blocks")
    void spansHoldOnlySpans() {
        Node root = adapter.parse("# T\n\n> *quote* with `code`\n\n- [x](y) **b**\n\n| a | b |\n|---|---|\n| 1 | 2 |\n");

        assertThat(allNodes(root))
            .filteredOn(node -> !node.isBlock())
            .allSatisfy(span -> assertThat(span.children()).noneMatch(Node::isBlock));
    }

    private static String firstText(Node root) {
        Optional<Node> text = descendants(root, NodeKind.TEXT).stream().findFirst();
        return text.map(Node::text).orElse("");
    }

    private static List<Node> descendants(Node root, NodeKind kind) {
        return allNodes(root).stream().filter(node -> node.kind() == kind).toList();
    }

    private static List<Node> allNodes(Node root) {
        List<Node> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    private static void collect(Node node, List<Node> nodes) {
        nodes.add(node);
        node.children().forEach(child -> collect(child, nodes));
    }
}
