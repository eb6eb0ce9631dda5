package com.williamcallahan.asciimarkdown.service.markdown;

import com.williamcallahan.asciimarkdown.domain.document.Node;
import com.williamcallahan.asciimarkdown.domain.document.NodeValue;

/**
 * Prints the shape of a document tree, one node per line, for diagnosing parser output.
 *
 * <pre>{@code
 * root(BLOCK) <<>>
 *   header(BLOCK) <<1>>
 *     text(SPAN) <<Title>>
 * }</pre>
 */
final class DebugTreeDumper {

    private static final int INDENT_STEP = 2;

    private DebugTreeDumper() {}

    static String dump(Node root) {
        StringBuilder out = new StringBuilder();
        dump(root, 0, out);
        return out.toString();
    }

    private static void dump(Node node, int indent, StringBuilder out) {
        out.append(" ".repeat(indent))
            .append(node.kind().tag())
            .append('(').append(node.category()).append(')')
            .append(" <<").append(describe(node).replace("\n", "\\n")).append(">>");
        node.relativePosition().ifPresent(position -> out.append(" @").append(position));
        out.append('\n');
        for (Node child : node.children()) {
            dump(child, indent + INDENT_STEP, out);
        }
    }

    private static String describe(Node node) {
        return node.value().map(value -> {
            if (value instanceof NodeValue.TextValue text) {
                return text.text();
            }
            if (value instanceof NodeValue.HeaderMark header) {
                return header.fullMark();
            }
            if (value instanceof NodeValue.ItemMark item) {
                return item.fullMark();
            }
            if (value instanceof NodeValue.SymbolValue symbol) {
                return symbol.symbol().name().toLowerCase(java.util.Locale.ROOT);
            }
            return ((NodeValue.QuoteValue) value).quote().name().toLowerCase(java.util.Locale.ROOT);
        }).orElse("");
    }
}
