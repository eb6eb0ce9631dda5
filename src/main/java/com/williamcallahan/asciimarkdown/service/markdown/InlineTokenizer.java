package com.williamcallahan.asciimarkdown.service.markdown;

import com.williamcallahan.asciimarkdown.domain.document.Node;
import com.williamcallahan.asciimarkdown.domain.document.NodeKind;
import com.williamcallahan.asciimarkdown.domain.document.NodeValue;
import com.williamcallahan.asciimarkdown.domain.document.SmartQuote;
import com.williamcallahan.asciimarkdown.domain.document.TypographicSymbol;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a run of plain text into span nodes, recognising the inline constructs that the
 * markdown parser leaves as literal text:
 * <ul>
 *   <li>{@code [ref:NAME]}, {@code [ref:++]}, {@code [ref:--]} references</li>
 *   <li>{@code [label:NAME]} labels</li>
 *   <li>{@code -->(assignee)} action items</li>
 *   <li>{@code #42} and {@code owner/repo#42} issue links</li>
 *   <li>Unicode dashes, ellipsis, guillemets and curly quotes</li>
 * </ul>
 */
final class InlineTokenizer {

    private static final Pattern CONSTRUCT = Pattern.compile(
        "\\[ref:(?<ref>[^\\]\\s]+)]"
            + "|\\[label:(?<label>[^\\]\\s]+)]"
            + "|-->\\((?<assignee>[^)]*)\\)"
            + "|(?<![\\w/#])(?<issue>(?:[A-Za-z0-9_.-]+/[A-Za-z0-9_.-]+)?#\\d+)(?!\\w)");

    private InlineTokenizer() {}

    /**
     * Tokenizes a text run.
     *
     * @param text literal text with soft breaks already joined
     * @return span nodes in source order; empty for empty input
     */
    static List<Node> tokenize(String text) {
        List<Node> nodes = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return nodes;
        }
        Matcher matcher = CONSTRUCT.matcher(text);
        int cursor = 0;
        while (matcher.find()) {
            appendTypographic(text.substring(cursor, matcher.start()), nodes);
            nodes.add(constructNode(matcher));
            cursor = matcher.end();
        }
        appendTypographic(text.substring(cursor), nodes);
        return nodes;
    }

    private static Node constructNode(Matcher matcher) {
        if (matcher.group("ref") != null) {
            return Node.ofText(NodeKind.REFERENCE, matcher.group("ref"));
        }
        if (matcher.group("label") != null) {
            return Node.ofText(NodeKind.LABEL, matcher.group("label"));
        }
        if (matcher.group("assignee") != null) {
            return Node.of(NodeKind.ACTION_ITEM).withOption(Node.OPTION_ASSIGNEE, matcher.group("assignee"));
        }
        return Node.of(NodeKind.ISSUE_LINK).withOption(Node.OPTION_MATCH, matcher.group("issue"));
    }

    private static void appendTypographic(String text, List<Node> nodes) {
        StringBuilder plain = new StringBuilder();
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            NodeValue typographic = typographicValue(text, index);
            if (typographic == null) {
                plain.append(current);
                continue;
            }
            flushPlain(plain, nodes);
            NodeKind kind = typographic instanceof NodeValue.QuoteValue ? NodeKind.SMART_QUOTE : NodeKind.TYPOGRAPHIC_SYMBOL;
            nodes.add(Node.of(kind, typographic));
        }
        flushPlain(plain, nodes);
    }

    private static NodeValue typographicValue(String text, int index) {
        return switch (text.charAt(index)) {
            case '\u2014' -> new NodeValue.SymbolValue(TypographicSymbol.MDASH);
            case '\u2013' -> new NodeValue.SymbolValue(TypographicSymbol.NDASH);
            case '\u2026' -> new NodeValue.SymbolValue(TypographicSymbol.HELLIP);
            case '\u00AB' -> new NodeValue.SymbolValue(
                index + 1 < text.length() && text.charAt(index + 1) == ' '
                    ? TypographicSymbol.LAQUO_SPACE
                    : TypographicSymbol.LAQUO);
            case '\u00BB' -> new NodeValue.SymbolValue(
                index > 0 && text.charAt(index - 1) == ' '
                    ? TypographicSymbol.RAQUO_SPACE
                    : TypographicSymbol.RAQUO);
            case '\u2018' -> new NodeValue.QuoteValue(SmartQuote.LSQUO);
            case '\u2019' -> new NodeValue.QuoteValue(SmartQuote.RSQUO);
            case '\u201C' -> new NodeValue.QuoteValue(SmartQuote.LDQUO);
            case '\u201D' -> new NodeValue.QuoteValue(SmartQuote.RDQUO);
            default -> null;
        };
    }

    private static void flushPlain(StringBuilder plain, List<Node> nodes) {
        if (plain.length() > 0) {
            nodes.add(Node.text(plain.toString()));
            plain.setLength(0);
        }
    }
}
