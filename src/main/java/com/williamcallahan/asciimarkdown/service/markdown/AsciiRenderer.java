package com.williamcallahan.asciimarkdown.service.markdown;

import com.williamcallahan.asciimarkdown.domain.document.Node;
import com.williamcallahan.asciimarkdown.domain.document.NodeKind;
import com.williamcallahan.asciimarkdown.domain.document.NodeValue;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts an annotated document tree into fixed-width plain text.
 *
 * <p>Block nodes render to self-contained text whose lines already carry their indentation and
 * which ends with exactly one newline. Span nodes render to inline text that the enclosing block
 * collects into its current line buffer; the buffer is wrapped and indented when the block flushes
 * it. Headers and list items hang their content under a bullet such as {@code 1)} or
 * {@code (a)}.</p>
 *
 * <p>A renderer is bound to the {@link ReferenceTables} of one document and is not thread safe.</p>
 */
public class AsciiRenderer {

    static final String SEPARATOR = "-".repeat(23);
    static final int BLOCKQUOTE_OFFSET = 4;
    static final String UNORDERED_BULLET = "*";

    private static final Pattern SPAN_NEWLINE = Pattern.compile("\n *");
    static final Pattern DEBUG_MARKER = Pattern.compile("</?(?:BLOCK|SPAN):[a-z-]+>");
    private static final Pattern LEADING_DEBUG_MARKERS = Pattern.compile("^(?:</?(?:BLOCK|SPAN):[a-z-]+>)*");
    private static final Pattern TRAILING_DEBUG_MARKERS = Pattern.compile("(?:</?(?:BLOCK|SPAN):[a-z-]+>|\\s)*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ReferenceTables tables;
    private final ReferenceResolver resolver;
    private final RenderSettings settings;

    /**
     * Creates a renderer for one resolved document.
     *
     * @param tables output of the reference pass
     * @param settings layout settings
     */
    public AsciiRenderer(ReferenceTables tables, RenderSettings settings) {
        this.tables = Objects.requireNonNull(tables, "Reference tables cannot be null");
        this.settings = Objects.requireNonNull(settings, "Render settings cannot be null");
        this.resolver = new ReferenceResolver(tables);
    }

    /**
     * Renders the whole document.
     *
     * @return plain text ending with a newline
     */
    public String render() {
        return render(tables.root(), 0);
    }

    /**
     * Renders one node at the given indentation.
     *
     * @param node node of the resolved document
     * @param indent column where the node's text starts
     * @return rendered text
     * @throws MalformedDocumentException when a span node contains a block node
     */
    public String render(Node node, int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("Indent must be non-negative: " + indent);
        }
        return convert(node, indent);
    }

    /**
     * Returns how many references rendered as the unresolved placeholder.
     *
     * @return unresolved reference count
     */
    public int unresolvedReferences() {
        return resolver.unresolvedCount();
    }

    private String convert(Node node, int indent) {
        if (!node.isBlock()) {
            requireSpanChildren(node);
        }
        return switch (node.kind()) {
            case ROOT, BLANK, PARAGRAPH, TABLE, TABLE_ROW, TABLE_CELL, TABLE_HEAD, TABLE_BODY, TABLE_FOOT,
                UNORDERED_LIST, ORDERED_LIST, DEFINITION_LIST, DEFINITION_TERM ->
                emit(node, layoutBlock(node, indent, 0, null));
            case HEADER -> emit(node, layoutBlock(node, indent, 0, headerBullet(node)));
            case LIST_ITEM, DEFINITION_DESCRIPTION -> emit(node, layoutBlock(node, indent, 0, itemBullet(node)));
            case BLOCKQUOTE -> emit(node, separatorLine(indent)
                + layoutBlock(node, indent, BLOCKQUOTE_OFFSET, null)
                + separatorLine(indent));
            case CODEBLOCK -> emit(node, verbatim(node.text(), indent));
            case HORIZONTAL_RULE -> emit(node, horizontalRule(indent));
            case TEXT -> emit(node, stripSpanNewlines(node.text()));
            case LINE_BREAK -> emit(node, "\n");
            case EMPHASIS, STRONG -> emit(node, renderInline(node, indent));
            case EMPHASIS_ENTITY, ABBREVIATION -> emit(node, valueOrInline(node, indent));
            case MATH -> emit(node, node.isBlock()
                ? indentLine(valueOrInline(node, indent), indent) + "\n"
                : valueOrInline(node, indent));
            case LINK -> emit(node, link(node));
            case IMAGE -> emit(node, node.attribute(Node.ATTR_SRC).orElse(""));
            case INLINE_CODE -> emit(node, node.text());
            case FOOTNOTE, LABEL, RAW_HTML_ELEMENT, XML_COMMENT, XML_PROCESSING_INSTRUCTION -> emit(node, "");
            case RAW_PASSTHROUGH -> emit(node, node.text() + (node.isBlock() ? "\n" : ""));
            case TYPOGRAPHIC_SYMBOL -> emit(node, typographicSymbol(node));
            case SMART_QUOTE -> emit(node, smartQuote(node));
            case REFERENCE -> emit(node, resolver.resolve(node));
            case ACTION_ITEM -> emit(node, "-->(" + node.optionText(Node.OPTION_ASSIGNEE) + ")");
            case ISSUE_LINK -> emit(node, node.optionText(Node.OPTION_MATCH));
        };
    }

    /**
     * Lays out the children of a block.
     *
     * @param node block node
     * @param indent indentation of the block itself
     * @param addIndent extra indentation for the children
     * @param bullet bullet hung before the first line, or null
     * @return block text ending with exactly one newline
     */
    private String layoutBlock(Node node, int indent, int addIndent, String bullet) {
        int ownIndent = Math.max(0, indent + addIndent);
        int childIndent = bullet == null ? ownIndent : ownIndent + DisplayWidth.of(bullet) + 1;
        boolean wrapLines = settings.wrap() && !isInsideBlockquote(node);

        StringBuilder body = new StringBuilder();
        StringBuilder pending = new StringBuilder();
        for (Node child : node.children()) {
            if (child.isBlock()) {
                flush(pending, body, childIndent, wrapLines);
                body.append(convert(child, childIndent));
            } else if (child.kind() == NodeKind.INLINE_CODE) {
                // inline code directly under a block keeps its bytes on lines of its own
                flush(pending, body, childIndent, wrapLines);
                requireSpanChildren(child);
                body.append(emit(child, verbatim(child.text(), childIndent)));
            } else {
                pending.append(convert(child, childIndent));
            }
        }
        flush(pending, body, childIndent, wrapLines);

        String text = body.toString();
        if (bullet != null) {
            text = hangBullet(bullet, text, ownIndent, childIndent);
        }
        return stripTrailing(text) + "\n";
    }

    private void flush(StringBuilder pending, StringBuilder body, int indent, boolean wrapLines) {
        if (pending.length() == 0) {
            return;
        }
        String inline = pending.toString();
        pending.setLength(0);
        if (visibleText(inline).isBlank()) {
            if (settings.debug()) {
                body.append(inline.replace("\n", ""));
            }
            return;
        }
        Pattern zeroWidth = settings.debug() ? DEBUG_MARKER : null;
        int budget = settings.maxColumn() - indent;
        for (String rawLine : inline.split("\n", -1)) {
            String line = stripTrailing(rawLine);
            if (wrapLines) {
                for (String wrapped : ColumnWrapper.wrap(line, budget, zeroWidth)) {
                    body.append(indentLine(stripTrailing(wrapped), indent)).append('\n');
                }
            } else {
                body.append(indentLine(line, indent)).append('\n');
            }
        }
    }

    /**
     * Puts the bullet in front of the first line. Children were laid out at {@code childIndent},
     * so every other line already hangs under the bullet text. Debug markers opening the first
     * line stay in front of its text.
     */
    private String hangBullet(String bullet, String body, int ownIndent, int childIndent) {
        int lineEnd = body.indexOf('\n');
        String firstLine = lineEnd < 0 ? body : body.substring(0, lineEnd);
        String rest = lineEnd < 0 ? "" : body.substring(lineEnd);

        String markers = "";
        if (settings.debug()) {
            Matcher leading = LEADING_DEBUG_MARKERS.matcher(firstLine);
            leading.lookingAt();
            markers = leading.group();
            firstLine = firstLine.substring(markers.length());
        }
        int strip = 0;
        while (strip < childIndent && strip < firstLine.length() && firstLine.charAt(strip) == ' ') {
            strip++;
        }
        return stripTrailing(" ".repeat(ownIndent) + bullet + " " + markers + firstLine.substring(strip)) + rest;
    }

    private String renderInline(Node node, int indent) {
        StringBuilder inline = new StringBuilder();
        for (Node child : node.children()) {
            inline.append(convert(child, indent));
        }
        return stripSpanNewlines(inline.toString());
    }

    private String valueOrInline(Node node, int indent) {
        String text = node.text();
        return text.isEmpty() ? renderInline(node, indent) : stripSpanNewlines(text);
    }

    private static String link(Node node) {
        return node.firstChild()
            .filter(child -> child.kind() == NodeKind.TEXT && !child.text().isEmpty())
            .map(child -> "[" + child.text() + "]")
            .orElseGet(() -> node.attribute(Node.ATTR_HREF).orElse(""));
    }

    private static String headerBullet(Node header) {
        return header.fullMark().map(mark -> mark + ")").orElse(null);
    }

    private static String itemBullet(Node item) {
        return item.value()
            .filter(NodeValue.ItemMark.class::isInstance)
            .map(value -> "(" + ((NodeValue.ItemMark) value).mark() + ")")
            .orElse(UNORDERED_BULLET);
    }

    private static String typographicSymbol(Node node) {
        return node.value()
            .filter(NodeValue.SymbolValue.class::isInstance)
            .map(value -> ((NodeValue.SymbolValue) value).symbol().ascii())
            .orElse("");
    }

    private static String smartQuote(Node node) {
        return node.value()
            .filter(NodeValue.QuoteValue.class::isInstance)
            .map(value -> ((NodeValue.QuoteValue) value).quote().ascii())
            .orElse("");
    }

    private static String verbatim(String content, int indent) {
        StringBuilder text = new StringBuilder(separatorLine(indent));
        text.append(content);
        if (!content.isEmpty() && !content.endsWith("\n")) {
            text.append('\n');
        }
        return text.append(separatorLine(indent)).toString();
    }

    private String horizontalRule(int indent) {
        return " ".repeat(indent) + "-".repeat(Math.max(1, settings.maxColumn() - indent)) + "\n";
    }

    private static String separatorLine(int indent) {
        return " ".repeat(indent) + SEPARATOR + "\n";
    }

    private static String indentLine(String line, int indent) {
        return line.isEmpty() ? line : " ".repeat(indent) + line;
    }

    /**
     * Right-trims text. In debug mode whitespace before the closing markers at the end is
     * trimmed too, so the markers do not keep it visible.
     */
    private String stripTrailing(String text) {
        if (!settings.debug()) {
            return text.stripTrailing();
        }
        Matcher tail = TRAILING_DEBUG_MARKERS.matcher(text);
        if (!tail.find()) {
            return text;
        }
        return text.substring(0, tail.start()) + WHITESPACE.matcher(tail.group()).replaceAll("");
    }

    private String visibleText(String text) {
        return settings.debug() ? DEBUG_MARKER.matcher(text).replaceAll("") : text;
    }

    private static String stripSpanNewlines(String text) {
        return SPAN_NEWLINE.matcher(text).replaceAll("");
    }

    private static boolean isInsideBlockquote(Node node) {
        return node.kind() == NodeKind.BLOCKQUOTE || node.hasAncestor(NodeKind.BLOCKQUOTE);
    }

    private static void requireSpanChildren(Node span) {
        for (Node child : span.children()) {
            if (child.isBlock()) {
                throw MalformedDocumentException.blockInsideSpan(span, child);
            }
        }
    }

    /**
     * Wraps rendered text in debug markers when debug mode is on. A closing marker goes before the
     * final newline, so removing the markers gives back the plain text.
     */
    private String emit(Node node, String body) {
        if (!settings.debug()) {
            return body;
        }
        String marker = (node.isBlock() ? "BLOCK:" : "SPAN:") + node.kind().tag() + ">";
        if (body.endsWith("\n")) {
            return "<" + marker + body.substring(0, body.length() - 1) + "</" + marker + "\n";
        }
        return "<" + marker + body + "</" + marker;
    }
}
