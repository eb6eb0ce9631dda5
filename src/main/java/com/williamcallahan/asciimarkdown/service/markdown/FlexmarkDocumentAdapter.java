package com.williamcallahan.asciimarkdown.service.markdown;

import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.Emphasis;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlock;
import com.vladsch.flexmark.ast.HtmlCommentBlock;
import com.vladsch.flexmark.ast.HtmlEntity;
import com.vladsch.flexmark.ast.HtmlInline;
import com.vladsch.flexmark.ast.HtmlInlineComment;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.ImageRef;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.Link;
import com.vladsch.flexmark.ast.LinkRef;
import com.vladsch.flexmark.ast.ListItem;
import com.vladsch.flexmark.ast.MailLink;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.Reference;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.ast.TextBase;
import com.vladsch.flexmark.ast.ThematicBreak;
import com.vladsch.flexmark.ext.abbreviation.Abbreviation;
import com.vladsch.flexmark.ext.abbreviation.AbbreviationBlock;
import com.vladsch.flexmark.ext.abbreviation.AbbreviationExtension;
import com.vladsch.flexmark.ext.autolink.AutolinkExtension;
import com.vladsch.flexmark.ext.definition.DefinitionExtension;
import com.vladsch.flexmark.ext.definition.DefinitionItem;
import com.vladsch.flexmark.ext.definition.DefinitionList;
import com.vladsch.flexmark.ext.definition.DefinitionTerm;
import com.vladsch.flexmark.ext.footnotes.Footnote;
import com.vladsch.flexmark.ext.footnotes.FootnoteBlock;
import com.vladsch.flexmark.ext.footnotes.FootnoteExtension;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TableBody;
import com.vladsch.flexmark.ext.tables.TableCaption;
import com.vladsch.flexmark.ext.tables.TableCell;
import com.vladsch.flexmark.ext.tables.TableHead;
import com.vladsch.flexmark.ext.tables.TableRow;
import com.vladsch.flexmark.ext.tables.TableSeparator;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.BlankLine;
import com.vladsch.flexmark.util.ast.Block;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.williamcallahan.asciimarkdown.domain.document.Category;
import com.williamcallahan.asciimarkdown.domain.document.Node;
import com.williamcallahan.asciimarkdown.domain.document.NodeKind;
import com.williamcallahan.asciimarkdown.domain.document.NodeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Locale;

/**
 * Parses markdown with flexmark and maps the flexmark AST onto the renderer's node taxonomy.
 *
 * <p>Besides the one-to-one mapping of node types, the adapter numbers headers (dotted section
 * counters relative to the shallowest heading level in the document) and ordered list items
 * (numbers, letters, roman numerals by nesting depth), joins soft line breaks, and hands text
 * runs to {@link InlineTokenizer} for references, labels, action items, issue links and
 * typographic characters.</p>
 */
public class FlexmarkDocumentAdapter {

    private static final Logger logger = LoggerFactory.getLogger(FlexmarkDocumentAdapter.class);

    private static final int MAX_HEADING_LEVEL = 6;

    private final Parser parser;

    public FlexmarkDocumentAdapter() {
        MutableDataSet options = new MutableDataSet()
            .set(Parser.EXTENSIONS, Arrays.asList(
                TablesExtension.create(),
                DefinitionExtension.create(),
                FootnoteExtension.create(),
                AbbreviationExtension.create(),
                AutolinkExtension.create()
            ))
            .set(Parser.BLANK_LINES_IN_AST, true)
            .set(Parser.HTML_BLOCK_DEEP_PARSER, false)
            .set(Parser.INDENTED_CODE_NO_TRAILING_BLANK_LINES, true)
            .set(TablesExtension.COLUMN_SPANS, false)
            .set(TablesExtension.APPEND_MISSING_COLUMNS, true)
            .set(TablesExtension.DISCARD_EXTRA_COLUMNS, true);
        this.parser = Parser.builder(options).build();
    }

    /**
     * Parses markdown into a document tree.
     *
     * @param markdown markdown source, null is treated as empty
     * @return root node of the converted tree
     */
    public Node parse(String markdown) {
        Document document = parser.parse(markdown == null ? "" : markdown);
        return adapt(document);
    }

    /**
     * Converts an already parsed flexmark document.
     *
     * @param document flexmark document
     * @return root node of the converted tree
     */
    public Node adapt(Document document) {
        return new Conversion(shallowestHeadingLevel(document)).convert(document);
    }

    private static int shallowestHeadingLevel(com.vladsch.flexmark.util.ast.Node root) {
        int shallowest = MAX_HEADING_LEVEL;
        for (com.vladsch.flexmark.util.ast.Node descendant : root.getDescendants()) {
            if (descendant instanceof Heading heading) {
                shallowest = Math.min(shallowest, heading.getLevel());
            }
        }
        return shallowest;
    }

    /**
     * State of converting one document: section counters and the marks of the ordered list items
     * currently open.
     */
    private static final class Conversion {
        private final int baseLevel;
        private final int[] sectionCounters = new int[MAX_HEADING_LEVEL + 1];
        private int openSectionDepth;
        private final Deque<String> openItemMarks = new ArrayDeque<>();
        private int orderedDepth;

        Conversion(int baseLevel) {
            this.baseLevel = baseLevel;
        }

        Node convert(Document document) {
            Node root = Node.of(NodeKind.ROOT);
            appendChildren(document, root);
            return root;
        }

        private void appendChildren(com.vladsch.flexmark.util.ast.Node source, Node target) {
            StringBuilder textRun = new StringBuilder();
            appendRun(source, target, textRun);
            flushText(textRun, target);
        }

        // TextBase only groups inline nodes, so its children continue the surrounding text run
        private void appendRun(com.vladsch.flexmark.util.ast.Node source, Node target, StringBuilder textRun) {
            for (com.vladsch.flexmark.util.ast.Node child = source.getFirstChild(); child != null; child = child.getNext()) {
                if (child instanceof TextBase) {
                    appendRun(child, target, textRun);
                } else if (isTextLike(child)) {
                    textRun.append(child instanceof SoftLineBreak ? "\n" : child.getChars().unescape());
                } else {
                    flushText(textRun, target);
                    appendNode(child, target);
                }
            }
        }

        private boolean isTextLike(com.vladsch.flexmark.util.ast.Node node) {
            return node instanceof Text
                || node instanceof SoftLineBreak
                || node instanceof LinkRef linkRef && !linkRef.isDefined()
                || node instanceof ImageRef imageRef && !imageRef.isDefined();
        }

        private void flushText(StringBuilder textRun, Node target) {
            if (textRun.length() == 0) {
                return;
            }
            target.appendChildren(InlineTokenizer.tokenize(joinSoftBreaks(textRun.toString())));
            textRun.setLength(0);
        }

        private void appendNode(com.vladsch.flexmark.util.ast.Node node, Node target) {
            if (appendBlock(node, target) || appendInline(node, target)) {
                return;
            }
            logger.debug("Unmapped {} {}, keeping its children",
                node instanceof Block ? "block" : "inline", node.getNodeName());
            appendChildren(node, target);
        }

        private boolean appendBlock(com.vladsch.flexmark.util.ast.Node node, Node target) {
            if (node instanceof Paragraph) {
                target.appendChild(withChildren(node, Node.of(NodeKind.PARAGRAPH)));
            } else if (node instanceof BlankLine) {
                target.appendChild(Node.of(NodeKind.BLANK));
            } else if (node instanceof Heading heading) {
                target.appendChild(withChildren(node, Node.of(NodeKind.HEADER, headerMark(heading.getLevel()))));
            } else if (node instanceof ThematicBreak) {
                target.appendChild(Node.of(NodeKind.HORIZONTAL_RULE));
            } else if (node instanceof BlockQuote) {
                target.appendChild(withChildren(node, Node.of(NodeKind.BLOCKQUOTE)));
            } else if (node instanceof FencedCodeBlock fenced) {
                target.appendChild(Node.ofText(NodeKind.CODEBLOCK, fenced.getContentChars().toString()));
            } else if (node instanceof IndentedCodeBlock indented) {
                target.appendChild(Node.ofText(NodeKind.CODEBLOCK, indented.getContentChars().toString()));
            } else if (node instanceof DefinitionList) {
                // the definition classes extend flexmark's list classes, so they go first
                target.appendChild(withChildren(node, Node.of(NodeKind.DEFINITION_LIST)));
            } else if (node instanceof DefinitionTerm) {
                target.appendChild(withChildren(node, Node.of(NodeKind.DEFINITION_TERM)));
            } else if (node instanceof DefinitionItem) {
                target.appendChild(withChildren(node, Node.of(NodeKind.DEFINITION_DESCRIPTION)));
            } else if (node instanceof BulletList) {
                target.appendChild(withChildren(node, Node.of(NodeKind.UNORDERED_LIST)));
            } else if (node instanceof OrderedList ordered) {
                target.appendChild(orderedList(ordered));
            } else if (node instanceof ListItem) {
                target.appendChild(withChildren(node, Node.of(NodeKind.LIST_ITEM)));
            } else if (node instanceof HtmlCommentBlock) {
                target.appendChild(Node.ofText(NodeKind.XML_COMMENT, node.getChars().toString()).withCategory(Category.BLOCK));
            } else if (node instanceof HtmlBlock) {
                target.appendChild(htmlNode(node.getChars().toString()).withCategory(Category.BLOCK));
            } else if (node instanceof TableBlock) {
                target.appendChild(withChildren(node, Node.of(NodeKind.TABLE)));
            } else if (node instanceof TableHead) {
                target.appendChild(withChildren(node, Node.of(NodeKind.TABLE_HEAD)));
            } else if (node instanceof TableBody) {
                target.appendChild(withChildren(node, Node.of(NodeKind.TABLE_BODY)));
            } else if (node instanceof TableRow) {
                target.appendChild(withChildren(node, Node.of(NodeKind.TABLE_ROW)));
            } else if (node instanceof TableCell) {
                target.appendChild(withChildren(node, Node.of(NodeKind.TABLE_CELL)));
            } else if (node instanceof TableCaption) {
                target.appendChild(withChildren(node, Node.of(NodeKind.PARAGRAPH)));
            } else if (node instanceof TableSeparator || node instanceof Reference
                || node instanceof FootnoteBlock || node instanceof AbbreviationBlock) {
                // definitions and table delimiter rows have no text of their own
                return true;
            } else {
                return false;
            }
            return true;
        }

        private boolean appendInline(com.vladsch.flexmark.util.ast.Node node, Node target) {
            if (node instanceof Emphasis) {
                target.appendChild(withChildren(node, Node.of(NodeKind.EMPHASIS)));
            } else if (node instanceof StrongEmphasis) {
                target.appendChild(withChildren(node, Node.of(NodeKind.STRONG)));
            } else if (node instanceof HardLineBreak) {
                target.appendChild(Node.of(NodeKind.LINE_BREAK));
            } else if (node instanceof Code code) {
                target.appendChild(Node.ofText(NodeKind.INLINE_CODE, code.getText().toString()));
            } else if (node instanceof Link link) {
                target.appendChild(link(node, link.getUrl().toString(), link.getTitle().toString()));
            } else if (node instanceof LinkRef linkRef) {
                target.appendChild(link(node, linkRef.getReference().unescape(), ""));
            } else if (node instanceof AutoLink autoLink) {
                target.appendChild(Node.of(NodeKind.LINK)
                    .withAttribute(Node.ATTR_HREF, autoLink.getUrl().toString())
                    .appendChild(Node.text(autoLink.getText().toString())));
            } else if (node instanceof MailLink mailLink) {
                target.appendChild(Node.of(NodeKind.LINK)
                    .withAttribute(Node.ATTR_HREF, "mailto:" + mailLink.getText())
                    .appendChild(Node.text(mailLink.getText().toString())));
            } else if (node instanceof Image image) {
                target.appendChild(Node.of(NodeKind.IMAGE).withAttribute(Node.ATTR_SRC, image.getUrl().toString()));
            } else if (node instanceof ImageRef imageRef) {
                target.appendChild(Node.of(NodeKind.IMAGE).withAttribute(Node.ATTR_SRC, imageRef.getReference().unescape()));
            } else if (node instanceof HtmlEntity) {
                target.appendChild(Node.ofText(NodeKind.EMPHASIS_ENTITY,
                    org.jsoup.parser.Parser.unescapeEntities(node.getChars().toString(), false)));
            } else if (node instanceof HtmlInlineComment) {
                target.appendChild(Node.ofText(NodeKind.XML_COMMENT, node.getChars().toString()));
            } else if (node instanceof HtmlInline) {
                target.appendChild(htmlNode(node.getChars().toString()));
            } else if (node instanceof Footnote) {
                target.appendChild(Node.ofText(NodeKind.FOOTNOTE, node.getChars().toString()));
            } else if (node instanceof Abbreviation) {
                target.appendChild(Node.ofText(NodeKind.ABBREVIATION, node.getChars().toString()));
            } else {
                return false;
            }
            return true;
        }

        private Node withChildren(com.vladsch.flexmark.util.ast.Node source, Node target) {
            appendChildren(source, target);
            return target;
        }

        private Node link(com.vladsch.flexmark.util.ast.Node source, String href, String title) {
            Node link = withChildren(source, Node.of(NodeKind.LINK).withAttribute(Node.ATTR_HREF, href));
            if (!title.isEmpty()) {
                link.withAttribute(Node.ATTR_TITLE, title);
            }
            return link;
        }

        private Node orderedList(OrderedList ordered) {
            Node list = Node.of(NodeKind.ORDERED_LIST);
            OrdinalStyle style = OrdinalStyle.forDepth(orderedDepth);
            int ordinal = ordered.getStartNumber();
            orderedDepth++;
            try {
                for (com.vladsch.flexmark.util.ast.Node child = ordered.getFirstChild(); child != null; child = child.getNext()) {
                    if (!(child instanceof ListItem)) {
                        appendNode(child, list);
                        continue;
                    }
                    String mark = style.format(ordinal++);
                    String fullMark = openItemMarks.isEmpty() ? mark : openItemMarks.peek() + "." + mark;
                    openItemMarks.push(fullMark);
                    try {
                        list.appendChild(withChildren(child, Node.of(NodeKind.LIST_ITEM, new NodeValue.ItemMark(mark, fullMark))));
                    } finally {
                        openItemMarks.pop();
                    }
                }
            } finally {
                orderedDepth--;
            }
            return list;
        }

        private NodeValue.HeaderMark headerMark(int level) {
            // a skipped level nests one section deeper than the open one
            int depth = Math.min(Math.max(1, level - baseLevel + 1), openSectionDepth + 1);
            openSectionDepth = depth;
            sectionCounters[depth]++;
            Arrays.fill(sectionCounters, depth + 1, sectionCounters.length, 0);
            StringBuilder fullMark = new StringBuilder();
            for (int index = 1; index <= depth; index++) {
                if (index > 1) {
                    fullMark.append('.');
                }
                fullMark.append(sectionCounters[index]);
            }
            return new NodeValue.HeaderMark(level, fullMark.toString());
        }

        private static Node htmlNode(String html) {
            String trimmed = html.stripLeading().toLowerCase(Locale.ROOT);
            if (trimmed.startsWith("<!--")) {
                return Node.ofText(NodeKind.XML_COMMENT, html);
            }
            if (trimmed.startsWith("<?")) {
                return Node.ofText(NodeKind.XML_PROCESSING_INSTRUCTION, html);
            }
            return Node.ofText(NodeKind.RAW_HTML_ELEMENT, html);
        }
    }

    /**
     * Joins soft line breaks: two wide characters (CJK text) are joined directly, anything else
     * gets a single space. Spaces around the break are dropped.
     */
    static String joinSoftBreaks(String text) {
        if (text.indexOf('\n') < 0) {
            return text;
        }
        StringBuilder joined = new StringBuilder(text.length());
        String[] lines = text.split("\n", -1);
        for (int index = 0; index < lines.length; index++) {
            String line = index == 0 ? lines[index] : lines[index].stripLeading();
            if (index < lines.length - 1) {
                line = line.stripTrailing();
            }
            if (index > 0 && joined.length() > 0 && !line.isEmpty()) {
                int previous = joined.codePointBefore(joined.length());
                int next = line.codePointAt(0);
                if (DisplayWidth.of(previous) == 1 || DisplayWidth.of(next) == 1) {
                    joined.append(' ');
                }
            }
            joined.append(line);
        }
        return joined.toString();
    }
}
