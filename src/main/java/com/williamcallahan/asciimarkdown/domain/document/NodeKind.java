package com.williamcallahan.asciimarkdown.domain.document;

/**
 * Closed set of node kinds produced by the markdown parser adapter.
 *
 * <p>Kinds whose category depends on where the parser found them (math, raw passthrough and
 * the HTML/XML kinds) declare {@code flexibleCategory}; their nodes may override the default.</p>
 */
public enum NodeKind {
    ROOT("root", Category.BLOCK),
    BLANK("blank", Category.BLOCK),
    PARAGRAPH("paragraph", Category.BLOCK),
    HEADER("header", Category.BLOCK),
    HORIZONTAL_RULE("horizontal-rule", Category.BLOCK),
    TABLE("table", Category.BLOCK),
    TABLE_ROW("table-row", Category.BLOCK),
    TABLE_CELL("table-cell", Category.BLOCK),
    TABLE_HEAD("table-head", Category.BLOCK),
    TABLE_BODY("table-body", Category.BLOCK),
    TABLE_FOOT("table-foot", Category.BLOCK),
    BLOCKQUOTE("blockquote", Category.BLOCK),
    CODEBLOCK("codeblock", Category.BLOCK),
    UNORDERED_LIST("unordered-list", Category.BLOCK),
    ORDERED_LIST("ordered-list", Category.BLOCK),
    LIST_ITEM("list-item", Category.BLOCK),
    DEFINITION_LIST("definition-list", Category.BLOCK),
    DEFINITION_TERM("definition-term", Category.BLOCK),
    DEFINITION_DESCRIPTION("definition-description", Category.BLOCK),
    TEXT("text", Category.SPAN),
    LINE_BREAK("line-break", Category.SPAN),
    EMPHASIS("emphasis", Category.SPAN),
    STRONG("strong", Category.SPAN),
    LINK("link", Category.SPAN),
    IMAGE("image", Category.SPAN),
    INLINE_CODE("inline-code", Category.SPAN),
    FOOTNOTE("footnote", Category.SPAN),
    RAW_PASSTHROUGH("raw-passthrough", Category.SPAN, true),
    EMPHASIS_ENTITY("emphasis-entity", Category.SPAN),
    TYPOGRAPHIC_SYMBOL("typographic-symbol", Category.SPAN),
    SMART_QUOTE("smart-quote", Category.SPAN),
    MATH("math", Category.SPAN, true),
    ABBREVIATION("abbreviation", Category.SPAN),
    REFERENCE("reference", Category.SPAN),
    LABEL("label", Category.SPAN),
    ACTION_ITEM("action-item", Category.SPAN),
    ISSUE_LINK("issue-link", Category.SPAN),
    RAW_HTML_ELEMENT("raw-html-element", Category.SPAN, true),
    XML_COMMENT("xml-comment", Category.SPAN, true),
    XML_PROCESSING_INSTRUCTION("xml-processing-instruction", Category.SPAN, true);

    private final String tag;
    private final Category defaultCategory;
    private final boolean flexibleCategory;

    NodeKind(String tag, Category defaultCategory) {
        this(tag, defaultCategory, false);
    }

    NodeKind(String tag, Category defaultCategory, boolean flexibleCategory) {
        this.tag = tag;
        this.defaultCategory = defaultCategory;
        this.flexibleCategory = flexibleCategory;
    }

    /**
     * Returns the stable lowercase name used in diagnostics output.
     *
     * @return kind tag such as {@code list-item}
     */
    public String tag() {
        return tag;
    }

    public Category defaultCategory() {
        return defaultCategory;
    }

    /**
     * Indicates whether nodes of this kind may be placed in either category.
     *
     * @return true for context-sensitive kinds
     */
    public boolean hasFlexibleCategory() {
        return flexibleCategory;
    }
}
