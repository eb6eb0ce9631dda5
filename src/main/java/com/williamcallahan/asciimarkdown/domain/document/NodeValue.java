package com.williamcallahan.asciimarkdown.domain.document;

import java.util.Objects;

/**
 * Kind-specific payload carried by a {@link Node}.
 */
public sealed interface NodeValue
    permits NodeValue.TextValue, NodeValue.HeaderMark, NodeValue.ItemMark,
        NodeValue.SymbolValue, NodeValue.QuoteValue {

    /**
     * Literal text: text runs, code, raw content, label and reference names.
     *
     * @param text literal content
     */
    record TextValue(String text) implements NodeValue {
        public TextValue {
            Objects.requireNonNull(text, "Text value cannot be null");
        }
    }

    /**
     * Section numbering of a header.
     *
     * @param level markdown heading level (1-6)
     * @param fullMark dotted section number such as {@code 2.1}
     */
    record HeaderMark(int level, String fullMark) implements NodeValue {
        public HeaderMark {
            Objects.requireNonNull(fullMark, "Header full mark cannot be null");
            if (level < 1) {
                throw new IllegalArgumentException("Header level must be positive");
            }
        }
    }

    /**
     * Ordinal of an ordered list item.
     *
     * @param mark the item's own ordinal, e.g. {@code b}
     * @param fullMark ordinals of all enclosing ordered items joined with dots, e.g. {@code 1.b}
     */
    record ItemMark(String mark, String fullMark) implements NodeValue {
        public ItemMark {
            Objects.requireNonNull(mark, "Item mark cannot be null");
            Objects.requireNonNull(fullMark, "Item full mark cannot be null");
        }
    }

    /**
     * Typographic symbol key.
     *
     * @param symbol symbol to approximate in ASCII
     */
    record SymbolValue(TypographicSymbol symbol) implements NodeValue {
        public SymbolValue {
            Objects.requireNonNull(symbol, "Symbol cannot be null");
        }
    }

    /**
     * Smart quote key.
     *
     * @param quote quote to approximate in ASCII
     */
    record QuoteValue(SmartQuote quote) implements NodeValue {
        public QuoteValue {
            Objects.requireNonNull(quote, "Quote cannot be null");
        }
    }
}
