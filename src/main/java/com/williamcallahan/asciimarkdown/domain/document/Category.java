package com.williamcallahan.asciimarkdown.domain.document;

/**
 * Layout category of a node: blocks start their own indented region, spans flow into the
 * current line of the nearest enclosing block.
 */
public enum Category {
    BLOCK,
    SPAN
}
