package com.williamcallahan.asciimarkdown.service.markdown;

import com.williamcallahan.asciimarkdown.domain.document.Node;
import com.williamcallahan.asciimarkdown.domain.document.NodeKind;

import java.util.Optional;

/**
 * Finds the header or list item a label or relative reference belongs to.
 */
final class ReferenceAnchors {

    private ReferenceAnchors() {}

    /**
     * Returns the anchor of a node: its nearest header ancestor when it has one, otherwise its
     * nearest list-item ancestor. A header wins even when a list item is closer.
     *
     * @param node label or reference node
     * @return anchoring header or list item
     */
    static Optional<Node> nearestAnchor(Node node) {
        Optional<Node> header = node.findAncestor(NodeKind.HEADER);
        return header.isPresent() ? header : node.findAncestor(NodeKind.LIST_ITEM);
    }
}
