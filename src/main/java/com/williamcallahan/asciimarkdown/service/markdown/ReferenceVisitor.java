package com.williamcallahan.asciimarkdown.service.markdown;

import com.williamcallahan.asciimarkdown.domain.document.Node;
import com.williamcallahan.asciimarkdown.domain.document.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single pre-order pass that prepares a document for reference resolution.
 *
 * <p>The pass annotates every header and list item with its {@code relative_position} among
 * siblings of the same kind, records label definitions, and lists headers and items in document
 * order. A visitor instance is good for one document.</p>
 */
public class ReferenceVisitor {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceVisitor.class);

    private final Map<String, Node> labels = new LinkedHashMap<>();
    private final List<Node> headers = new ArrayList<>();
    private final List<Node> items = new ArrayList<>();
    private boolean used;

    /**
     * Traverses the document and builds the lookup tables.
     *
     * @param root document root
     * @return annotated tree and tables
     * @throws IllegalStateException when the visitor has already traversed a document
     */
    public ReferenceTables traverse(Node root) {
        if (used) {
            throw new IllegalStateException("ReferenceVisitor instances cannot be reused");
        }
        used = true;
        visit(root);
        logger.debug("Reference pass found {} headers, {} items, {} labels",
            headers.size(), items.size(), labels.size());
        return new ReferenceTables(root, labels, headers, items);
    }

    private void visit(Node node) {
        if (node.kind() == NodeKind.HEADER) {
            headers.add(node);
        } else if (node.kind() == NodeKind.LIST_ITEM) {
            items.add(node);
        } else if (node.kind() == NodeKind.LABEL) {
            captureLabel(node);
        }

        // positions are scoped to one parent, one counter per kind
        int headerPosition = 0;
        int itemPosition = 0;
        for (Node child : node.children()) {
            if (child.kind() == NodeKind.HEADER) {
                child.withOption(Node.OPTION_RELATIVE_POSITION, headerPosition++);
            } else if (child.kind() == NodeKind.LIST_ITEM) {
                child.withOption(Node.OPTION_RELATIVE_POSITION, itemPosition++);
            }
            visit(child);
        }
    }

    private void captureLabel(Node label) {
        String name = label.text();
        Optional<Node> anchor = ReferenceAnchors.nearestAnchor(label);
        if (name.isEmpty() || anchor.isEmpty()) {
            logger.debug("Ignoring label '{}' outside any header or list item", name);
            return;
        }
        Node previous = labels.put(name, anchor.get());
        if (previous != null && previous != anchor.get()) {
            logger.debug("Label '{}' redefined, later definition wins", name);
        }
    }
}
