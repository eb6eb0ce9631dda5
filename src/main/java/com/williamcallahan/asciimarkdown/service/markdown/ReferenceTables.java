package com.williamcallahan.asciimarkdown.service.markdown;

import com.williamcallahan.asciimarkdown.domain.document.Node;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookup tables produced by the reference pass, read-only once built.
 *
 * @param root the annotated document tree
 * @param labels label name to the header or list item it names
 * @param headers headers in document order
 * @param items list items in document order
 */
public record ReferenceTables(Node root, Map<String, Node> labels, List<Node> headers, List<Node> items) {

    public ReferenceTables {
        Objects.requireNonNull(root, "Root cannot be null");
        labels = Map.copyOf(labels);
        headers = List.copyOf(headers);
        items = List.copyOf(items);
    }

    public Optional<Node> labelTarget(String label) {
        return Optional.ofNullable(labels.get(label));
    }

    /**
     * Returns the header at a table index.
     *
     * @param index zero-based index
     * @return header, empty when out of range
     */
    public Optional<Node> header(int index) {
        return index >= 0 && index < headers.size() ? Optional.of(headers.get(index)) : Optional.empty();
    }

    /**
     * Returns the list item at a table index.
     *
     * @param index zero-based index
     * @return list item, empty when out of range
     */
    public Optional<Node> item(int index) {
        return index >= 0 && index < items.size() ? Optional.of(items.get(index)) : Optional.empty();
    }
}
