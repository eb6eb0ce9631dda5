package com.williamcallahan.asciimarkdown.domain.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One element of a parsed markdown document.
 *
 * <p>A node owns its children exclusively: appending a node that already has a parent is
 * rejected, so the structure is always a tree. The parent link exists for ancestor queries made
 * while resolving references.</p>
 */
public final class Node {

    public static final String OPTION_RELATIVE_POSITION = "relative_position";
    public static final String OPTION_ASSIGNEE = "assignee";
    public static final String OPTION_MATCH = "match";

    public static final String ATTR_HREF = "href";
    public static final String ATTR_SRC = "src";
    public static final String ATTR_TITLE = "title";

    private final NodeKind kind;
    private final NodeValue value;
    private final List<Node> children = new ArrayList<>();
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final Map<String, Object> options = new LinkedHashMap<>();
    private Category category;
    private Node parent;

    private Node(NodeKind kind, NodeValue value) {
        this.kind = Objects.requireNonNull(kind, "Node kind cannot be null");
        this.value = value;
        this.category = kind.defaultCategory();
    }

    /**
     * Creates a structural node without payload.
     *
     * @param kind node kind
     * @return new detached node
     */
    public static Node of(NodeKind kind) {
        return new Node(kind, null);
    }

    /**
     * Creates a node carrying a payload.
     *
     * @param kind node kind
     * @param value kind-specific payload
     * @return new detached node
     */
    public static Node of(NodeKind kind, NodeValue value) {
        return new Node(kind, Objects.requireNonNull(value, "Node value cannot be null"));
    }

    /**
     * Creates a node whose payload is literal text.
     *
     * @param kind node kind
     * @param text literal content
     * @return new detached node
     */
    public static Node ofText(NodeKind kind, String text) {
        return new Node(kind, new NodeValue.TextValue(text));
    }

    public static Node text(String text) {
        return ofText(NodeKind.TEXT, text);
    }

    public NodeKind kind() {
        return kind;
    }

    public Category category() {
        return category;
    }

    /**
     * Places a context-sensitive node in the given category.
     *
     * @param category block or span
     * @return this node
     * @throws IllegalArgumentException when the kind has a fixed category that differs
     */
    public Node withCategory(Category category) {
        Objects.requireNonNull(category, "Category cannot be null");
        if (category != kind.defaultCategory() && !kind.hasFlexibleCategory()) {
            throw new IllegalArgumentException(kind.tag() + " nodes are always " + kind.defaultCategory());
        }
        this.category = category;
        return this;
    }

    public boolean isBlock() {
        return category == Category.BLOCK;
    }

    public Optional<NodeValue> value() {
        return Optional.ofNullable(value);
    }

    /**
     * Returns the literal text payload, or an empty string when the node carries none.
     *
     * @return text payload
     */
    public String text() {
        return value instanceof NodeValue.TextValue textValue ? textValue.text() : "";
    }

    /**
     * Returns the positional numbering of a header or ordered list item.
     *
     * @return full mark, empty for every other node
     */
    public Optional<String> fullMark() {
        if (value instanceof NodeValue.HeaderMark headerMark) {
            return Optional.of(headerMark.fullMark());
        }
        if (value instanceof NodeValue.ItemMark itemMark) {
            return Optional.of(itemMark.fullMark());
        }
        return Optional.empty();
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<Node> firstChild() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    /**
     * Appends a child, taking ownership of it.
     *
     * @param child detached node
     * @return this node
     * @throws IllegalArgumentException when the child already belongs to a tree
     */
    public Node appendChild(Node child) {
        Objects.requireNonNull(child, "Child cannot be null");
        if (child.parent != null) {
            throw new IllegalArgumentException("Node already has a parent: " + child.kind.tag());
        }
        if (child == this) {
            throw new IllegalArgumentException("Node cannot contain itself");
        }
        child.parent = this;
        children.add(child);
        return this;
    }

    public Node appendChildren(List<Node> newChildren) {
        newChildren.forEach(this::appendChild);
        return this;
    }

    public Optional<Node> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Finds the closest strict ancestor of the given kind.
     *
     * @param ancestorKind kind to look for
     * @return nearest matching ancestor
     */
    public Optional<Node> findAncestor(NodeKind ancestorKind) {
        for (Node current = parent; current != null; current = current.parent) {
            if (current.kind == ancestorKind) {
                return Optional.of(current);
            }
        }
        return Optional.empty();
    }

    public boolean hasAncestor(NodeKind ancestorKind) {
        return findAncestor(ancestorKind).isPresent();
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Node withAttribute(String name, String attributeValue) {
        attributes.put(Objects.requireNonNull(name), Objects.requireNonNull(attributeValue));
        return this;
    }

    public Optional<Object> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    /**
     * Returns a string option, or an empty string when it is absent.
     *
     * @param name option key
     * @return option value as text
     */
    public String optionText(String name) {
        Object optionValue = options.get(name);
        return optionValue == null ? "" : optionValue.toString();
    }

    public Node withOption(String name, Object optionValue) {
        options.put(Objects.requireNonNull(name), Objects.requireNonNull(optionValue));
        return this;
    }

    /**
     * Returns the position assigned by the reference pass.
     *
     * @return relative position, empty when the node was never classified
     */
    public OptionalInt relativePosition() {
        return options.get(OPTION_RELATIVE_POSITION) instanceof Integer position
            ? OptionalInt.of(position)
            : OptionalInt.empty();
    }

    @Override
    public String toString() {
        return "Node{" + kind.tag() + ", children=" + children.size() + "}";
    }
}
