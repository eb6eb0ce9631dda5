package com.williamcallahan.asciimarkdown.service.markdown;

import com.williamcallahan.asciimarkdown.domain.document.Node;
import com.williamcallahan.asciimarkdown.domain.document.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns reference nodes into literal text such as {@code (2.1)}.
 *
 * <p>A reference names either a label or a relative offset: a run of {@code +} moves forward
 * and a run of {@code -} moves backward by the run length, counted from the reference's anchor
 * (see {@link ReferenceAnchors#nearestAnchor}). Anything that cannot be resolved becomes
 * {@value #UNRESOLVED}; resolution never throws.</p>
 */
public class ReferenceResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

    static final String UNRESOLVED = "(???)";
    private static final Pattern RELATIVE_OFFSET = Pattern.compile("^(\\++|-+)$");

    private final ReferenceTables tables;
    private int unresolvedCount;

    public ReferenceResolver(ReferenceTables tables) {
        this.tables = Objects.requireNonNull(tables, "Reference tables cannot be null");
    }

    /**
     * Resolves one reference node.
     *
     * @param reference node of kind {@link NodeKind#REFERENCE}
     * @return parenthesised full mark of the target, or the unresolved placeholder
     */
    public String resolve(Node reference) {
        String expression = reference.text();
        Optional<String> mark = tables.labelTarget(expression)
            .flatMap(Node::fullMark)
            .or(() -> resolveRelative(reference, expression));
        if (mark.isPresent()) {
            return "(" + mark.get() + ")";
        }
        unresolvedCount++;
        logger.debug("Unresolved reference '{}'", expression);
        return UNRESOLVED;
    }

    /**
     * Returns how many references resolved to the placeholder so far.
     *
     * @return unresolved reference count
     */
    public int unresolvedCount() {
        return unresolvedCount;
    }

    private Optional<String> resolveRelative(Node reference, String expression) {
        Matcher matcher = RELATIVE_OFFSET.matcher(expression);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String run = matcher.group(1);
        int offset = run.charAt(0) == '+' ? run.length() : -run.length();

        Optional<Node> anchor = ReferenceAnchors.nearestAnchor(reference);
        if (anchor.isEmpty()) {
            return Optional.empty();
        }
        OptionalInt position = anchor.get().relativePosition();
        if (position.isEmpty()) {
            return Optional.empty();
        }
        int index = position.getAsInt() + offset;
        Optional<Node> target = anchor.get().kind() == NodeKind.HEADER
            ? tables.header(index)
            : tables.item(index);
        return target.flatMap(Node::fullMark);
    }
}
