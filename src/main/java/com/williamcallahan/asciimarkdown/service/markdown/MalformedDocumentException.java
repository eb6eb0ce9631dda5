package com.williamcallahan.asciimarkdown.service.markdown;

import com.williamcallahan.asciimarkdown.domain.document.Node;

/**
 * Raised when a document tree breaks a structural invariant the renderer relies on, such as a
 * span node holding a block child.
 */
public class MalformedDocumentException extends MarkdownProcessingException {

    /**
     * Creates the exception for a span node that contains a block node.
     *
     * @param span the offending span node
     * @param block its block child
     * @return exception describing both kinds
     */
    static MalformedDocumentException blockInsideSpan(Node span, Node block) {
        return new MalformedDocumentException(
            "Span node '" + span.kind().tag() + "' cannot contain block node '" + block.kind().tag() + "'");
    }

    public MalformedDocumentException(String message) {
        super(message);
    }
}
