package com.williamcallahan.asciimarkdown.service.markdown;

/**
 * Signals a failure while converting markdown to plain text.
 */
public class MarkdownProcessingException extends IllegalStateException {

    /**
     * Creates a markdown processing exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public MarkdownProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates a markdown processing exception without an underlying cause.
     *
     * @param message failure summary
     */
    public MarkdownProcessingException(String message) {
        super(message);
    }
}
