package com.williamcallahan.asciimarkdown.domain.markdown;

/**
 * Response variants of the plain-text rendering endpoint.
 */
public sealed interface AsciiRenderResponse permits AsciiRenderOutcome, MarkdownErrorResponse {
}
