package com.williamcallahan.asciimarkdown.domain.markdown;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Accepts markdown input for plain-text rendering.
 */
public record MarkdownRenderRequest(String content) {

    /**
     * Creates a request while normalizing null content to an empty string.
     *
     * @param content markdown input text
     * @return normalized render request
     */
    @JsonCreator
    public static MarkdownRenderRequest create(@JsonProperty("content") String content) {
        return new MarkdownRenderRequest(content == null ? "" : content);
    }

    public MarkdownRenderRequest {
        Objects.requireNonNull(content, "Markdown content cannot be null");
    }

    public boolean isBlank() {
        return content.isBlank();
    }
}
