package com.williamcallahan.asciimarkdown.web;

import com.williamcallahan.asciimarkdown.domain.markdown.AsciiRenderOutcome;
import com.williamcallahan.asciimarkdown.domain.markdown.AsciiRenderResponse;
import com.williamcallahan.asciimarkdown.domain.markdown.MarkdownCacheClearOutcome;
import com.williamcallahan.asciimarkdown.domain.markdown.MarkdownCacheClearResponse;
import com.williamcallahan.asciimarkdown.domain.markdown.MarkdownCacheStatsResponse;
import com.williamcallahan.asciimarkdown.domain.markdown.MarkdownCacheStatsSnapshot;
import com.williamcallahan.asciimarkdown.domain.markdown.MarkdownErrorResponse;
import com.williamcallahan.asciimarkdown.domain.markdown.MarkdownRenderRequest;
import com.williamcallahan.asciimarkdown.service.markdown.AsciiMarkdownService;
import com.williamcallahan.asciimarkdown.service.markdown.MarkdownProcessingException;
import com.williamcallahan.asciimarkdown.service.markdown.RenderedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for rendering markdown to fixed-width plain text.
 */
@RestController
@RequestMapping("/api/markdown/ascii")
public class MarkdownController {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownController.class);

    private final AsciiMarkdownService asciiMarkdownService;

    public MarkdownController(AsciiMarkdownService asciiMarkdownService) {
        this.asciiMarkdownService = asciiMarkdownService;
    }

    /**
     * Renders markdown to plain text. Results are cached server-side by markdown content.
     *
     * @param request A JSON object containing the markdown to render. Expected format:
     *                <pre>{@code
     *                  {
     *                    "content": "# Title\n\nSee [ref:intro]."
     *                  }
     *                }</pre>
     * @return the rendered text with document statistics, or an error body with status 500
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AsciiRenderResponse> renderAscii(@RequestBody MarkdownRenderRequest request) {
        if (request.isBlank()) {
            return ResponseEntity.ok(AsciiRenderOutcome.empty());
        }
        try {
            logger.debug("Rendering markdown of length: {}", request.content().length());
            RenderedDocument rendered = asciiMarkdownService.render(request.content());
            return ResponseEntity.ok(new AsciiRenderOutcome(
                rendered.text(),
                rendered.headers(),
                rendered.items(),
                rendered.unresolvedReferences(),
                rendered.processingTimeMs(),
                rendered.cached()
            ));
        } catch (MarkdownProcessingException e) {
            logger.error("Error rendering markdown to plain text", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new MarkdownErrorResponse("Failed to render markdown", e.getMessage()));
        }
    }

    /**
     * Retrieves hit, miss and eviction counts of the render cache.
     *
     * @return cache statistics
     */
    @GetMapping("/cache/stats")
    public ResponseEntity<MarkdownCacheStatsResponse> getCacheStats() {
        try {
            return ResponseEntity.ok(MarkdownCacheStatsSnapshot.from(
                asciiMarkdownService.getCacheStats(), asciiMarkdownService.getCacheSize()));
        } catch (RuntimeException e) {
            logger.error("Error getting cache stats", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new MarkdownErrorResponse("Failed to get cache stats", e.getMessage()));
        }
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<MarkdownCacheClearResponse> clearCache() {
        try {
            long removed = asciiMarkdownService.clearCache();
            logger.info("Plain-text render cache cleared via API");
            return ResponseEntity.ok(new MarkdownCacheClearOutcome("success", removed));
        } catch (RuntimeException e) {
            logger.error("Error clearing cache", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new MarkdownErrorResponse("Failed to clear cache", e.getMessage()));
        }
    }
}
